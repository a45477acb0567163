package org.lsst.pipe.photocal;

import java.awt.Rectangle;
import java.util.Objects;

/**
 * The parts of an exposure the calibration needs: its id (used to seed the
 * reserve selection), its filter and its pixel bounding box (passed on to the
 * reference loader).
 *
 * @author tonyj
 */
public final class Exposure {

    private final long id;
    private final String filterName;
    private final Rectangle bbox;

    public Exposure(long id, String filterName, Rectangle bbox) {
        this.id = id;
        this.filterName = Objects.requireNonNull(filterName, "filterName");
        this.bbox = new Rectangle(Objects.requireNonNull(bbox, "bbox"));
    }

    public long getId() {
        return id;
    }

    public String getFilterName() {
        return filterName;
    }

    public Rectangle getBBox() {
        return new Rectangle(bbox);
    }

    @Override
    public String toString() {
        return "Exposure{" + "id=" + id + ", filterName=" + filterName + ", bbox=" + bbox + '}';
    }
}
