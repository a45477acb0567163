package org.lsst.pipe.photocal.match;

import java.io.IOException;
import org.lsst.pipe.photocal.Exposure;
import org.lsst.pipe.photocal.catalog.ReferenceCatalog;

/**
 * Loads the reference stars overlapping an exposure.
 *
 * @author tonyj
 */
public interface ReferenceObjectLoader {

    ReferenceCatalog load(Exposure exposure) throws IOException;
}
