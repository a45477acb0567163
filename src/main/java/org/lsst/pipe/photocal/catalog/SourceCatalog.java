package org.lsst.pipe.photocal.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered catalog of detected sources. The catalog is the one piece of
 * mutable state shared with the calibration: it owns the photometry flags of
 * its rows. It is not thread safe, callers must serialize calibrations run
 * against the same catalog.
 *
 * @author tonyj
 */
public class SourceCatalog implements Iterable<SourceRecord> {

    private final List<SourceRecord> records;
    private final Map<Long, SourceRecord> byId;

    public SourceCatalog(List<SourceRecord> records) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.byId = new LinkedHashMap<>();
        for (SourceRecord record : records) {
            if (byId.put(record.getId(), record) != null) {
                throw new IllegalArgumentException("Duplicate source id " + record.getId());
            }
        }
    }

    public int size() {
        return records.size();
    }

    public SourceRecord get(int index) {
        return records.get(index);
    }

    public SourceRecord find(long id) {
        return byId.get(id);
    }

    public List<SourceRecord> getRecords() {
        return records;
    }

    @Override
    public Iterator<SourceRecord> iterator() {
        return records.iterator();
    }

    public void resetPhotometryFlags() {
        for (SourceRecord record : records) {
            record.setPhotometryFlags(PhotometryFlags.NONE);
        }
    }

    /**
     * Replace the photometry flags of this catalog. All rows are first reset,
     * so flags left by an earlier calibration never accumulate.
     *
     * @param updates The flags to write
     * @throws IllegalArgumentException If an update refers to a source not in
     * this catalog, in which case no flags are modified
     */
    public void applyFlagUpdates(Collection<FlagUpdate> updates) {
        for (FlagUpdate update : updates) {
            if (!byId.containsKey(update.getSourceId())) {
                throw new IllegalArgumentException("Source " + update.getSourceId() + " is not in catalog");
            }
        }
        resetPhotometryFlags();
        for (FlagUpdate update : updates) {
            byId.get(update.getSourceId()).setPhotometryFlags(update.getFlags());
        }
    }

    public int count(PhotometryFlag flag) {
        int count = 0;
        for (SourceRecord record : records) {
            if (record.get(flag)) {
                count++;
            }
        }
        return count;
    }
}
