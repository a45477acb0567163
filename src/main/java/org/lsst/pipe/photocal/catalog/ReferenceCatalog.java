package org.lsst.pipe.photocal.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A catalog of reference stars.
 *
 * @author tonyj
 */
public class ReferenceCatalog implements Iterable<ReferenceRecord> {

    private final List<ReferenceRecord> records;
    private final Set<String> fieldNames;

    public ReferenceCatalog(List<ReferenceRecord> records) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        Set<String> names = new LinkedHashSet<>();
        for (ReferenceRecord record : records) {
            names.addAll(record.getFields().keySet());
        }
        this.fieldNames = Collections.unmodifiableSet(names);
    }

    public int size() {
        return records.size();
    }

    public ReferenceRecord get(int index) {
        return records.get(index);
    }

    public List<ReferenceRecord> getRecords() {
        return records;
    }

    @Override
    public Iterator<ReferenceRecord> iterator() {
        return records.iterator();
    }

    public boolean hasField(String name) {
        return fieldNames.contains(name);
    }

    public Set<String> getFieldNames() {
        return fieldNames;
    }

    /**
     * The native flux fields of this catalog, those ending in
     * <code>_flux</code> or <code>_camFlux</code>.
     *
     * @return The flux field names in schema order
     */
    public List<String> getFluxFieldNames() {
        return fieldNames.stream()
                .filter(name -> name.endsWith("_flux") || name.endsWith("_camFlux"))
                .collect(Collectors.toList());
    }
}
