package org.lsst.pipe.photocal.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A catalog row: a numeric id plus named floating point fields, named
 * integer fields and named boolean flags. Integer fields are kept as
 * <code>long</code> so that 64 bit identifiers survive exactly, and also read
 * as doubles through {@link #get(String)}.
 *
 * @author tonyj
 */
public abstract class Record {

    private final long id;
    private final Map<String, Double> fields;
    private final Map<String, Long> longFields;
    private final Map<String, Boolean> flags;

    protected Record(long id, Map<String, Double> fields, Map<String, Boolean> flags) {
        this(id, fields, Collections.emptyMap(), flags);
    }

    protected Record(long id, Map<String, Double> fields, Map<String, Long> longFields, Map<String, Boolean> flags) {
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.longFields = Collections.unmodifiableMap(new LinkedHashMap<>(longFields));
        this.flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public long getId() {
        return id;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name) || longFields.containsKey(name);
    }

    public boolean hasLongField(String name) {
        return longFields.containsKey(name);
    }

    /**
     * Get the exact value of an integer field.
     *
     * @param name The field name
     * @return The value
     * @throws IllegalArgumentException If the record has no such integer field
     */
    public long getLong(String name) {
        Long value = longFields.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No integer field " + name + " in record " + id);
        }
        return value;
    }

    /**
     * Get the value of a numeric field.
     *
     * @param name The field name
     * @return The value
     * @throws IllegalArgumentException If the record has no such field
     */
    public double get(String name) {
        Double value = value(name);
        if (value == null) {
            throw new IllegalArgumentException("No field " + name + " in record " + id);
        }
        return value;
    }

    public double get(String name, double defaultValue) {
        Double value = value(name);
        return value == null ? defaultValue : value;
    }

    private Double value(String name) {
        Double value = fields.get(name);
        if (value == null) {
            Long longValue = longFields.get(name);
            if (longValue != null) {
                value = longValue.doubleValue();
            }
        }
        return value;
    }

    public boolean hasFlag(String name) {
        return flags.containsKey(name);
    }

    /**
     * Get a boolean flag. Flags which are not present read as false.
     *
     * @param name The flag name
     * @return The flag value
     */
    public boolean getFlag(String name) {
        return flags.getOrDefault(name, Boolean.FALSE);
    }

    public Map<String, Double> getFields() {
        return fields;
    }

    public Map<String, Long> getLongFields() {
        return longFields;
    }

    public Map<String, Boolean> getFlags() {
        return flags;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + "id=" + id + ", fields=" + fields + '}';
    }
}
