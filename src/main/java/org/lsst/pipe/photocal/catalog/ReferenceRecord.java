package org.lsst.pipe.photocal.catalog;

import java.util.Collections;
import java.util.Map;

/**
 * A reference star. Fluxes are AB fluxes in Jansky, stored in fields named
 * <code>&lt;filter&gt;_flux</code> with errors in
 * <code>&lt;filter&gt;_fluxSigma</code>.
 *
 * @author tonyj
 */
public class ReferenceRecord extends Record {

    public static final String RESOLVED_FLAG = "resolved";
    public static final String VARIABLE_FLAG = "variable";

    public ReferenceRecord(long id, Map<String, Double> fields) {
        this(id, fields, Collections.emptyMap());
    }

    public ReferenceRecord(long id, Map<String, Double> fields, Map<String, Boolean> flags) {
        super(id, fields, flags);
    }

    public ReferenceRecord(long id, Map<String, Double> fields, Map<String, Long> longFields, Map<String, Boolean> flags) {
        super(id, fields, longFields, flags);
    }

    public boolean isResolved() {
        return getFlag(RESOLVED_FLAG);
    }

    public boolean isVariable() {
        return getFlag(VARIABLE_FLAG);
    }
}
