package org.lsst.pipe.photocal.match;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.pipe.photocal.Exposure;
import org.lsst.pipe.photocal.catalog.MatchedPair;
import org.lsst.pipe.photocal.catalog.ReferenceCatalog;
import org.lsst.pipe.photocal.catalog.ReferenceRecord;
import org.lsst.pipe.photocal.catalog.SourceCatalog;
import org.lsst.pipe.photocal.catalog.SourceRecord;

/**
 * Pairs sources with reference stars through a reference id already recorded
 * in the source catalog, for catalogs matched upstream. Sources without the id
 * field, or whose id is not in the reference catalog, are left unmatched.
 *
 * @author tonyj
 */
public class CatalogIdMatcher implements SourceMatcher {

    public static final String DEFAULT_REF_ID_FIELD = "refId";

    private static final Logger LOG = Logger.getLogger(CatalogIdMatcher.class.getName());
    // 2^53, above which doubles no longer hold every integer
    private static final double MAX_EXACT_DOUBLE = 9007199254740992.0;

    private final String refIdField;

    public CatalogIdMatcher() {
        this(DEFAULT_REF_ID_FIELD);
    }

    public CatalogIdMatcher(String refIdField) {
        this.refIdField = refIdField;
    }

    @Override
    public List<MatchedPair> match(SourceCatalog sources, ReferenceCatalog references, Exposure exposure) {
        Map<Long, ReferenceRecord> byId = new HashMap<>();
        for (ReferenceRecord reference : references) {
            byId.put(reference.getId(), reference);
        }
        List<MatchedPair> result = new ArrayList<>();
        for (SourceRecord source : sources) {
            Long refId = refId(source);
            if (refId == null) {
                continue;
            }
            ReferenceRecord reference = byId.get(refId);
            if (reference != null) {
                result.add(new MatchedPair(reference, source, 0.0));
            }
        }
        LOG.log(Level.FINE, "Matched {0} of {1} sources for {2}", new Object[]{result.size(), sources.size(), exposure});
        return result;
    }

    /**
     * The reference id of a source, exact from an integer field. A floating
     * point field is only trusted where it holds an integer that a double
     * represents exactly.
     */
    private Long refId(SourceRecord source) {
        if (source.hasLongField(refIdField)) {
            return source.getLong(refIdField);
        }
        double value = source.get(refIdField, Double.NaN);
        if (Double.isNaN(value)) {
            return null;
        }
        if (value != Math.rint(value) || Math.abs(value) > MAX_EXACT_DOUBLE) {
            LOG.log(Level.FINE, "Ignoring inexact {0} = {1} of source {2}", new Object[]{refIdField, value, source.getId()});
            return null;
        }
        return (long) value;
    }
}
