package org.lsst.pipe.photocal.match;

import java.util.List;
import org.lsst.pipe.photocal.Exposure;
import org.lsst.pipe.photocal.catalog.MatchedPair;
import org.lsst.pipe.photocal.catalog.ReferenceCatalog;
import org.lsst.pipe.photocal.catalog.SourceCatalog;

/**
 * Matches detected sources to reference stars. The distance metric and match
 * radius are the matcher's business.
 *
 * @author tonyj
 */
public interface SourceMatcher {

    List<MatchedPair> match(SourceCatalog sources, ReferenceCatalog references, Exposure exposure);
}
