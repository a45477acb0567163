package org.lsst.pipe.photocal.fit;

import java.util.List;
import org.lsst.pipe.photocal.catalog.ReferenceRecord;

/**
 * Computes the magnitude of a reference star on the system being calibrated.
 *
 * @author tonyj
 */
public interface ReferenceMagnitudes {

    /**
     * The reference catalog flux fields consulted, primary first.
     */
    List<String> getFluxFields();

    /**
     * The reference magnitude, or NaN if the reference fluxes needed are not
     * finite and positive.
     */
    double magnitude(ReferenceRecord reference);

    /**
     * The error on {@link #magnitude(ReferenceRecord)}, or NaN if the
     * catalog carries no flux errors.
     */
    double magnitudeError(ReferenceRecord reference);
}
