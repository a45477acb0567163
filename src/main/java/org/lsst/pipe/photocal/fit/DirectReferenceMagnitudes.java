package org.lsst.pipe.photocal.fit;

import java.util.Collections;
import java.util.List;
import org.lsst.pipe.photocal.catalog.ReferenceRecord;

/**
 * Reference magnitudes taken directly from a single flux field.
 *
 * @author tonyj
 */
public class DirectReferenceMagnitudes implements ReferenceMagnitudes {

    private final String fluxField;
    private final String fluxErrField;

    public DirectReferenceMagnitudes(String fluxField) {
        this.fluxField = fluxField;
        this.fluxErrField = fluxField + "Sigma";
    }

    @Override
    public List<String> getFluxFields() {
        return Collections.singletonList(fluxField);
    }

    @Override
    public double magnitude(ReferenceRecord reference) {
        double flux = reference.get(fluxField, Double.NaN);
        return Magnitudes.isPositive(flux) ? Magnitudes.abMagFromFlux(flux) : Double.NaN;
    }

    @Override
    public double magnitudeError(ReferenceRecord reference) {
        return Magnitudes.magErrFromFluxErr(reference.get(fluxField, Double.NaN), reference.get(fluxErrField, Double.NaN));
    }
}
