package org.lsst.pipe.photocal.fit;

import java.util.Arrays;
import java.util.List;
import org.lsst.pipe.photocal.catalog.ReferenceRecord;
import org.lsst.pipe.photocal.colorterm.Colorterm;

/**
 * Reference magnitudes corrected with a color term from the primary and
 * secondary filter fluxes.
 *
 * @author tonyj
 */
public class ColorCorrectedReferenceMagnitudes implements ReferenceMagnitudes {

    private final Colorterm colorterm;
    private final String primaryFluxField;
    private final String secondaryFluxField;

    public ColorCorrectedReferenceMagnitudes(Colorterm colorterm, String primaryFluxField, String secondaryFluxField) {
        this.colorterm = colorterm;
        this.primaryFluxField = primaryFluxField;
        this.secondaryFluxField = secondaryFluxField;
    }

    public Colorterm getColorterm() {
        return colorterm;
    }

    @Override
    public List<String> getFluxFields() {
        return Arrays.asList(primaryFluxField, secondaryFluxField);
    }

    @Override
    public double magnitude(ReferenceRecord reference) {
        double primaryFlux = reference.get(primaryFluxField, Double.NaN);
        double secondaryFlux = reference.get(secondaryFluxField, Double.NaN);
        if (!Magnitudes.isPositive(primaryFlux) || !Magnitudes.isPositive(secondaryFlux)) {
            return Double.NaN;
        }
        double corrected = colorterm.transformMags(Magnitudes.abMagFromFlux(primaryFlux), Magnitudes.abMagFromFlux(secondaryFlux));
        // A corrected magnitude must still correspond to a finite positive flux
        return Magnitudes.isPositive(Magnitudes.fluxFromABMag(corrected)) ? corrected : Double.NaN;
    }

    @Override
    public double magnitudeError(ReferenceRecord reference) {
        double primaryFlux = reference.get(primaryFluxField, Double.NaN);
        double secondaryFlux = reference.get(secondaryFluxField, Double.NaN);
        double primaryErr = Magnitudes.magErrFromFluxErr(primaryFlux, reference.get(primaryFluxField + "Sigma", Double.NaN));
        double secondaryErr = Magnitudes.magErrFromFluxErr(secondaryFlux, reference.get(secondaryFluxField + "Sigma", Double.NaN));
        return colorterm.propagateMagErrors(Magnitudes.abMagFromFlux(primaryFlux), Magnitudes.abMagFromFlux(secondaryFlux), primaryErr, secondaryErr);
    }
}
