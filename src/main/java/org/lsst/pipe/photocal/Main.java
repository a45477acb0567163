package org.lsst.pipe.photocal;

import java.awt.Rectangle;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import nom.tam.fits.FitsException;
import org.lsst.pipe.photocal.catalog.FitsCatalogReader;
import org.lsst.pipe.photocal.catalog.PhotometryFlag;
import org.lsst.pipe.photocal.catalog.ReferenceCatalog;
import org.lsst.pipe.photocal.catalog.SourceCatalog;
import org.lsst.pipe.photocal.match.CatalogIdMatcher;

/**
 * Calibrates a source catalog against a reference catalog from the command
 * line. The source catalog must carry a <code>refId</code> column naming the
 * matched reference star.
 * <pre>
 * Main srcCat.fits refCat.fits filter [photocal.properties]
 * </pre>
 *
 * @author tonyj
 */
public class Main {

    public static void main(String[] args) throws IOException, FitsException {
        if (args.length < 3 || args.length > 4) {
            System.err.println("Usage: Main srcCat.fits refCat.fits filter [photocal.properties]");
            System.exit(1);
        }
        Properties props = new Properties();
        if (args.length == 4) {
            try (InputStream in = new FileInputStream(args[3])) {
                props.load(in);
            }
        }
        PhotoCalConfig config = PhotoCalConfig.fromProperties(props);
        FitsCatalogReader reader = new FitsCatalogReader();
        SourceCatalog srcCat = reader.readSourceCatalog(new File(args[0]));
        ReferenceCatalog refCat = reader.readReferenceCatalog(new File(args[1]));
        Exposure exposure = new Exposure(Long.getLong("org.lsst.pipe.photocal.exposureId", 0), args[2], new Rectangle());

        PhotoCalTask task = new PhotoCalTask((e) -> refCat, new CatalogIdMatcher(), config);
        PhotoCalResult result = task.run(exposure, srcCat);
        System.out.printf("zeroPoint=%.4f +/- %.4f%n", result.getZeroPoint(), result.getZeroPointError());
        System.out.printf("candidates=%d used=%d reserved=%d%n",
                srcCat.count(PhotometryFlag.CANDIDATE), srcCat.count(PhotometryFlag.USED), srcCat.count(PhotometryFlag.RESERVED));
    }
}
