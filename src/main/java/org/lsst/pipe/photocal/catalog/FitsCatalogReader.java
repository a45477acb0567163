package org.lsst.pipe.photocal.catalog;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.ArrayFuncs;

/**
 * Reads source and reference catalogs from the first binary table extension
 * of a FITS file. Scalar floating point columns become fields, integer columns
 * become exact <code>long</code> fields, logical columns become flags, anything
 * else is ignored. An integer <code>id</code> column is required.
 *
 * @author tonyj
 */
public class FitsCatalogReader {

    public static final String ID_COLUMN = "id";

    private static final Logger LOG = Logger.getLogger(FitsCatalogReader.class.getName());

    public SourceCatalog readSourceCatalog(File file) throws IOException, FitsException {
        List<SourceRecord> records = new ArrayList<>();
        readRows(file, (id, fields, longFields, flags) -> records.add(new SourceRecord(id, fields, longFields, flags)));
        LOG.log(Level.FINE, "Read {0} sources from {1}", new Object[]{records.size(), file});
        return new SourceCatalog(records);
    }

    public ReferenceCatalog readReferenceCatalog(File file) throws IOException, FitsException {
        List<ReferenceRecord> records = new ArrayList<>();
        readRows(file, (id, fields, longFields, flags) -> records.add(new ReferenceRecord(id, fields, longFields, flags)));
        LOG.log(Level.FINE, "Read {0} reference objects from {1}", new Object[]{records.size(), file});
        return new ReferenceCatalog(records);
    }

    private void readRows(File file, RowConsumer consumer) throws IOException, FitsException {
        try (Fits fits = new Fits(file)) {
            BinaryTableHDU table = findTable(fits, file);
            int nRows = table.getNRows();
            int nCols = table.getNCols();
            long[] ids = null;
            Map<String, double[]> numeric = new LinkedHashMap<>();
            Map<String, long[]> integer = new LinkedHashMap<>();
            Map<String, boolean[]> logical = new LinkedHashMap<>();
            for (int col = 0; col < nCols; col++) {
                String name = table.getColumnName(col);
                Object data = table.getColumn(col);
                if (name == null || data == null || !data.getClass().isArray()) {
                    continue;
                }
                Class<?> type = data.getClass().getComponentType();
                if (ID_COLUMN.equals(name)) {
                    if (!isInteger(type)) {
                        throw new FitsException("Column " + ID_COLUMN + " in " + file + " is not an integer column");
                    }
                    ids = (long[]) ArrayFuncs.convertArray(data, long.class);
                } else if (type == boolean.class) {
                    logical.put(name, (boolean[]) data);
                } else if (isInteger(type)) {
                    integer.put(name, (long[]) ArrayFuncs.convertArray(data, long.class));
                } else if (type == float.class || type == double.class) {
                    numeric.put(name, (double[]) ArrayFuncs.convertArray(data, double.class));
                } else {
                    LOG.log(Level.FINE, "Skipping column {0} of type {1}", new Object[]{name, type});
                }
            }
            if (ids == null) {
                throw new FitsException("Missing " + ID_COLUMN + " column in " + file);
            }
            for (int row = 0; row < nRows; row++) {
                Map<String, Double> fields = new LinkedHashMap<>();
                for (Map.Entry<String, double[]> e : numeric.entrySet()) {
                    fields.put(e.getKey(), e.getValue()[row]);
                }
                Map<String, Long> longFields = new LinkedHashMap<>();
                for (Map.Entry<String, long[]> e : integer.entrySet()) {
                    longFields.put(e.getKey(), e.getValue()[row]);
                }
                Map<String, Boolean> flags = new LinkedHashMap<>();
                for (Map.Entry<String, boolean[]> e : logical.entrySet()) {
                    flags.put(e.getKey(), e.getValue()[row]);
                }
                consumer.accept(ids[row], fields, longFields, flags);
            }
        }
    }

    private static BinaryTableHDU findTable(Fits fits, File file) throws IOException, FitsException {
        for (int i = 0;; i++) {
            BasicHDU<?> hdu = fits.getHDU(i);
            if (hdu == null) {
                throw new FitsException("No binary table found in " + file);
            }
            if (hdu instanceof BinaryTableHDU) {
                return (BinaryTableHDU) hdu;
            }
        }
    }

    private static boolean isInteger(Class<?> type) {
        return type == long.class || type == int.class || type == short.class || type == byte.class;
    }

    private interface RowConsumer {

        void accept(long id, Map<String, Double> fields, Map<String, Long> longFields, Map<String, Boolean> flags);
    }
}
