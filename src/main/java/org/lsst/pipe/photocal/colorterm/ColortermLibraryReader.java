package org.lsst.pipe.photocal.colorterm;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Reads a {@link ColortermLibrary} from a properties file of the form
 * <pre>
 * legend = primary, secondary, c0, c1, c2
 * sdss*.g = g, r, -0.009, -0.085, 0.0
 * </pre>
 * where each key is a catalog name pattern and a filter name separated by the
 * last dot. The c2 column may be omitted.
 *
 * @author tonyj
 */
public class ColortermLibraryReader {

    private static final List<String> LEGEND = Arrays.asList("primary", "secondary", "c0", "c1", "c2");

    public ColortermLibrary read(File file) throws IOException {
        try (InputStream in = new FileInputStream(file)) {
            return read(in);
        }
    }

    public ColortermLibrary read(URL url) throws IOException {
        try (InputStream in = url.openStream()) {
            return read(in);
        }
    }

    public ColortermLibrary read(InputStream input) throws IOException {
        Properties props = new Properties();
        props.load(input);
        String legend = props.getProperty("legend");
        if (legend == null) {
            throw new IOException("Missing legend in colorterm file");
        }
        String[] keyList = legend.trim().split("\\s*,\\s*");
        if (keyList.length < 4 || !LEGEND.subList(0, keyList.length).equals(Arrays.asList(keyList))) {
            throw new IOException("Unexpected legend in colorterm file: " + legend);
        }
        ColortermLibrary.Builder builder = ColortermLibrary.builder();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            if ("legend".equals(key)) {
                continue;
            }
            int dot = key.lastIndexOf('.');
            if (dot <= 0 || dot == key.length() - 1) {
                throw new IOException("Invalid colorterm key " + key + ", expected <pattern>.<filter>");
            }
            String[] values = props.getProperty(key).trim().split("\\s*,\\s*");
            if (values.length != keyList.length) {
                throw new IOException("Colorterm " + key + " has " + values.length + " values, expected " + keyList.length);
            }
            try {
                double c0 = Double.parseDouble(values[2]);
                double c1 = Double.parseDouble(values[3]);
                double c2 = values.length > 4 ? Double.parseDouble(values[4]) : 0.0;
                builder.add(key.substring(0, dot), key.substring(dot + 1), new Colorterm(values[0], values[1], c0, c1, c2));
            } catch (NumberFormatException x) {
                throw new IOException("Invalid coefficient in colorterm " + key, x);
            }
        }
        return builder.build();
    }
}
