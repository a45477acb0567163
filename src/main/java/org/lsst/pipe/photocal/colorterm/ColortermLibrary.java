package org.lsst.pipe.photocal.colorterm;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import org.lsst.pipe.photocal.ConfigurationException;

/**
 * A library of color terms, organized by photometric reference catalog. Each
 * entry is keyed by a glob pattern which is matched against the catalog name,
 * and holds the color terms for each filter.
 * <p>
 * Entries are kept in insertion order and a lookup makes a single pass over
 * them. Exactly one key must match the catalog name, a key equal to the
 * name counting as a match like any other.
 *
 * @author tonyj
 */
public class ColortermLibrary {

    private static final Logger LOG = Logger.getLogger(ColortermLibrary.class.getName());

    private final List<Entry> entries;
    private final LoadingCache<ColortermKey, Colorterm> cache;

    private ColortermLibrary(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
        this.cache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.lsst.pipe.photocal.colortermCacheSize", 100))
                .build((ColortermKey key) -> lookup(key.filterName, key.catalogName));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Find the color term for a filter of a photometric reference catalog.
     *
     * @param filterName The filter of the exposure being calibrated
     * @param photoCatName The name of the reference catalog
     * @return The matching color term
     * @throws ConfigurationException If no entry or more than one entry
     * matches the catalog name, or the matching entry has no color term for
     * the filter
     */
    public Colorterm getColorterm(String filterName, String photoCatName) {
        Objects.requireNonNull(filterName, "filterName");
        Objects.requireNonNull(photoCatName, "photoCatName");
        return cache.get(new ColortermKey(photoCatName, filterName));
    }

    private Colorterm lookup(String filterName, String photoCatName) {
        List<Entry> matches = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.pattern.matches(photoCatName)) {
                matches.add(entry);
            }
        }
        if (matches.isEmpty()) {
            throw new ConfigurationException("No colorterm library entry matches photometric catalog " + photoCatName);
        } else if (matches.size() > 1) {
            throw new ConfigurationException("Multiple colorterm library entries match photometric catalog " + photoCatName + ": "
                    + matches.stream().map(e -> e.pattern.getGlob()).collect(Collectors.toList()));
        }
        Entry found = matches.get(0);
        Colorterm colorterm = found.colorterms.get(filterName);
        if (colorterm == null) {
            throw new ConfigurationException("No colorterm for filter " + filterName + " in library entry " + found.pattern.getGlob());
        }
        LOG.log(Level.FINE, "Resolved colorterm for {0}/{1} via {2}: {3}", new Object[]{photoCatName, filterName, found.pattern, colorterm});
        return colorterm;
    }

    public List<String> getKeys() {
        return entries.stream().map(e -> e.pattern.getGlob()).collect(Collectors.toList());
    }

    public Map<String, Colorterm> getColorterms(String key) {
        for (Entry entry : entries) {
            if (entry.pattern.getGlob().equals(key)) {
                return entry.colorterms;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "ColortermLibrary" + getKeys();
    }

    public static class Builder {

        private final Map<String, Map<String, Colorterm>> data = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String pattern, String filterName, Colorterm colorterm) {
            data.computeIfAbsent(pattern, (p) -> new LinkedHashMap<>()).put(filterName, colorterm);
            return this;
        }

        public Builder add(String pattern, Map<String, Colorterm> colorterms) {
            for (Map.Entry<String, Colorterm> e : colorterms.entrySet()) {
                add(pattern, e.getKey(), e.getValue());
            }
            return this;
        }

        public ColortermLibrary build() {
            List<Entry> entries = new ArrayList<>();
            for (Map.Entry<String, Map<String, Colorterm>> e : data.entrySet()) {
                entries.add(new Entry(new GlobPattern(e.getKey()), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue()))));
            }
            return new ColortermLibrary(entries);
        }
    }

    private static class Entry {

        private final GlobPattern pattern;
        private final Map<String, Colorterm> colorterms;

        Entry(GlobPattern pattern, Map<String, Colorterm> colorterms) {
            this.pattern = pattern;
            this.colorterms = colorterms;
        }
    }

    private static final class ColortermKey {

        private final String catalogName;
        private final String filterName;

        ColortermKey(String catalogName, String filterName) {
            this.catalogName = catalogName;
            this.filterName = filterName;
        }

        @Override
        public int hashCode() {
            int hash = 7;
            hash = 19 * hash + catalogName.hashCode();
            hash = 19 * hash + filterName.hashCode();
            return hash;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            final ColortermKey other = (ColortermKey) obj;
            return catalogName.equals(other.catalogName) && filterName.equals(other.filterName);
        }
    }
}
