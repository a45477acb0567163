package org.lsst.pipe.photocal.colorterm;

import java.util.regex.Pattern;

/**
 * Shell style wildcard matching of catalog names. Supports <code>*</code>,
 * <code>?</code>, <code>[seq]</code> and <code>[!seq]</code>; matching is
 * case sensitive and anchored at both ends.
 *
 * @author tonyj
 */
final class GlobPattern {

    private final String glob;
    private final Pattern pattern;

    GlobPattern(String glob) {
        this.glob = glob;
        this.pattern = Pattern.compile(translate(glob), Pattern.DOTALL);
    }

    boolean matches(String name) {
        return pattern.matcher(name).matches();
    }

    String getGlob() {
        return glob;
    }

    static String translate(String glob) {
        StringBuilder regex = new StringBuilder();
        int n = glob.length();
        int i = 0;
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    // Unterminated set is a literal bracket
                    regex.append("\\[");
                } else {
                    String set = glob.substring(i, j);
                    i = j + 1;
                    regex.append('[');
                    if (set.startsWith("!")) {
                        regex.append('^');
                        set = set.substring(1);
                    }
                    for (char s : set.toCharArray()) {
                        if ("\\[]&^".indexOf(s) >= 0) {
                            regex.append('\\');
                        }
                        regex.append(s);
                    }
                    regex.append(']');
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
