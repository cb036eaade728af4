package com.expertpanel.common.parse;

import java.util.regex.Pattern;

/**
 * Bullet and numbering conventions shared by the opinion and decision parsers.
 * Items start with {@code -}, {@code *}, {@code •} or a number followed by {@code .} or {@code )}.
 */
final class BulletItems {

    private static final Pattern NUMBERED = Pattern.compile("^\\d{1,2}[.)]\\s+\\S.*");
    private static final Pattern MARKER   = Pattern.compile("^(?:[-*•]|\\d{1,2}[.)])\\s*");

    private BulletItems() {}

    static boolean isItem(String line) {
        if (line.startsWith("**")) return false;
        return line.startsWith("-") || line.startsWith("*") || line.startsWith("•")
            || NUMBERED.matcher(line).matches();
    }

    /** Removes the bullet marker and bold markup, e.g. {@code "2. **Pneumonia**"} → {@code "Pneumonia"}. */
    static String strip(String line) {
        return MARKER.matcher(line).replaceFirst("").replace("**", "").trim();
    }

    static boolean isHeading(String line) {
        if (line.startsWith("**") || line.startsWith("#")) return true;
        if (line.length() > 2 && line.startsWith("*") && line.endsWith("*") && !line.startsWith("* ")) {
            return true;
        }
        return line.endsWith(":") && !isItem(line);
    }
}
