package im.arun.mdblocks.service;

import java.util.Locale;

/**
 * How {@link LogseqPageService#updatePage} treats the existing page.
 */
public enum UpdateMode {
    /** Keep existing blocks and add new ones after the last root block; properties merge. */
    APPEND,
    /** Remove every existing block first; properties are replaced. */
    REPLACE;

    public static UpdateMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return APPEND;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown update mode '" + value + "', expected append or replace");
        }
    }
}
