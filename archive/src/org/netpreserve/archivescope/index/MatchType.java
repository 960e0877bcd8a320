package org.netpreserve.archivescope.index;

import java.util.Locale;

/**
 * How the index server interprets the query URL.
 */
public enum MatchType {
    EXACT, PREFIX, DOMAIN, RANGE;

    public String parameter() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MatchType parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
