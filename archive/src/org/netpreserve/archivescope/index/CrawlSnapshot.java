package org.netpreserve.archivescope.index;

import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * One generation of the archived corpus as listed by the index server.
 *
 * @param id     opaque sortable identifier, e.g. {@code CC-MAIN-2024-10}
 * @param name   human readable name
 * @param date   approximate start date decoded from the id
 * @param status lifecycle status
 * @param cdxApi per-snapshot index endpoint, when the listing supplies one
 */
public record CrawlSnapshot(String id, String name, LocalDate date, SnapshotStatus status, String cdxApi) {
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Z]+-[A-Z]+-(\\d{4})(?:-(\\d{1,2}))?");

    /**
     * Decodes {@code CC-MAIN-YYYY-WW} into 1 January of YYYY plus WW-1 weeks. A missing week
     * counts as week 1. Returns the fallback when the id doesn't follow the scheme.
     */
    public static LocalDate dateFromId(String id, LocalDate fallback) {
        if (id == null) return fallback;
        var matcher = ID_PATTERN.matcher(id);
        if (!matcher.matches()) return fallback;
        int year = Integer.parseInt(matcher.group(1));
        int week = matcher.group(2) == null ? 1 : Integer.parseInt(matcher.group(2));
        if (week < 1) return fallback;
        return LocalDate.of(year, 1, 1).plusWeeks(week - 1);
    }
}
