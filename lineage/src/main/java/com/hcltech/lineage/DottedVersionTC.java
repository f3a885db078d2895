package com.hcltech.lineage;

import java.util.List;

/**
 * Dotted version strings such as {@code "1.9"}, {@code "1.10"} or {@code "2.0-rc1"}.
 * <ul>
 *     <li>each segment is a leading number and an optional suffix: {@code "0-rc1"} is {@code 0} + {@code "-rc1"}</li>
 *     <li>numbers compare numerically: {@code "1.10" > "1.9"}</li>
 *     <li>with equal numbers, no suffix sorts first, then suffixes lexicographically:
 *     {@code "2.0" < "2.0-rc1" < "2.1"}</li>
 *     <li>segments with no leading number compare lexicographically, and sort after numbered ones</li>
 *     <li>missing trailing segments count as {@code 0}: {@code "2" == "2.0"}</li>
 * </ul>
 * Blank versions and empty segments ({@code "1."}, {@code "1..2"}) are rejected.
 */
public final class DottedVersionTC implements VersionTC<String> {
    public static final DottedVersionTC INSTANCE = new DottedVersionTC();

    private static final String ZERO = "0";

    private DottedVersionTC() {}

    @Override
    public int compare(String a, String b) {
        List<String> as = segments(a);
        List<String> bs = segments(b);
        int n = Math.max(as.size(), bs.size());
        for (int i = 0; i < n; i++) {
            String sa = i < as.size() ? as.get(i) : ZERO;
            String sb = i < bs.size() ? bs.get(i) : ZERO;
            int c = compareSegment(sa, sb);
            if (c != 0) return c;
        }
        return 0;
    }

    static List<String> segments(String version) {
        if (version == null || version.isBlank())
            throw new IllegalArgumentException("Version must not be blank: '" + version + "'");
        List<String> segments = List.of(version.trim().split("\\.", -1));
        for (String s : segments) {
            if (s.isEmpty())
                throw new IllegalArgumentException("Version has an empty segment: '" + version + "'");
        }
        return segments;
    }

    private static int compareSegment(String a, String b) {
        int da = digitPrefix(a), db = digitPrefix(b);
        if (da > 0 && db > 0) {
            int c = compareNumbers(a.substring(0, da), b.substring(0, db));
            if (c != 0) return c;
            String xa = a.substring(da), xb = b.substring(db);
            if (xa.isEmpty() || xb.isEmpty()) return Boolean.compare(!xa.isEmpty(), !xb.isEmpty());
            return xa.compareTo(xb);
        }
        if (da > 0) return -1;
        if (db > 0) return 1;
        return a.compareTo(b);
    }

    // strip leading zeros so arbitrary lengths compare without overflow
    private static int compareNumbers(String a, String b) {
        String ta = stripZeros(a), tb = stripZeros(b);
        if (ta.length() != tb.length()) return Integer.compare(ta.length(), tb.length());
        return ta.compareTo(tb);
    }

    /** Length of the run of ASCII digits at the start of {@code s}. */
    private static int digitPrefix(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) >= '0' && s.charAt(i) <= '9') i++;
        return i;
    }

    private static String stripZeros(String s) {
        int i = 0;
        while (i < s.length() - 1 && s.charAt(i) == '0') i++;
        return s.substring(i);
    }
}
