package com.priceintel.harvester.resolver;

/**
 * Dotted-numeric version ordering ("1.10.0" is newer than "1.9.2"). A missing version is oldest.
 */
public final class ResolverVersion {

    private ResolverVersion() {
    }

    public static int compare(String a, String b) {
        if (a == null) return b == null ? 0 : -1;
        if (b == null) return 1;

        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.max(left.length, right.length); i++) {
            String l = i < left.length ? left[i] : "0";
            String r = i < right.length ? right[i] : "0";
            int cmp = comparePart(l, r);
            if (cmp != 0) return cmp;
        }
        return 0;
    }

    private static int comparePart(String l, String r) {
        try {
            return Long.compare(Long.parseLong(l), Long.parseLong(r));
        } catch (NumberFormatException e) {
            return l.compareTo(r);
        }
    }
}
