package com.transparenta.analytics.grouping;

/**
 * Helpers for budget classification codes. Stored codes are dotted ({@code 65.02.01}); the
 * grouping engine works on the digits-only form ({@code 650201}), two digits per level.
 */
public final class ClassificationCodes {

    public static final int CHAPTER_DIGITS = 2;
    public static final int SUBCHAPTER_DIGITS = 4;
    public static final int PARAGRAPH_DIGITS = 6;

    private ClassificationCodes() {
    }

    public static String normalize(String code) {
        if (code == null) {
            return "";
        }
        StringBuilder digits = new StringBuilder(code.length());
        for (int i = 0; i < code.length(); i++) {
            char ch = code.charAt(i);
            if (ch >= '0' && ch <= '9') {
                digits.append(ch);
            }
        }
        return digits.toString();
    }

    public static int depthOf(String code) {
        return normalize(code).length();
    }

    public static String truncate(String digits, int depth) {
        return digits.length() <= depth ? digits : digits.substring(0, depth);
    }

    public static String chapterOf(String code) {
        return truncate(normalize(code), CHAPTER_DIGITS);
    }

    /**
     * Display form: {@code 65}, {@code 65.02}, {@code 65.02.01}.
     */
    public static String format(String code) {
        String digits = normalize(code);
        StringBuilder formatted = new StringBuilder(digits.length() + 2);
        for (int i = 0; i < digits.length(); i += 2) {
            if (i > 0) {
                formatted.append('.');
            }
            formatted.append(digits, i, Math.min(i + 2, digits.length()));
        }
        return formatted.toString();
    }

    /**
     * True for the placeholder economic codes ({@code 0}, {@code 00.00.00}) given to line items
     * that carry no economic classification.
     */
    public static boolean isUnclassified(String code) {
        String digits = normalize(code);
        return digits.isEmpty() || digits.chars().allMatch(ch -> ch == '0');
    }

    /**
     * Grouping depth for a drilldown: the root depth for an empty path, otherwise one level
     * below the last path element, never deeper than a paragraph.
     */
    public static int nextDepth(String pathLeaf, int rootDepth) {
        if (pathLeaf == null) {
            return rootDepth;
        }
        return Math.min(depthOf(pathLeaf) + 2, PARAGRAPH_DIGITS);
    }
}
