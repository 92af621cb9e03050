package com.funcplan.syntax;

/**
 * Turns raw source fragments into single-line labels.
 */
public final class LabelText {

    public static final int DEFAULT_MAX_LENGTH = 60;

    private LabelText() {}

    /**
     * Collapses whitespace, drops a trailing semicolon and cuts the result at {@code maxLength}
     * characters (negative means unlimited), appending {@code ...} when cut.
     */
    public static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return "";
        }
        String singleLine = raw.replaceAll("\\s+", " ").trim();
        while (singleLine.endsWith(";")) {
            singleLine = singleLine.substring(0, singleLine.length() - 1).trim();
        }
        if (maxLength >= 0 && singleLine.length() > maxLength) {
            return singleLine.substring(0, maxLength) + "...";
        }
        return singleLine;
    }
}
