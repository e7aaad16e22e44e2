package com.marketdw.utils;

import java.util.regex.Pattern;

/**
 * Shortening and joining of error text before it is persisted.
 */
public final class TextFormatter {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\n\t]]");

    private TextFormatter() {
    }

    // 保留开头：用于错误摘要
    public static String head(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        String t = clean(s);
        if (maxChars <= 0 || t.length() <= maxChars) {
            return t;
        }
        return t.substring(0, maxChars) + "...";
    }

    // 保留结尾：用于进程输出尾部
    public static String tail(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        String t = clean(s);
        if (maxChars <= 0 || t.length() <= maxChars) {
            return t;
        }
        return t.substring(t.length() - maxChars);
    }

    /**
     * Appends {@code note} to existing text, or returns the note when there is nothing to keep.
     */
    public static String appendNote(String existing, String note) {
        String base = existing == null ? "" : existing.trim();
        String add = note == null ? "" : note.trim();
        if (base.isEmpty()) {
            return add;
        }
        if (add.isEmpty()) {
            return base;
        }
        return base + " " + add;
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String clean(String s) {
        String t = s.replace("\r\n", "\n").replace("\r", "\n");
        return CONTROL_CHARS.matcher(t).replaceAll("").trim();
    }
}
