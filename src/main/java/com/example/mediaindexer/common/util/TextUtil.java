package com.example.mediaindexer.common.util;

public final class TextUtil {

    private TextUtil() {
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    public static boolean hasText(String text) {
        return text != null && !text.trim().isEmpty();
    }
}
