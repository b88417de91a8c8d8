package com.example.mediaindexer.domain.enumtype;

import java.util.Locale;

public enum LibraryType {
    MOVIES,
    SERIES,
    MIXED;

    /**
     * @return the matching type, or null when the stored value is unknown
     */
    public static LibraryType fromValue(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LibraryType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
