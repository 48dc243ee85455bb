package com.gnovoa.fantasy.model;

import java.util.Locale;

public enum PlayerStatus {
    ACTIVE,
    INJURED,
    SUSPENDED,
    IR;

    public boolean isAvailable() { return this == ACTIVE; }

    /** Missing or unrecognised feed values count as active. */
    public static PlayerStatus fromCode(String code) {
        if (code == null || code.isBlank()) return ACTIVE;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "injured" -> INJURED;
            case "suspended" -> SUSPENDED;
            case "ir" -> IR;
            default -> ACTIVE;
        };
    }
}
