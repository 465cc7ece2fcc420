package com.manning.macaroons;

import java.util.Locale;

import com.manning.macaroons.json.CaveatForm;

/**
 * Settings read from system properties.
 */
public final class MacaroonConfig {
    public static final String JSON_CAVEATS_PROPERTY = "macaroons.json.caveats";

    private MacaroonConfig() {
    }

    public static CaveatForm jsonCaveatForm() {
        var value = System.getProperty(JSON_CAVEATS_PROPERTY, "compact");
        switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "compact":
            return CaveatForm.COMPACT;
        case "legacy":
            return CaveatForm.LEGACY;
        default:
            throw new IllegalArgumentException("unknown value for " + JSON_CAVEATS_PROPERTY + ": " + value);
        }
    }
}
