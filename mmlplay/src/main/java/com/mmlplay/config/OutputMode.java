package com.mmlplay.config;

import java.util.Locale;

/** Where interpreted events go. */
public enum OutputMode {
    /** JavaSound tone synthesis (falls back to SLEEP without a device). */
    AUDIO,
    /** Real-time timing only, no sound. */
    SLEEP,
    /** Discard events immediately. */
    SILENT;

    /**
     * @return matching mode or null when the text names none
     */
    public static OutputMode parse(String raw) {
        if (raw == null)
            return null;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "audio":
                return AUDIO;
            case "sleep":
                return SLEEP;
            case "silent":
                return SILENT;
            default:
                return null;
        }
    }
}
