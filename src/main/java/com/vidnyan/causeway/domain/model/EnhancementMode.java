package com.vidnyan.causeway.domain.model;

import java.util.Locale;

/**
 * Requested fitting mode. {@link #AUTO} picks dynamic when traces are supplied.
 */
public enum EnhancementMode {
    STATIC,
    DYNAMIC,
    AUTO;

    public ScmMode resolve(boolean hasTraces) {
        switch (this) {
            case STATIC:
                return ScmMode.STATIC;
            case DYNAMIC:
                return ScmMode.DYNAMIC;
            default:
                return hasTraces ? ScmMode.DYNAMIC : ScmMode.STATIC;
        }
    }

    /**
     * @throws IllegalArgumentException for anything but static, dynamic or auto
     */
    public static EnhancementMode fromLabel(String label) {
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid mode: " + label + " (must be 'static', 'dynamic', or 'auto')", e);
        }
    }
}
