package com.vidnyan.aro.domain.symbol;

import java.util.Locale;

public enum Visibility {
    /** Only visible inside the feature set. */
    INTERNAL,
    /** Exported to other feature sets. */
    PUBLISHED,
    /** Provided from outside the feature set. */
    EXTERNAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
