package com.vidnyan.aro.domain.diagnostic;

import java.util.Locale;

public enum Severity {
    ERROR,
    WARNING,
    NOTE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
