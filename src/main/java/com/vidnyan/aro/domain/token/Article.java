package com.vidnyan.aro.domain.token;

import java.util.Locale;

public enum Article {
    A,
    AN,
    THE;

    public String word() {
        return name().toLowerCase(Locale.ROOT);
    }
}
