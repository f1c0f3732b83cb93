package com.opsos.itemresolution.model;

import java.util.Locale;

public enum PackType {
    CASE,
    BOTTLE,
    BAG,
    BOX,
    EACH,
    KEG,
    PAIL,
    DRUM;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
