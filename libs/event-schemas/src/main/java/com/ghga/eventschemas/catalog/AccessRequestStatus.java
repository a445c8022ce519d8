package com.ghga.eventschemas.catalog;

import com.ghga.eventschemas.schema.LiteralEnum;

/** The status of an access request. */
public enum AccessRequestStatus implements LiteralEnum {
    ALLOWED("allowed"),
    DENIED("denied"),
    PENDING("pending");

    private final String value;

    AccessRequestStatus(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }
}
