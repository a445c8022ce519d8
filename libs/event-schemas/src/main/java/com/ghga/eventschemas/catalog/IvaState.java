package com.ghga.eventschemas.catalog;

import com.ghga.eventschemas.schema.LiteralEnum;

/** The verification state of an IVA. */
public enum IvaState implements LiteralEnum {
    UNVERIFIED("Unverified"),
    CODE_REQUESTED("CodeRequested"),
    CODE_CREATED("CodeCreated"),
    CODE_TRANSMITTED("CodeTransmitted"),
    VERIFIED("Verified");

    private final String value;

    IvaState(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }
}
