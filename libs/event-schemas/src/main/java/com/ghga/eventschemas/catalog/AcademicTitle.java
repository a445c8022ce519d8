package com.ghga.eventschemas.catalog;

import com.ghga.eventschemas.schema.LiteralEnum;

/** Academic title of a user. */
public enum AcademicTitle implements LiteralEnum {
    DR("Dr."),
    PROF("Prof.");

    private final String value;

    AcademicTitle(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }
}
