package com.ghga.eventschemas.catalog;

import com.ghga.eventschemas.schema.LiteralEnum;

/** The type of an IVA (independent verification address). */
public enum IvaType implements LiteralEnum {
    PHONE("Phone"),
    FAX("Fax"),
    POSTAL_ADDRESS("PostalAddress"),
    IN_PERSON("InPerson");

    private final String value;

    IvaType(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }
}
