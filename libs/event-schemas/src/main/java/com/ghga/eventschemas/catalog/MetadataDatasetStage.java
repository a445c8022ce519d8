package com.ghga.eventschemas.catalog;

import com.ghga.eventschemas.schema.LiteralEnum;

/** The current stage that a metadata dataset is in. */
public enum MetadataDatasetStage implements LiteralEnum {
    DOWNLOAD("download"),
    UPLOAD("upload");

    private final String value;

    MetadataDatasetStage(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }
}
