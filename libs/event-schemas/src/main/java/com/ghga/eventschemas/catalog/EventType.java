package com.ghga.eventschemas.catalog;

import com.ghga.eventschemas.schema.SchemaDefinition;
import java.util.Optional;

/**
 * All event types with a schema in the catalog.
 *
 * <p>The {@code value} is the string carried in message metadata.
 */
public enum EventType {

    // ---- Metadata Events ----
    METADATA_DATASET_DELETED("metadata_dataset_deleted", EventSchemas.METADATA_DATASET_ID),
    METADATA_DATASET_OVERVIEW("metadata_dataset_overview", EventSchemas.METADATA_DATASET_OVERVIEW),
    METADATA_SUBMISSION_UPSERTED("metadata_submission_upserted", EventSchemas.METADATA_SUBMISSION_UPSERTED),
    SEARCHABLE_RESOURCE_DELETED("searchable_resource_deleted", EventSchemas.SEARCHABLE_RESOURCE_INFO),
    SEARCHABLE_RESOURCE_UPSERTED("searchable_resource_upserted", EventSchemas.SEARCHABLE_RESOURCE),

    // ---- File Upload Events ----
    FILE_UPLOAD_RECEIVED("file_upload_received", EventSchemas.FILE_UPLOAD_RECEIVED),
    FILE_UPLOAD_VALIDATION_SUCCESS("file_upload_validation_success", EventSchemas.FILE_UPLOAD_VALIDATION_SUCCESS),
    FILE_UPLOAD_VALIDATION_FAILURE("file_upload_validation_failure", EventSchemas.FILE_UPLOAD_VALIDATION_FAILURE),
    FILE_INTERNALLY_REGISTERED("file_internally_registered", EventSchemas.FILE_INTERNALLY_REGISTERED),
    FILE_REGISTERED_FOR_DOWNLOAD("file_registered_for_download", EventSchemas.FILE_REGISTERED_FOR_DOWNLOAD),

    // ---- File Download Events ----
    NON_STAGED_FILE_REQUESTED("non_staged_file_requested", EventSchemas.NON_STAGED_FILE_REQUESTED),
    FILE_STAGED_FOR_DOWNLOAD("file_staged_for_download", EventSchemas.FILE_STAGED_FOR_DOWNLOAD),
    FILE_DOWNLOAD_SERVED("file_download_served", EventSchemas.FILE_DOWNLOAD_SERVED),

    // ---- Notification Events ----
    NOTIFICATION("notification", EventSchemas.NOTIFICATION),

    // ---- User / Access Events ----
    USER_ID("user_id", EventSchemas.USER_ID),
    SECOND_FACTOR_RECREATED("second_factor_recreated", EventSchemas.USER_ID),
    ACCESS_REQUEST_DETAILS("access_request_details", EventSchemas.ACCESS_REQUEST_DETAILS),
    IVA_STATE_CHANGED("iva_state_changed", EventSchemas.USER_IVA_STATE);

    private final String value;
    private final SchemaDefinition schema;

    EventType(String value, SchemaDefinition schema) {
        this.value = value;
        this.schema = schema;
    }

    /** The canonical string carried with the event (e.g. "file_upload_received"). */
    public String value() {
        return value;
    }

    public SchemaDefinition schema() {
        return schema;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "notification")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
