package com.ghga.eventschemas.catalog;

import static com.ghga.eventschemas.schema.FieldType.datetime;
import static com.ghga.eventschemas.schema.FieldType.email;
import static com.ghga.eventschemas.schema.FieldType.enumOf;
import static com.ghga.eventschemas.schema.FieldType.integer;
import static com.ghga.eventschemas.schema.FieldType.jsonObject;
import static com.ghga.eventschemas.schema.FieldType.listOf;
import static com.ghga.eventschemas.schema.FieldType.record;
import static com.ghga.eventschemas.schema.FieldType.string;

import com.ghga.eventschemas.schema.FieldSpec;
import com.ghga.eventschemas.schema.FieldType;
import com.ghga.eventschemas.schema.SchemaDefinition;
import com.ghga.eventschemas.validation.UploadDates;
import java.util.List;

/**
 * The event payload schemas shared by the file-management and access-control services.
 *
 * <p>These declarations are the source of truth for every other representation (JSON-Schema
 * exports, service-side DTOs). Schemas that extend another one are composed with {@link
 * SchemaDefinition.Builder#include(SchemaDefinition)}, so base fields come first.
 */
public final class EventSchemas {

    private static final String FILE_ID_DESCRIPTION =
            "The public ID of the file as present in the metadata catalog.";
    private static final String OBJECT_ID_DESCRIPTION = "The ID of the file in the specific S3 bucket.";
    private static final String BUCKET_ID_DESCRIPTION =
            "The ID/name of the S3 bucket used to store the file.";
    private static final String S3_ENDPOINT_ALIAS_DESCRIPTION =
            "Alias for the object storage location where the given object is stored. This can be"
                    + " uniquely mapped to an endpoint configuration in the service.";
    private static final String DECRYPTED_SIZE_DESCRIPTION =
            "The size of the entire decrypted file content in bytes.";
    private static final String DECRYPTED_SHA256_DESCRIPTION =
            "The SHA-256 checksum of the entire decrypted file content.";

    // ---- Metadata ----

    public static final SchemaDefinition METADATA_DATASET_FILE =
            SchemaDefinition.builder("metadata_dataset_file")
                    .description("A file as that is part of a Dataset.")
                    .field(field("accession", string(), "The file accession."))
                    .field(field("description", string(), "The description of the file.").asNullable())
                    .field(field("file_extension", string(), "The file extension with a leading dot."))
                    .build();

    public static final SchemaDefinition METADATA_DATASET_ID =
            SchemaDefinition.builder("MetadataDatasetID")
                    .description("Simplified model to pass dataset ID to claims repository for deletion")
                    .field(field("accession", string(), "The dataset accession."))
                    .build();

    public static final SchemaDefinition METADATA_DATASET_OVERVIEW =
            SchemaDefinition.builder("metadata_dataset_overview")
                    .description("Overview of files contained in a dataset.")
                    .include(METADATA_DATASET_ID)
                    .field(field("title", string(), "The title of the dataset"))
                    .field(field("stage", enumOf(MetadataDatasetStage.class), "The current stage of this dataset"))
                    .field(field("description", string(), "The description of the dataset").asNullable())
                    .field(field("dac_alias", string(), "The alias of the Data Access Committee"))
                    .field(field("dac_email", email(), "The email address of the Data Access Committee"))
                    .field(field("files", listOf(record(METADATA_DATASET_FILE)), "Files contained in the dataset"))
                    .build();

    public static final SchemaDefinition METADATA_SUBMISSION_FILES =
            SchemaDefinition.builder("MetadataSubmissionFiles")
                    .description(
                            "Models files that are associated with or affected by a new or updated"
                                    + " metadata submission.")
                    .field(field("file_id", string(), FILE_ID_DESCRIPTION))
                    .field(field("file_name", string(), "The name of the file as it was submitted."))
                    .field(field("decrypted_size", integer(), DECRYPTED_SIZE_DESCRIPTION))
                    .field(field("decrypted_sha256", string(),
                            "The SHA-2 checksum of the entire decrypted file content."))
                    .build();

    public static final SchemaDefinition METADATA_SUBMISSION_UPSERTED =
            SchemaDefinition.builder("metadata_submission_upserted")
                    .description("Emitted when a metadata submission is created or updated.")
                    .field(FieldSpec.of("associated_files", listOf(record(METADATA_SUBMISSION_FILES))))
                    .build();

    public static final SchemaDefinition SEARCHABLE_RESOURCE_INFO =
            SchemaDefinition.builder("SearchableResourceInfo")
                    .description("Identifying information about an artifact's resource")
                    .field(field("accession", string(), "The resource accession."))
                    .field(field("class_name", string(),
                            "The name of the class this artifact resource corresponds to."))
                    .build();

    public static final SchemaDefinition SEARCHABLE_RESOURCE =
            SchemaDefinition.builder("SearchableResource")
                    .description("Resource content in addition to the accession and class name")
                    .include(SEARCHABLE_RESOURCE_INFO)
                    .field(field("content", jsonObject(), "The metadata content of this artifact resource."))
                    .build();

    public static final SchemaDefinition ARTIFACT_TAG =
            SchemaDefinition.builder("ArtifactTag")
                    .description("A tag for an artifact (artifact name and study accession).")
                    .field(field("study_accession", string(), "The ID of the study this artifact pertains to."))
                    .field(field("artifact_name", string(), "The name of the artifact, e.g. 'added_accessions'."))
                    .build();

    public static final SchemaDefinition ARTIFACT =
            SchemaDefinition.builder("Artifact")
                    .description("An artifact.")
                    .include(ARTIFACT_TAG)
                    .field(field("content", jsonObject(), "The metadata content of the artifact."))
                    .build();

    // ---- File upload ----

    /** Base for schemas carrying a stringified {@code upload_date}. */
    public static final SchemaDefinition UPLOAD_DATE_MODEL =
            SchemaDefinition.builder("UploadDateModel")
                    .field(UploadDates.UPLOAD_DATE_FIELD)
                    .build();

    public static final SchemaDefinition FILE_UPLOAD_RECEIVED =
            SchemaDefinition.builder("file_upload_received")
                    .description("This event is triggered when a new file upload is received.")
                    .include(UPLOAD_DATE_MODEL)
                    .field(field("file_id", string(), FILE_ID_DESCRIPTION))
                    .field(field("object_id", string(), OBJECT_ID_DESCRIPTION))
                    .field(field("bucket_id", string(), BUCKET_ID_DESCRIPTION))
                    .field(field("s3_endpoint_alias", string(), S3_ENDPOINT_ALIAS_DESCRIPTION))
                    .field(field("submitter_public_key", string(), "The public key of the submitter."))
                    .field(field("decrypted_size", integer(), DECRYPTED_SIZE_DESCRIPTION))
                    .field(field("expected_decrypted_sha256", string(),
                            "The expected SHA-256 checksum of the entire decrypted file content. To be validated."))
                    .build();

    public static final SchemaDefinition FILE_UPLOAD_VALIDATION_SUCCESS =
            SchemaDefinition.builder("file_upload_validation_success")
                    .description("This event is triggered when an uploaded file is successfully validated.")
                    .include(UPLOAD_DATE_MODEL)
                    .field(field("file_id", string(), FILE_ID_DESCRIPTION))
                    .field(field("object_id", string(), OBJECT_ID_DESCRIPTION))
                    .field(field("bucket_id", string(), BUCKET_ID_DESCRIPTION))
                    .field(field("s3_endpoint_alias", string(), S3_ENDPOINT_ALIAS_DESCRIPTION))
                    .field(field("decrypted_size", integer(), DECRYPTED_SIZE_DESCRIPTION))
                    .field(field("decryption_secret_id", string(),
                            "The ID of the symmetric file encryption/decryption secret. Please note, this is not"
                                    + " the secret itself."))
                    .field(field("content_offset", integer(),
                            "The offset in bytes at which the encrypted content starts (excluding the crypt4GH"
                                    + " envelope)."))
                    .field(field("encrypted_part_size", integer(),
                            "The size of the file parts of the encrypted content (excluding the crypt4gh"
                                    + " envelope) as used for the encrypted_parts_md5 and the"
                                    + " encrypted_parts_sha256 in bytes."))
                    .field(field("encrypted_parts_md5", listOf(string()),
                            "MD5 checksums of file parts of the encrypted content (excluding the crypt4gh"
                                    + " envelope)."))
                    .field(field("encrypted_parts_sha256", listOf(string()),
                            "SHA-256 checksums of file parts of the encrypted content (excluding the crypt4gh"
                                    + " envelope)."))
                    .field(field("decrypted_sha256", string(), DECRYPTED_SHA256_DESCRIPTION))
                    .build();

    public static final SchemaDefinition FILE_UPLOAD_VALIDATION_FAILURE =
            SchemaDefinition.builder("file_upload_validation_failure")
                    .description("This event is triggered when an uploaded file failed to validate.")
                    .include(UPLOAD_DATE_MODEL)
                    .field(field("file_id", string(), FILE_ID_DESCRIPTION))
                    .field(field("object_id", string(), OBJECT_ID_DESCRIPTION))
                    .field(field("bucket_id", string(), BUCKET_ID_DESCRIPTION))
                    .field(field("s3_endpoint_alias", string(), S3_ENDPOINT_ALIAS_DESCRIPTION))
                    .field(field("reason", string(), "The reason why the validation failed."))
                    .build();

    public static final SchemaDefinition FILE_INTERNALLY_REGISTERED =
            SchemaDefinition.builder("file_internally_registered")
                    .description("This event is triggered when an newly uploaded file is internally registered.")
                    .include(FILE_UPLOAD_VALIDATION_SUCCESS)
                    .field(field("encrypted_size", integer(),
                            "The size of the encrypted file content in bytes without the Crypt4GH envelope."))
                    .build();

    public static final SchemaDefinition FILE_REGISTERED_FOR_DOWNLOAD =
            SchemaDefinition.builder("file_registered_for_download")
                    .description(
                            "This event is triggered when a newly uploaded file becomes available for download"
                                    + " via a GA4GH DRS-compatible API.")
                    .include(UPLOAD_DATE_MODEL)
                    .field(field("file_id", string(), FILE_ID_DESCRIPTION))
                    .field(field("decrypted_sha256", string(), DECRYPTED_SHA256_DESCRIPTION))
                    .field(field("drs_uri", string(), "A URI for accessing the file according to the GA4GH DRS standard."))
                    .build();

    // ---- File download ----

    public static final SchemaDefinition NON_STAGED_FILE_REQUESTED =
            SchemaDefinition.builder("non_staged_file_requested")
                    .description(
                            "Triggered when a user requests to download a file that is not yet present in the"
                                    + " outbox and needs to be staged.")
                    .field(field("file_id", string(), FILE_ID_DESCRIPTION))
                    .field(field("target_object_id", string(), OBJECT_ID_DESCRIPTION))
                    .field(field("target_bucket_id", string(),
                            "The ID/name of the S3 bucket in which the object was expected."))
                    .field(field("s3_endpoint_alias", string(), S3_ENDPOINT_ALIAS_DESCRIPTION))
                    .field(field("decrypted_sha256", string(), DECRYPTED_SHA256_DESCRIPTION))
                    .build();

    public static final SchemaDefinition FILE_STAGED_FOR_DOWNLOAD =
            SchemaDefinition.builder("file_staged_for_download")
                    .description("Triggered when a file is staged to the outbox storage.")
                    .include(NON_STAGED_FILE_REQUESTED)
                    .build();

    public static final SchemaDefinition FILE_DOWNLOAD_SERVED =
            SchemaDefinition.builder("file_download_served")
                    .description("Triggered when the content of a file was served for download.")
                    .include(NON_STAGED_FILE_REQUESTED)
                    .field(field("context", string(),
                            "The context in which the download was served (e.g. the ID of the data access"
                                    + " request)."))
                    .build();

    // ---- File deletion ----

    public static final SchemaDefinition FILE_DELETION_REQUESTED =
            SchemaDefinition.builder("file_deletion_requested")
                    .description("Emitted when a request to delete a file from the file backend has been made.")
                    .field(field("file_id", string(), FILE_ID_DESCRIPTION))
                    .build();

    public static final SchemaDefinition FILE_DELETION_SUCCESS =
            SchemaDefinition.builder("file_deletion_success")
                    .description(
                            "Emitted when a service has deleted a file from its database as well as the S3"
                                    + " buckets it controls.")
                    .include(FILE_DELETION_REQUESTED)
                    .build();

    // ---- Notifications ----

    public static final SchemaDefinition NOTIFICATION =
            SchemaDefinition.builder("notification")
                    .description("Emitted by services that want the notification service to send an email.")
                    .field(field("recipient_email", email(), "The primary recipient of the email"))
                    .field(field("email_cc", listOf(email()), "The list of recipients cc'd on the email")
                            .withDefault(List.of()))
                    .field(field("email_bcc", listOf(email()), "The list of recipients bcc'd on the email")
                            .withDefault(List.of()))
                    .field(field("subject", string(), "The subject line for the notification"))
                    .field(field("recipient_name", string(),
                            "The full name of the recipient to be used in the greeting section"))
                    .field(field("plaintext_body", string(), "The basic text for the notification body"))
                    .build();

    // ---- Users and access requests ----

    public static final SchemaDefinition USER_ID =
            SchemaDefinition.builder("UserID")
                    .description("Generic event payload to relay a user ID.")
                    .field(field("user_id", string(), "The user ID"))
                    .build();

    public static final SchemaDefinition USER =
            SchemaDefinition.builder("User")
                    .description("Event used to publish user data changes via outbox pattern.")
                    .include(USER_ID)
                    .field(field("name", string(), "Full name of the user"))
                    .field(field("title", enumOf(AcademicTitle.class), "Academic title of the user")
                            .asNullable()
                            .withDefault(null))
                    .field(field("email", email(), "Preferred e-mail address of the user"))
                    .build();

    public static final SchemaDefinition ACCESS_REQUEST_DETAILS =
            SchemaDefinition.builder("AccessRequestDetails")
                    .description("Event used to convey the details an access request.")
                    .include(USER_ID)
                    .field(field("id", string(), "The access request ID"))
                    .field(field("dataset_id", string(), "The dataset ID"))
                    .field(field("dataset_title", string(), "The dataset title"))
                    .field(optionalString("dataset_description", "A description of the dataset"))
                    .field(field("status", enumOf(AccessRequestStatus.class), "The status of the access request"))
                    .field(field("request_text", string(), "Text note submitted with the request"))
                    .field(field("dac_alias", string(),
                            "The alias of the Data Access Committee responsible for the dataset"))
                    .field(field("dac_email", email(), "The email address of the Data Access Committee"))
                    .field(optionalString("ticket_id", "The ID of the ticket associated with the access request"))
                    .field(optionalString("internal_note",
                            "A note about the access request only visible to Data Stewards"))
                    .field(optionalString("note_to_requester",
                            "A note about the access request that is visible to the requester"))
                    .field(field("access_starts", datetime(),
                            "The beginning of the access request's validity period as a UTC datetime"))
                    .field(field("access_ends", datetime(),
                            "The end of the access request's validity period as a UTC datetime"))
                    .build();

    public static final SchemaDefinition USER_IVA_STATE =
            SchemaDefinition.builder("iva_state_change")
                    .description("Notification event for state changes of a user's IVA(s).")
                    .include(USER_ID)
                    .field(field("value", string(), "The value of the IVA (None = all IVAs of the user)")
                            .asNullable())
                    .field(field("type", enumOf(IvaType.class), "The type of the IVA (None = all IVAs of the user)")
                            .asNullable())
                    .field(field("state", enumOf(IvaState.class), "The new state of the IVA"))
                    .build();

    private EventSchemas() {
        // constants only
    }

    private static FieldSpec field(String name, FieldType type, String description) {
        return FieldSpec.of(name, type).describedAs(description);
    }

    private static FieldSpec optionalString(String name, String description) {
        return field(name, string(), description).asNullable().withDefault(null);
    }
}
