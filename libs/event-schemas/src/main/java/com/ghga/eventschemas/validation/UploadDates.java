package com.ghga.eventschemas.validation;

import com.ghga.eventschemas.schema.FieldConstraint;
import com.ghga.eventschemas.schema.FieldSpec;
import com.ghga.eventschemas.schema.FieldType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * The shared rule for stringified upload timestamps.
 *
 * <p>Upload dates travel as plain strings (they are produced by the upload services with a UTC
 * timestamp's ISO form) and are kept as strings in the validated payload. The rule only ensures
 * they can be read back as a date/time. Every schema with an upload date uses {@link
 * #UPLOAD_DATE_FIELD}, so the check cannot drift between schemas.
 */
public final class UploadDates {

    /** The upload date rule as a reusable constraint. */
    public static final FieldConstraint CONSTRAINT = UploadDates::check;

    /** The {@code upload_date} field spec shared by all upload-related schemas. */
    public static final FieldSpec UPLOAD_DATE_FIELD =
            FieldSpec.of("upload_date", FieldType.string())
                    .withConstraint(CONSTRAINT)
                    .describedAs(
                            "The date and time when this file was uploaded. String format should"
                                    + " follow ISO 8601");

    private UploadDates() {
        // utility class
    }

    /**
     * Returns {@code uploadDate} unchanged if it can be interpreted as an ISO-8601 date/time.
     *
     * @throws IllegalArgumentException naming the unparseable string otherwise
     */
    public static String validated(String uploadDate) {
        if (!isParseable(uploadDate)) {
            throw new IllegalArgumentException(violationMessage(uploadDate));
        }
        return uploadDate;
    }

    /** True for ISO dates, local date-times and offset date-times ("T" or space separated). */
    public static boolean isParseable(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String normalized = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    normalized, OffsetDateTime::from, LocalDateTime::from);
            return true;
        } catch (DateTimeParseException e) {
            // fall through to the date-only form
        }
        try {
            LocalDate.parse(normalized, DateTimeFormatter.ISO_LOCAL_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static Optional<String> check(Object value) {
        String text = String.valueOf(value);
        return isParseable(text) ? Optional.empty() : Optional.of(violationMessage(text));
    }

    private static String violationMessage(String uploadDate) {
        return "Could not convert upload date to datetime: " + uploadDate;
    }
}
