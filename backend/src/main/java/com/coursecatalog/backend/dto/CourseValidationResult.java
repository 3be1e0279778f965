package com.coursecatalog.backend.dto;

import java.util.List;

/**
 * Outcome of checking a {@link CourseRequest} against its required fields.
 * An empty missing-field list means the request is valid.
 */
public record CourseValidationResult(List<String> missingFields) {

    public CourseValidationResult {
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public static CourseValidationResult ok() {
        return new CourseValidationResult(List.of());
    }

    public static CourseValidationResult missing(List<String> fields) {
        return new CourseValidationResult(fields);
    }

    public boolean isValid() {
        return missingFields.isEmpty();
    }
}
