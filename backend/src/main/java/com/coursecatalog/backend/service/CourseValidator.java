package com.coursecatalog.backend.service;

import com.coursecatalog.backend.dto.CourseRequest;
import com.coursecatalog.backend.dto.CourseValidationResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Checks a submitted course against {@link CourseRequest#REQUIRED_FIELDS}. Missing fields are
 * reported in declaration order.
 */
@Component
@RequiredArgsConstructor
public class CourseValidator {

    private final Validator validator;

    public CourseValidationResult validate(CourseRequest request) {
        if (request == null) {
            return CourseValidationResult.missing(CourseRequest.REQUIRED_FIELDS);
        }
        Set<ConstraintViolation<CourseRequest>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return CourseValidationResult.ok();
        }
        List<String> missing = violations.stream()
                .map(violation -> violation.getPropertyPath().toString())
                .distinct()
                .sorted(Comparator.comparingInt(CourseRequest.REQUIRED_FIELDS::indexOf))
                .toList();
        return CourseValidationResult.missing(missing);
    }
}
