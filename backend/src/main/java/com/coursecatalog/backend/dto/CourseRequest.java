package com.coursecatalog.backend.dto;

import com.coursecatalog.backend.model.Course;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseRequest {

    public static final List<String> REQUIRED_FIELDS = List.of("code", "name", "instructor", "semester");

    @NotBlank
    private String code;
    @NotBlank
    private String name;
    @NotBlank
    private String instructor;
    @NotBlank
    private String semester;
    private String schedule;
    private String classroom;
    private String prerequisites;
    private String grading;
    private String description;

    /**
     * Every field is stored trimmed; absent fields stay null.
     */
    public Course toCourse() {
        return Course.builder()
                .code(trim(code))
                .name(trim(name))
                .instructor(trim(instructor))
                .semester(trim(semester))
                .schedule(trim(schedule))
                .classroom(trim(classroom))
                .prerequisites(trim(prerequisites))
                .grading(trim(grading))
                .description(trim(description))
                .build();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
