package com.coursecatalog.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the course catalog file. Stored as-is; the catalog is append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Course {

    private String code;
    private String name;
    private String instructor;
    private String semester;
    private String schedule;
    private String classroom;
    private String prerequisites;
    private String grading;
    private String description;
}
