package com.coursecatalog.backend.controller;

import com.coursecatalog.backend.dto.CourseRequest;
import com.coursecatalog.backend.model.Course;
import com.coursecatalog.backend.service.CourseService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Method names double as the telemetry route ids.
 */
@RestController
@RequestMapping("/api/courses")
@RequiredArgsConstructor
public class CourseController {

    private final CourseService courseService;

    @GetMapping
    public List<Course> courseCatalog() {
        return courseService.listCourses();
    }

    @GetMapping("/{code}")
    public Course courseDetails(@PathVariable("code") String code) {
        return courseService.getCourse(code);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Course submitCourse(@RequestBody(required = false) CourseRequest request) {
        return courseService.addCourse(request);
    }
}
