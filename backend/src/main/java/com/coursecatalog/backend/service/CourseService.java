package com.coursecatalog.backend.service;

import com.coursecatalog.backend.dto.CourseRequest;
import com.coursecatalog.backend.dto.CourseValidationResult;
import com.coursecatalog.backend.exception.BadRequestException;
import com.coursecatalog.backend.exception.NotFoundException;
import com.coursecatalog.backend.model.Course;
import com.coursecatalog.backend.repository.CourseFileRepository;
import com.coursecatalog.backend.service.telemetry.ErrorReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class CourseService {

    private final CourseFileRepository courseRepository;
    private final CourseValidator courseValidator;
    private final ErrorReporter errorReporter;

    public List<Course> listCourses() {
        return courseRepository.findAll();
    }

    public Course getCourse(String code) {
        return courseRepository.findByCode(code)
                .orElseThrow(() -> {
                    String message = String.format("No course found with code '%s'.", code);
                    errorReporter.report(message);
                    return new NotFoundException(message);
                });
    }

    public Course addCourse(CourseRequest request) {
        CourseValidationResult validation = courseValidator.validate(request);
        if (!validation.isValid()) {
            String message = "Missing required fields: " + String.join(", ", validation.missingFields());
            errorReporter.report(message);
            throw new BadRequestException(message, validation.missingFields());
        }
        Course course = courseRepository.append(request.toCourse());
        log.info("Course '{}' has been successfully added", course.getName());
        return course;
    }
}
