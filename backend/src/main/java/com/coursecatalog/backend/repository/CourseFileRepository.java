package com.coursecatalog.backend.repository;

import com.coursecatalog.backend.config.StorageProperties;
import com.coursecatalog.backend.exception.CatalogStorageException;
import com.coursecatalog.backend.model.Course;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Course catalog kept as a single JSON array on disk. A missing file reads as an empty catalog.
 * Courses are only ever appended; the whole array is rewritten on each append.
 */
@Slf4j
@Repository
public class CourseFileRepository {

    private static final TypeReference<List<Course>> COURSE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path courseFile;
    private final ReentrantLock appendLock = new ReentrantLock();

    @Autowired
    public CourseFileRepository(ObjectMapper objectMapper, StorageProperties properties) {
        this(objectMapper, Path.of(properties.getCourseFile()));
    }

    public CourseFileRepository(ObjectMapper objectMapper, Path courseFile) {
        this.objectMapper = objectMapper;
        this.courseFile = courseFile;
    }

    public List<Course> findAll() {
        if (!Files.exists(courseFile)) {
            return List.of();
        }
        try {
            List<Course> courses = objectMapper.readValue(courseFile.toFile(), COURSE_LIST);
            return courses == null ? List.of() : courses;
        } catch (IOException e) {
            throw new CatalogStorageException("Failed to read course catalog " + courseFile, e);
        }
    }

    public Optional<Course> findByCode(String code) {
        return findAll().stream()
                .filter(course -> Objects.equals(course.getCode(), code))
                .findFirst();
    }

    public Course append(Course course) {
        appendLock.lock();
        try {
            List<Course> courses = new ArrayList<>(findAll());
            courses.add(course);
            Path directory = courseFile.toAbsolutePath().getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(courseFile.toFile(), courses);
            log.debug("Appended course {} ({} courses in catalog)", course.getCode(), courses.size());
            return course;
        } catch (IOException e) {
            throw new CatalogStorageException("Failed to write course catalog " + courseFile, e);
        } finally {
            appendLock.unlock();
        }
    }
}
