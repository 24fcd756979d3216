package examscheduler.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class Student {
    private final String id; // öğrenci numarası
    private final String name;
    private final int classLevel;
    private final Set<String> courseIds;

    public Student(String id, Set<String> courseIds) {
        this(id, "", 0, courseIds);
    }

    public Student(String id, String name, int classLevel, Set<String> courseIds) {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("student id is required");
        this.id = id;
        this.name = (name == null) ? "" : name;
        this.classLevel = classLevel;
        this.courseIds = (courseIds == null)
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(courseIds));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getClassLevel() {
        return classLevel;
    }

    public Set<String> getCourseIds() {
        return courseIds;
    }

    public boolean isEnrolledIn(String courseId) {
        return courseIds.contains(courseId);
    }

    @Override
    public String toString() {
        return id + (name.isEmpty() ? "" : " (" + name + ")");
    }
}
