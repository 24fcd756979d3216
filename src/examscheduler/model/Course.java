package examscheduler.model;

import java.util.Objects;

public class Course {
    private final String id;
    private final String name;
    private final int classLevel;      // 1. sınıf, 2. sınıf ...
    private final int durationMinutes; // 0 = use the configured default

    public Course(String id, int classLevel) {
        this(id, id, classLevel, 0);
    }

    public Course(String id, String name, int classLevel, int durationMinutes) {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("course id is required");
        this.id = id;
        this.name = (name == null) ? id : name;
        this.classLevel = classLevel;
        this.durationMinutes = durationMinutes;
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

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public boolean hasOwnDuration() {
        return durationMinutes != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Course)) return false;
        return id.equals(((Course) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
