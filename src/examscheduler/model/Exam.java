package examscheduler.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A course's exam placed on a date and time window, with the rooms it runs in
 * simultaneously. Immutable once built.
 */
public class Exam {
    private final String courseId;
    private final int classLevel;
    private final ExamType type;
    private final Timeslot timeslot;
    private final List<Classroom> classrooms; // paralel yürütülecek sınıflar

    public Exam(String courseId, int classLevel, ExamType type, Timeslot timeslot, List<Classroom> classrooms) {
        if (courseId == null || type == null || timeslot == null)
            throw new IllegalArgumentException("course, type and timeslot are required");
        this.courseId = courseId;
        this.classLevel = classLevel;
        this.type = type;
        this.timeslot = timeslot;
        this.classrooms = (classrooms == null) ? List.of() : List.copyOf(classrooms);
    }

    public String getId() {
        return type.name() + "/" + courseId;
    }

    public String getCourseId() {
        return courseId;
    }

    public int getClassLevel() {
        return classLevel;
    }

    public ExamType getType() {
        return type;
    }

    public Timeslot getTimeslot() {
        return timeslot;
    }

    public LocalDate getDate() {
        return timeslot.getDate();
    }

    public LocalTime getStart() {
        return timeslot.getStart();
    }

    public LocalTime getEnd() {
        return timeslot.getEnd();
    }

    public List<Classroom> getClassrooms() {
        return classrooms;
    }

    public boolean usesClassroom(String classroomId) {
        for (Classroom c : classrooms) {
            if (c.getId().equals(classroomId))
                return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Exam)) return false;
        Exam e = (Exam) o;
        return classLevel == e.classLevel && courseId.equals(e.courseId) && type == e.type
                && timeslot.equals(e.timeslot) && classroomIds().equals(e.classroomIds());
    }

    @Override
    public int hashCode() {
        return Objects.hash(courseId, type, timeslot);
    }

    private List<String> classroomIds() {
        return classrooms.stream().map(Classroom::getId).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return courseId + " @ " + timeslot + " " + classrooms;
    }
}
