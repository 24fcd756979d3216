package examscheduler.core;

import examscheduler.config.SchedulingConfig;
import examscheduler.model.Classroom;
import examscheduler.model.Course;
import examscheduler.model.ExamWindow;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Rejects inputs no search could honour, before anything is placed.
 */
public final class InputValidator {

    private InputValidator() {
    }

    public static void checkConfig(SchedulingConfig config) throws InvalidConstraintException {
        if (!config.getDayStart().isBefore(config.getDayEnd()))
            throw new InvalidConstraintException("Operating hours must start before they end: "
                    + config.getDayStart() + "-" + config.getDayEnd());
        if (config.getDefaultDurationMinutes() <= 0)
            throw new InvalidConstraintException("Default exam duration must be positive: "
                    + config.getDefaultDurationMinutes());
        if (config.getBreakMinutes() < 0)
            throw new InvalidConstraintException("Break between exams cannot be negative: " + config.getBreakMinutes());
        if (config.getStepMinutes() <= 0)
            throw new InvalidConstraintException("Start time step must be positive: " + config.getStepMinutes());
        if (config.getMaxBacktrackSteps() <= 0 || config.getDeadlineMs() <= 0)
            throw new InvalidConstraintException("Backtracking budget must be positive");
    }

    public static void checkWindow(ExamWindow window) throws InvalidConstraintException {
        if (window == null)
            throw new InvalidConstraintException("Exam window is required");
        if (window.getEnd().isBefore(window.getStart()))
            throw new InvalidConstraintException("Exam window ends (" + window.getEnd()
                    + ") before it starts (" + window.getStart() + ")");
    }

    public static void checkDailyCap(int dailyCap) throws InvalidConstraintException {
        if (dailyCap < 1)
            throw new InvalidConstraintException("Daily exam cap must be at least 1: " + dailyCap);
    }

    public static void checkClassrooms(Collection<Classroom> classrooms) throws InvalidConstraintException {
        Set<String> ids = new HashSet<>();
        for (Classroom c : classrooms) {
            if (!ids.add(c.getId()))
                throw new InvalidConstraintException("Duplicate classroom " + c.getId());
            if (c.getCapacity() <= 0)
                throw new InvalidConstraintException("Classroom " + c.getId() + " has no capacity: " + c.getCapacity());
            if (c.getRows() <= 0 || c.getColumns() <= 0)
                throw new InvalidConstraintException("Classroom " + c.getId() + " has an empty seat grid: "
                        + c.getRows() + "x" + c.getColumns());
            if (c.getSeatGroup() < 2 || c.getSeatGroup() > 4)
                throw new InvalidConstraintException("Classroom " + c.getId() + " seat group must be 2, 3 or 4: "
                        + c.getSeatGroup());
        }
    }

    public static void checkCourses(Collection<Course> courses, Map<String, Integer> durationOverrides)
            throws InvalidConstraintException {
        Set<String> ids = new HashSet<>();
        for (Course c : courses) {
            if (!ids.add(c.getId()))
                throw new InvalidConstraintException("Duplicate course " + c.getId());
            if (c.hasOwnDuration() && c.getDurationMinutes() < 0)
                throw new InvalidConstraintException("Course " + c.getId() + " has a negative duration: "
                        + c.getDurationMinutes());
        }
        for (Map.Entry<String, Integer> e : durationOverrides.entrySet()) {
            if (e.getValue() == null || e.getValue() <= 0)
                throw new InvalidConstraintException("Duration override for " + e.getKey()
                        + " must be positive: " + e.getValue());
        }
    }
}
