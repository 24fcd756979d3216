package examscheduler.constraints;

import examscheduler.core.ConflictGraph;
import examscheduler.model.Exam;

/**
 * Courses sharing a student may not overlap, and must leave {@code minGapMinutes}
 * between one exam's end and the next one's start.
 */
public class NoStudentClashAndMinGap implements Constraint {
    private final ConflictGraph conflicts;
    private final int minGapMinutes;

    public NoStudentClashAndMinGap(ConflictGraph conflicts, int minGapMinutes) {
        this.conflicts = conflicts;
        this.minGapMinutes = minGapMinutes;
    }

    @Override
    public boolean test(PartialSchedule state, Exam cand) {
        // only neighbours in the conflict graph can clash
        for (String other : conflicts.conflictsOf(cand.getCourseId())) {
            Exam placed = state.get(other);
            if (placed != null && ExamValidator.overlaps(placed, cand, minGapMinutes))
                return false;
        }
        return true;
    }

    @Override
    public String getViolationMessage() {
        return "Student has another exam at that time";
    }
}
