package examscheduler.constraints;

import examscheduler.model.Exam;

/**
 * Strict sequential mode: one exam at a time across the whole session.
 */
public class NoParallelExams implements Constraint {

    private final int breakMinutes;

    public NoParallelExams(int breakMinutes) {
        this.breakMinutes = breakMinutes;
    }

    @Override
    public boolean test(PartialSchedule state, Exam cand) {
        for (Exam placed : state.getPlacements().values()) {
            if (!placed.getCourseId().equals(cand.getCourseId())
                    && ExamValidator.overlaps(placed, cand, breakMinutes))
                return false;
        }
        return true;
    }

    @Override
    public String getViolationMessage() {
        return "Another exam is running at that time";
    }
}
