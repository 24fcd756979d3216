package examscheduler.constraints;

import examscheduler.model.Exam;

/**
 * Bir sınıf seviyesi için bir günde en fazla maxPerDay sınav olmasını sağlar.
 */
public class MaxExamsPerDay implements Constraint {

    private final int maxPerDay; // örn: 2

    public MaxExamsPerDay(int maxPerDay) {
        this.maxPerDay = maxPerDay;
    }

    @Override
    public boolean test(PartialSchedule state, Exam cand) {
        return !ExamValidator.dailyCountExceeded(cand, state.getPlacements().values(), maxPerDay);
    }

    @Override
    public String getViolationMessage() {
        return "Daily exam limit per class level exceeded";
    }
}
