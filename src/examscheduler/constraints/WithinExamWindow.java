package examscheduler.constraints;

import examscheduler.model.Exam;
import examscheduler.model.ExamWindow;

import java.time.LocalTime;

public class WithinExamWindow implements Constraint {

    private final ExamWindow window;
    private final LocalTime dayStart;
    private final LocalTime dayEnd;

    public WithinExamWindow(ExamWindow window, LocalTime dayStart, LocalTime dayEnd) {
        this.window = window;
        this.dayStart = dayStart;
        this.dayEnd = dayEnd;
    }

    @Override
    public boolean test(PartialSchedule state, Exam cand) {
        return ExamValidator.withinWindow(cand, window, dayStart, dayEnd);
    }

    @Override
    public String getViolationMessage() {
        return "Outside the exam period or operating hours";
    }
}
