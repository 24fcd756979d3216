package examscheduler.model;

import java.time.LocalDate;

/**
 * Calendar period an exam session may use, both ends inclusive.
 * Ordering of the two dates is checked by the scheduler, not here.
 */
public class ExamWindow {
    private final LocalDate start;
    private final LocalDate end;

    public ExamWindow(LocalDate start, LocalDate end) {
        if (start == null || end == null)
            throw new IllegalArgumentException("null date");
        this.start = start;
        this.end = end;
    }

    public static ExamWindow singleDay(LocalDate date) {
        return new ExamWindow(date, date);
    }

    public LocalDate getStart() { return start; }
    public LocalDate getEnd() { return end; }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
