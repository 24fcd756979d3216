package examscheduler.model;

import java.time.LocalDate;
import java.util.List;

public class DayWindow {
    private final LocalDate date;
    private final List<TimeRange> ranges;

    public DayWindow(LocalDate date, List<TimeRange> ranges) {
        if (date == null || ranges == null || ranges.isEmpty())
            throw new IllegalArgumentException("Invalid day or empty range list");
        this.date = date;
        this.ranges = List.copyOf(ranges);
    }

    public LocalDate getDate() { return date; }
    public List<TimeRange> getRanges() { return ranges; }
}
