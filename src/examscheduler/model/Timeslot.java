package examscheduler.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

public class Timeslot implements Comparable<Timeslot> {
    private final LocalDate date;
    private final LocalTime start;
    private final LocalTime end; // [start, end)

    public Timeslot(LocalDate date, LocalTime start, LocalTime end) {
        if (date == null || start == null || end == null)
            throw new IllegalArgumentException("null time");
        if (!start.isBefore(end))
            throw new IllegalArgumentException("start must be before end");
        this.date = date;
        this.start = start;
        this.end = end;
    }

    public static Timeslot of(LocalDate date, LocalTime start, int durationMinutes) {
        return new Timeslot(date, start, start.plusMinutes(durationMinutes));
    }

    public LocalDate getDate() { return date; }
    public LocalTime getStart() { return start; }
    public LocalTime getEnd() { return end; }

    public int lengthMinutes() {
        return (int) Duration.between(start, end).toMinutes();
    }

    /**
     * Same date and the two windows, each stretched by {@code bufferMinutes} after its end,
     * intersect.
     */
    public boolean overlaps(Timeslot other, int bufferMinutes) {
        if (!date.equals(other.date))
            return false;
        int aStart = start.toSecondOfDay() / 60;
        int aEnd = end.toSecondOfDay() / 60 + bufferMinutes;
        int bStart = other.start.toSecondOfDay() / 60;
        int bEnd = other.end.toSecondOfDay() / 60 + bufferMinutes;
        return aStart < bEnd && bStart < aEnd;
    }

    @Override
    public int compareTo(Timeslot o) {
        int c = date.compareTo(o.date);
        if (c != 0) return c;
        c = start.compareTo(o.start);
        return c != 0 ? c : end.compareTo(o.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Timeslot)) return false;
        Timeslot t = (Timeslot) o;
        return date.equals(t.date) && start.equals(t.start) && end.equals(t.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, start, end);
    }

    @Override
    public String toString() {
        return date + " " + start + "-" + end;
    }
}
