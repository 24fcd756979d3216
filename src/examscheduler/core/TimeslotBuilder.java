package examscheduler.core;

import examscheduler.config.SchedulingConfig;
import examscheduler.model.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

public class TimeslotBuilder {

    /**
     * One window per usable date of the exam period: excluded weekdays are
     * skipped, every remaining day gets the configured operating hours.
     */
    public List<DayWindow> buildDayWindows(ExamWindow window, SchedulingConfig config) {
        List<DayWindow> result = new ArrayList<>();
        TimeRange hours = new TimeRange(config.getDayStart(), config.getDayEnd());
        for (LocalDate d = window.getStart(); !d.isAfter(window.getEnd()); d = d.plusDays(1)) {
            if (config.getExcludedDays().contains(d.getDayOfWeek()))
                continue;
            result.add(new DayWindow(d, List.of(hours)));
        }
        return result;
    }

    /**
     * Every start time on the step grid whose exam still ends inside the range,
     * in date then time order.
     */
    public List<Timeslot> build(List<DayWindow> dayWindows, int durationMinutes, int stepMinutes) {
        List<Timeslot> result = new ArrayList<>();
        if (durationMinutes <= 0 || stepMinutes <= 0)
            return result;

        for (DayWindow dw : dayWindows) {
            for (TimeRange r : dw.getRanges()) {
                if (durationMinutes > r.lengthMinutes())
                    continue;
                int startMin = r.getStart().toSecondOfDay() / 60;
                int lastStart = r.getEnd().toSecondOfDay() / 60 - durationMinutes;

                // LocalTime wraps at midnight, so walk in minutes
                for (int m = startMin; m <= lastStart; m += stepMinutes) {
                    LocalTime start = LocalTime.ofSecondOfDay(m * 60L);
                    result.add(Timeslot.of(dw.getDate(), start, durationMinutes));
                }
            }
        }
        return result;
    }
}
