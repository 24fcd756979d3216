package examscheduler.core;

import examscheduler.config.SchedulingConfig;
import examscheduler.model.DayWindow;
import examscheduler.model.ExamWindow;
import examscheduler.model.TimeRange;
import examscheduler.model.Timeslot;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeslotBuilderTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 11, 17);

    private final TimeslotBuilder builder = new TimeslotBuilder();

    @Test
    void skipsExcludedWeekdays() {
        List<DayWindow> days = builder.buildDayWindows(new ExamWindow(MONDAY, MONDAY.plusDays(6)),
                SchedulingConfig.defaults());

        assertEquals(5, days.size());
        assertEquals(MONDAY, days.get(0).getDate());
        assertEquals(MONDAY.plusDays(4), days.get(4).getDate());
    }

    @Test
    void usesEveryDayWhenNothingIsExcluded() {
        SchedulingConfig config = SchedulingConfig.builder().noExcludedDays().build();

        List<DayWindow> days = builder.buildDayWindows(new ExamWindow(MONDAY, MONDAY.plusDays(6)), config);

        assertEquals(7, days.size());
        assertEquals(LocalTime.of(9, 0), days.get(0).getRanges().get(0).getStart());
        assertEquals(LocalTime.of(17, 0), days.get(0).getRanges().get(0).getEnd());
    }

    @Test
    void startsOnTheStepGridAndEndsInsideTheRange() {
        List<DayWindow> days = List.of(new DayWindow(MONDAY,
                List.of(new TimeRange(LocalTime.of(9, 0), LocalTime.of(17, 0)))));

        List<Timeslot> slots = builder.build(days, 75, 15);

        // 09:00 .. 15:45
        assertEquals(28, slots.size());
        assertEquals(LocalTime.of(9, 0), slots.get(0).getStart());
        assertEquals(LocalTime.of(10, 15), slots.get(0).getEnd());
        assertEquals(LocalTime.of(15, 45), slots.get(27).getStart());
        assertEquals(LocalTime.of(17, 0), slots.get(27).getEnd());
    }

    @Test
    void ordersByDateThenTime() {
        List<DayWindow> days = List.of(
                new DayWindow(MONDAY, List.of(new TimeRange(LocalTime.of(9, 0), LocalTime.of(11, 0)))),
                new DayWindow(MONDAY.plusDays(1), List.of(new TimeRange(LocalTime.of(9, 0), LocalTime.of(11, 0)))));

        List<Timeslot> slots = builder.build(days, 60, 60);

        assertEquals(4, slots.size());
        for (int i = 1; i < slots.size(); i++)
            assertTrue(slots.get(i - 1).compareTo(slots.get(i)) < 0);
    }

    @Test
    void examLongerThanTheDayGetsNoSlot() {
        List<DayWindow> days = List.of(new DayWindow(MONDAY,
                List.of(new TimeRange(LocalTime.of(9, 0), LocalTime.of(10, 0)))));

        assertTrue(builder.build(days, 90, 15).isEmpty());
    }
}
