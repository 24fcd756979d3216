package examscheduler.config;

import examscheduler.model.SeatSpacing;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingConfigTest {

    @Test
    void defaultsMatchTheExamOffice() {
        SchedulingConfig c = SchedulingConfig.defaults();

        assertEquals(LocalTime.of(9, 0), c.getDayStart());
        assertEquals(LocalTime.of(17, 0), c.getDayEnd());
        assertEquals(75, c.getDefaultDurationMinutes());
        assertEquals(15, c.getBreakMinutes());
        assertEquals(2, c.getMaxExamsPerDay());
        assertEquals(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), c.getExcludedDays());
        assertFalse(c.isNoParallelExams());
        assertEquals(SeatSpacing.FULL, c.getSeatSpacing());
    }

    @Test
    void readsProperties() {
        Properties p = new Properties();
        p.setProperty("scheduler.hours.start", "08:30");
        p.setProperty("scheduler.duration.default", "90");
        p.setProperty("scheduler.daily.cap", "3");
        p.setProperty("scheduler.excluded.days", "sunday");
        p.setProperty("scheduler.no-parallel", "true");
        p.setProperty("scheduler.seating.spacing", "spaced");
        p.setProperty("scheduler.random.seed", "7");

        SchedulingConfig c = SchedulingConfig.fromProperties(p);

        assertEquals(LocalTime.of(8, 30), c.getDayStart());
        assertEquals(LocalTime.of(17, 0), c.getDayEnd());
        assertEquals(90, c.getDefaultDurationMinutes());
        assertEquals(3, c.getMaxExamsPerDay());
        assertEquals(EnumSet.of(DayOfWeek.SUNDAY), c.getExcludedDays());
        assertTrue(c.isNoParallelExams());
        assertEquals(SeatSpacing.SPACED, c.getSeatSpacing());
        assertEquals(7L, c.getRandomSeed());
    }

    @Test
    void noneClearsExcludedDays() {
        Properties p = new Properties();
        p.setProperty("scheduler.excluded.days", "none");

        assertTrue(SchedulingConfig.fromProperties(p).getExcludedDays().isEmpty());
    }

    @Test
    void malformedValueNamesTheKey() {
        Properties p = new Properties();
        p.setProperty("scheduler.break.minutes", "fifteen");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SchedulingConfig.fromProperties(p));
        assertTrue(e.getMessage().contains("scheduler.break.minutes"));
    }

    @Test
    void noParallelFlagMustBeTrueOrFalse() {
        Properties p = new Properties();
        p.setProperty("scheduler.no-parallel", "TRUE");
        assertTrue(SchedulingConfig.fromProperties(p).isNoParallelExams());

        p.setProperty("scheduler.no-parallel", "yes");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SchedulingConfig.fromProperties(p));
        assertTrue(e.getMessage().contains("scheduler.no-parallel"));
    }

    @Test
    void loadsBundledProperties() throws Exception {
        SchedulingConfig c = SchedulingConfig.load();

        assertEquals(LocalTime.of(9, 0), c.getDayStart());
        assertEquals(15, c.getStepMinutes());
        assertEquals(10_000, c.getMaxBacktrackSteps());
        assertEquals(42L, c.getRandomSeed());
    }

    @Test
    void toBuilderKeepsValues() {
        SchedulingConfig c = SchedulingConfig.builder().breakMinutes(0).stepMinutes(30).build();

        SchedulingConfig copy = c.toBuilder().maxExamsPerDay(4).build();

        assertEquals(0, copy.getBreakMinutes());
        assertEquals(30, copy.getStepMinutes());
        assertEquals(4, copy.getMaxExamsPerDay());
    }
}
