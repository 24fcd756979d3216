package examscheduler.config;

import examscheduler.model.SeatSpacing;

import java.io.IOException;
import java.io.InputStream;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Tunables of a scheduling run. Defaults follow the exam office's usual setup:
 * 09:00-17:00, 75 minute exams, 15 minutes between exams, weekends off.
 */
public class SchedulingConfig {
    public static final String RESOURCE = "scheduler.properties";

    public static final LocalTime DEFAULT_DAY_START = LocalTime.of(9, 0);
    public static final LocalTime DEFAULT_DAY_END = LocalTime.of(17, 0);
    public static final int DEFAULT_DURATION_MINUTES = 75;
    public static final int DEFAULT_BREAK_MINUTES = 15;
    public static final int GRID_MINUTES = 15;
    public static final int MAX_EXAMS_PER_DAY = 2;
    public static final int MAX_BACKTRACK_STEPS = 10_000;
    public static final long DEADLINE_MS = 60000;
    public static final long RANDOM_SEED = 42L;

    private final LocalTime dayStart;
    private final LocalTime dayEnd;
    private final int defaultDurationMinutes;
    private final int breakMinutes;
    private final int stepMinutes;
    private final int maxExamsPerDay;
    private final Set<DayOfWeek> excludedDays;
    private final boolean noParallelExams;
    private final int maxBacktrackSteps;
    private final long deadlineMs;
    private final SeatSpacing seatSpacing;
    private final long randomSeed;

    private SchedulingConfig(Builder b) {
        this.dayStart = b.dayStart;
        this.dayEnd = b.dayEnd;
        this.defaultDurationMinutes = b.defaultDurationMinutes;
        this.breakMinutes = b.breakMinutes;
        this.stepMinutes = b.stepMinutes;
        this.maxExamsPerDay = b.maxExamsPerDay;
        this.excludedDays = Collections.unmodifiableSet(
                b.excludedDays.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(b.excludedDays));
        this.noParallelExams = b.noParallelExams;
        this.maxBacktrackSteps = b.maxBacktrackSteps;
        this.deadlineMs = b.deadlineMs;
        this.seatSpacing = b.seatSpacing;
        this.randomSeed = b.randomSeed;
    }

    public static SchedulingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@value #RESOURCE} from the classpath. Missing file or keys fall back
     * to the defaults.
     */
    public static SchedulingConfig load() throws IOException {
        Properties props = new Properties();
        try (InputStream in = SchedulingConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                props.load(in);
        }
        return fromProperties(props);
    }

    public static SchedulingConfig fromProperties(Properties p) {
        Builder b = builder();
        String v;
        if ((v = value(p, "scheduler.hours.start")) != null) b.dayStart(parseTime("scheduler.hours.start", v));
        if ((v = value(p, "scheduler.hours.end")) != null) b.dayEnd(parseTime("scheduler.hours.end", v));
        if ((v = value(p, "scheduler.duration.default")) != null)
            b.defaultDurationMinutes(parseInt("scheduler.duration.default", v));
        if ((v = value(p, "scheduler.break.minutes")) != null) b.breakMinutes(parseInt("scheduler.break.minutes", v));
        if ((v = value(p, "scheduler.step.minutes")) != null) b.stepMinutes(parseInt("scheduler.step.minutes", v));
        if ((v = value(p, "scheduler.daily.cap")) != null) b.maxExamsPerDay(parseInt("scheduler.daily.cap", v));
        if ((v = value(p, "scheduler.excluded.days")) != null) b.excludedDays(parseDays("scheduler.excluded.days", v));
        if ((v = value(p, "scheduler.no-parallel")) != null)
            b.noParallelExams(parseBoolean("scheduler.no-parallel", v));
        if ((v = value(p, "scheduler.backtrack.max-steps")) != null)
            b.maxBacktrackSteps(parseInt("scheduler.backtrack.max-steps", v));
        if ((v = value(p, "scheduler.backtrack.deadline-ms")) != null)
            b.deadlineMs(parseLong("scheduler.backtrack.deadline-ms", v));
        if ((v = value(p, "scheduler.seating.spacing")) != null) {
            try {
                b.seatSpacing(SeatSpacing.valueOf(v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("scheduler.seating.spacing: unknown value '" + v + "'", e);
            }
        }
        if ((v = value(p, "scheduler.random.seed")) != null) b.randomSeed(parseLong("scheduler.random.seed", v));
        return b.build();
    }

    private static String value(Properties p, String key) {
        String v = p.getProperty(key);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static LocalTime parseTime(String key, String v) {
        try {
            return LocalTime.parse(v);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(key + ": not a time '" + v + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String v) {
        if (v.equalsIgnoreCase("true"))
            return true;
        if (v.equalsIgnoreCase("false"))
            return false;
        throw new IllegalArgumentException(key + ": not true or false '" + v + "'");
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + ": not a number '" + v + "'", e);
        }
    }

    private static long parseLong(String key, String v) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + ": not a number '" + v + "'", e);
        }
    }

    private static Set<DayOfWeek> parseDays(String key, String v) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (v.equalsIgnoreCase("none"))
            return days;
        for (String part : v.split("[,;\\s]+")) {
            if (part.isEmpty()) continue;
            try {
                days.add(DayOfWeek.valueOf(part.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(key + ": unknown day '" + part + "'", e);
            }
        }
        return days;
    }

    public LocalTime getDayStart() { return dayStart; }
    public LocalTime getDayEnd() { return dayEnd; }
    public int getDefaultDurationMinutes() { return defaultDurationMinutes; }
    public int getBreakMinutes() { return breakMinutes; }
    public int getStepMinutes() { return stepMinutes; }
    public int getMaxExamsPerDay() { return maxExamsPerDay; }
    public Set<DayOfWeek> getExcludedDays() { return excludedDays; }
    public boolean isNoParallelExams() { return noParallelExams; }
    public int getMaxBacktrackSteps() { return maxBacktrackSteps; }
    public long getDeadlineMs() { return deadlineMs; }
    public SeatSpacing getSeatSpacing() { return seatSpacing; }
    public long getRandomSeed() { return randomSeed; }

    public Builder toBuilder() {
        return builder()
                .dayStart(dayStart)
                .dayEnd(dayEnd)
                .defaultDurationMinutes(defaultDurationMinutes)
                .breakMinutes(breakMinutes)
                .stepMinutes(stepMinutes)
                .maxExamsPerDay(maxExamsPerDay)
                .excludedDays(excludedDays)
                .noParallelExams(noParallelExams)
                .maxBacktrackSteps(maxBacktrackSteps)
                .deadlineMs(deadlineMs)
                .seatSpacing(seatSpacing)
                .randomSeed(randomSeed);
    }

    public static class Builder {
        private LocalTime dayStart = DEFAULT_DAY_START;
        private LocalTime dayEnd = DEFAULT_DAY_END;
        private int defaultDurationMinutes = DEFAULT_DURATION_MINUTES;
        private int breakMinutes = DEFAULT_BREAK_MINUTES;
        private int stepMinutes = GRID_MINUTES;
        private int maxExamsPerDay = MAX_EXAMS_PER_DAY;
        private Set<DayOfWeek> excludedDays = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
        private boolean noParallelExams = false;
        private int maxBacktrackSteps = MAX_BACKTRACK_STEPS;
        private long deadlineMs = DEADLINE_MS;
        private SeatSpacing seatSpacing = SeatSpacing.FULL;
        private long randomSeed = RANDOM_SEED;

        public Builder dayStart(LocalTime v) { this.dayStart = v; return this; }
        public Builder dayEnd(LocalTime v) { this.dayEnd = v; return this; }
        public Builder defaultDurationMinutes(int v) { this.defaultDurationMinutes = v; return this; }
        public Builder breakMinutes(int v) { this.breakMinutes = v; return this; }
        public Builder stepMinutes(int v) { this.stepMinutes = v; return this; }
        public Builder maxExamsPerDay(int v) { this.maxExamsPerDay = v; return this; }
        public Builder noParallelExams(boolean v) { this.noParallelExams = v; return this; }
        public Builder maxBacktrackSteps(int v) { this.maxBacktrackSteps = v; return this; }
        public Builder deadlineMs(long v) { this.deadlineMs = v; return this; }
        public Builder seatSpacing(SeatSpacing v) { this.seatSpacing = v; return this; }
        public Builder randomSeed(long v) { this.randomSeed = v; return this; }

        public Builder excludedDays(Set<DayOfWeek> v) {
            this.excludedDays = (v == null) ? EnumSet.noneOf(DayOfWeek.class) : v;
            return this;
        }

        public Builder noExcludedDays() {
            return excludedDays(EnumSet.noneOf(DayOfWeek.class));
        }

        public SchedulingConfig build() {
            if (dayStart == null || dayEnd == null)
                throw new IllegalArgumentException("operating hours are required");
            if (seatSpacing == null)
                throw new IllegalArgumentException("seat spacing is required");
            return new SchedulingConfig(this);
        }
    }
}
