package examscheduler.service;

import examscheduler.model.ExamSchedule;
import examscheduler.model.SeatAssignment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A committed schedule with the seating plan of each of its exams. */
public class ExamPlan {
    private final ExamSchedule schedule;
    private final Map<String, List<SeatAssignment>> seating;

    public ExamPlan(ExamSchedule schedule, Map<String, List<SeatAssignment>> seating) {
        this.schedule = schedule;
        this.seating = Collections.unmodifiableMap(new LinkedHashMap<>(seating));
    }

    public ExamSchedule getSchedule() {
        return schedule;
    }

    /** examId -> seat assignments */
    public Map<String, List<SeatAssignment>> getSeating() {
        return seating;
    }

    public List<SeatAssignment> seatingOf(String examId) {
        return seating.getOrDefault(examId, List.of());
    }
}
