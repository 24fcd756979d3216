package examscheduler.dao;

import examscheduler.model.Exam;
import examscheduler.model.ExamType;
import examscheduler.model.SeatAssignment;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stores committed exams and seating plans. Implementations must make each
 * replace visible all at once: readers see either the old records or the new ones.
 */
public interface ScheduleRepository {

    /**
     * Drops the previous {@code type} exams of {@code courseIds} together with their
     * seating, then stores {@code exams} and {@code seating} (examId -> assignments).
     */
    void replace(ExamType type, Set<String> courseIds, List<Exam> exams,
                 Map<String, List<SeatAssignment>> seating);

    /** Re-seats one stored exam. */
    void replaceSeating(String examId, List<SeatAssignment> seating);

    List<Exam> findExams(ExamType type);

    Optional<Exam> findExam(String examId);

    List<SeatAssignment> findSeating(String examId);
}
