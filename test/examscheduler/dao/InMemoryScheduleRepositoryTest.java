package examscheduler.dao;

import examscheduler.model.*;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryScheduleRepositoryTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 11, 17);
    private static final Classroom R1 = new Classroom("R1", 30);

    private final InMemoryScheduleRepository repository = new InMemoryScheduleRepository();

    private static Exam exam(String course, ExamType type, int hour) {
        return new Exam(course, 1, type, Timeslot.of(MONDAY, LocalTime.of(hour, 0), 60), List.of(R1));
    }

    private static List<SeatAssignment> seat(Exam exam, String... studentIds) {
        List<SeatAssignment> out = new ArrayList<>();
        for (int i = 0; i < studentIds.length; i++)
            out.add(new SeatAssignment(exam.getId(), "R1", new Seat(1, i + 1), studentIds[i]));
        return out;
    }

    @Test
    void storesExamsAndSeating() {
        Exam a = exam("A", ExamType.FINAL, 11);
        Exam b = exam("B", ExamType.FINAL, 9);

        repository.replace(ExamType.FINAL, Set.of("A", "B"), List.of(a, b), Map.of(a.getId(), seat(a, "s1", "s2")));

        assertEquals(List.of(b, a), repository.findExams(ExamType.FINAL));
        assertEquals(a, repository.findExam("FINAL/A").orElseThrow());
        assertEquals(2, repository.findSeating("FINAL/A").size());
        assertTrue(repository.findSeating("FINAL/B").isEmpty());
        assertTrue(repository.findExams(ExamType.MIDTERM).isEmpty());
    }

    @Test
    void replaceDropsOnlyTheSameTypeAndCourses() {
        Exam finalA = exam("A", ExamType.FINAL, 9);
        Exam finalB = exam("B", ExamType.FINAL, 10);
        Exam midtermA = exam("A", ExamType.MIDTERM, 9);
        repository.replace(ExamType.FINAL, Set.of("A", "B"), List.of(finalA, finalB),
                Map.of(finalA.getId(), seat(finalA, "s1")));
        repository.replace(ExamType.MIDTERM, Set.of("A"), List.of(midtermA), Map.of());

        Exam movedA = exam("A", ExamType.FINAL, 14);
        repository.replace(ExamType.FINAL, Set.of("A"), List.of(movedA), Map.of());

        assertEquals(List.of(finalB, movedA), repository.findExams(ExamType.FINAL));
        assertEquals(List.of(midtermA), repository.findExams(ExamType.MIDTERM));
        // the old seating went with the old exam
        assertTrue(repository.findSeating("FINAL/A").isEmpty());
    }

    @Test
    void replacingWithNothingRemovesTheCourses() {
        Exam a = exam("A", ExamType.FINAL, 9);
        repository.replace(ExamType.FINAL, Set.of("A"), List.of(a), Map.of());

        repository.replace(ExamType.FINAL, Set.of("A"), List.of(), Map.of());

        assertTrue(repository.findExam("FINAL/A").isEmpty());
    }

    @Test
    void invalidReplaceLeavesPreviousRecords() {
        Exam a = exam("A", ExamType.FINAL, 9);
        repository.replace(ExamType.FINAL, Set.of("A"), List.of(a), Map.of(a.getId(), seat(a, "s1")));

        Exam wrongType = exam("A", ExamType.MIDTERM, 10);
        assertThrows(IllegalArgumentException.class,
                () -> repository.replace(ExamType.FINAL, Set.of("A"), List.of(wrongType), Map.of()));
        Exam outsider = exam("Z", ExamType.FINAL, 10);
        assertThrows(IllegalArgumentException.class,
                () -> repository.replace(ExamType.FINAL, Set.of("A"), List.of(outsider), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> repository.replace(ExamType.FINAL, Set.of("A"), List.of(),
                        Map.of("FINAL/A", seat(a, "s1"))));

        assertEquals(List.of(a), repository.findExams(ExamType.FINAL));
        assertEquals(1, repository.findSeating("FINAL/A").size());
    }

    @Test
    void replaceSeatingSwapsOneExam() {
        Exam a = exam("A", ExamType.FINAL, 9);
        repository.replace(ExamType.FINAL, Set.of("A"), List.of(a), Map.of(a.getId(), seat(a, "s1")));

        repository.replaceSeating(a.getId(), seat(a, "s2", "s3"));

        assertEquals(List.of("s2", "s3"), repository.findSeating(a.getId()).stream()
                .map(SeatAssignment::getStudentId).collect(Collectors.toList()));
    }

    @Test
    void replaceSeatingRejectsUnknownOrForeignAssignments() {
        Exam a = exam("A", ExamType.FINAL, 9);
        Exam b = exam("B", ExamType.FINAL, 10);
        repository.replace(ExamType.FINAL, Set.of("A", "B"), List.of(a, b), Map.of());

        assertThrows(IllegalArgumentException.class, () -> repository.replaceSeating("FINAL/X", List.of()));
        assertThrows(IllegalArgumentException.class, () -> repository.replaceSeating(a.getId(), seat(b, "s1")));
    }

    @Test
    void storedSeatingCannotBeModified() {
        Exam a = exam("A", ExamType.FINAL, 9);
        repository.replace(ExamType.FINAL, Set.of("A"), List.of(a), Map.of(a.getId(), seat(a, "s1")));

        assertThrows(UnsupportedOperationException.class, () -> repository.findSeating(a.getId()).clear());
    }
}
