package examscheduler.assign;

import examscheduler.core.CapacityShortfallException;
import examscheduler.core.InvalidConstraintException;
import examscheduler.model.*;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StudentDistributorTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 11, 17);

    private final StudentDistributor distributor = new StudentDistributor(SeatSpacing.FULL);

    private static Exam exam(List<Classroom> rooms) {
        return new Exam("CS101", 1, ExamType.FINAL, Timeslot.of(MONDAY, LocalTime.of(9, 0), 75), rooms);
    }

    private static List<Student> students(int n) {
        List<Student> out = new ArrayList<>();
        for (int i = 1; i <= n; i++)
            out.add(new Student(String.format("S%03d", i), Set.of("CS101")));
        return out;
    }

    @Test
    void everyStudentGetsADistinctSeat() throws Exception {
        Classroom r1 = new Classroom("R1", "R1", 30, 5, 3, 2);
        List<Student> students = students(25);

        List<SeatAssignment> seating = distributor.assign(exam(List.of(r1)), students, List.of(r1), 42L);

        assertEquals(25, seating.size());
        assertEquals(25, seating.stream().map(SeatAssignment::getSeat).distinct().count());
        assertEquals(students.stream().map(Student::getId).collect(Collectors.toSet()),
                seating.stream().map(SeatAssignment::getStudentId).collect(Collectors.toSet()));
        seating.forEach(a -> {
            assertEquals("FINAL/CS101", a.getExamId());
            assertEquals("R1", a.getClassroomId());
        });
    }

    @Test
    void shortfallIsReportedWithoutPartialResult() {
        Classroom r1 = new Classroom("R1", "R1", 20, 5, 2, 2);

        CapacityShortfallException e = assertThrows(CapacityShortfallException.class,
                () -> distributor.assign(exam(List.of(r1)), students(25), List.of(r1), 42L));

        assertEquals(5, e.getShortfall());
        assertEquals(25, e.getRequired());
        assertEquals(20, e.getAvailable());
        assertEquals("FINAL/CS101", e.getExamId());
    }

    @Test
    void roomsAreFilledInTheGivenOrder() throws Exception {
        List<Classroom> rooms = List.of(new Classroom("R1", 10), new Classroom("R2", 10));

        List<SeatAssignment> seating = distributor.assign(exam(rooms), students(15), rooms, 7L);

        Map<String, Long> perRoom = seating.stream()
                .collect(Collectors.groupingBy(SeatAssignment::getClassroomId, Collectors.counting()));
        assertEquals(10L, perRoom.get("R1"));
        assertEquals(5L, perRoom.get("R2"));
    }

    @Test
    void sameSeedGivesSameSeating() throws Exception {
        Classroom r1 = new Classroom("R1", "R1", 30, 5, 3, 2);

        List<SeatAssignment> first = distributor.assign(exam(List.of(r1)), students(25), List.of(r1), 99L);
        List<SeatAssignment> second = distributor.assign(exam(List.of(r1)), students(25), List.of(r1), 99L);

        assertEquals(first, second);
    }

    @Test
    void inputOrderDoesNotChangeTheSeating() throws Exception {
        Classroom r1 = new Classroom("R1", "R1", 30, 5, 3, 2);
        List<Student> reversed = students(25);
        Collections.reverse(reversed);

        assertEquals(distributor.assign(exam(List.of(r1)), students(25), List.of(r1), 5L),
                distributor.assign(exam(List.of(r1)), reversed, List.of(r1), 5L));
    }

    @Test
    void differentSeedsShuffleDifferently() throws Exception {
        Classroom r1 = new Classroom("R1", "R1", 30, 5, 3, 2);

        assertNotEquals(distributor.assign(exam(List.of(r1)), students(25), List.of(r1), 1L),
                distributor.assign(exam(List.of(r1)), students(25), List.of(r1), 2L));
    }

    @Test
    void noStudentsGiveNoAssignments() throws Exception {
        Classroom r1 = new Classroom("R1", 10);

        assertTrue(distributor.assign(exam(List.of(r1)), List.of(), List.of(r1), 1L).isEmpty());
    }

    @Test
    void singleStudentTakesTheFirstSeat() throws Exception {
        Classroom r1 = new Classroom("R1", 10);

        List<SeatAssignment> seating = distributor.assign(exam(List.of(r1)), students(1), List.of(r1), 1L);

        assertEquals(1, seating.size());
        assertEquals(new Seat(1, 1), seating.get(0).getSeat());
    }

    @Test
    void spacedSeatingLeavesNeighbourSeatsEmpty() throws Exception {
        StudentDistributor spaced = new StudentDistributor(SeatSpacing.SPACED);
        Classroom r1 = new Classroom("R1", "R1", 30, 5, 3, 2);

        List<SeatAssignment> seating = spaced.assign(exam(List.of(r1)), students(15), List.of(r1), 3L);

        assertEquals(15, seating.size());
        seating.forEach(a -> assertEquals(0, a.getSeat().getColumn() % 2, a.getSeat().toString()));

        CapacityShortfallException e = assertThrows(CapacityShortfallException.class,
                () -> spaced.assign(exam(List.of(r1)), students(16), List.of(r1), 3L));
        assertEquals(1, e.getShortfall());
    }

    @Test
    void duplicateStudentsAreSeatedOnce() throws Exception {
        Classroom r1 = new Classroom("R1", 10);
        List<Student> students = new ArrayList<>(students(3));
        students.add(new Student("S001", Set.of("CS101")));

        List<SeatAssignment> seating = distributor.assign(exam(List.of(r1)), students, List.of(r1), 1L);

        assertEquals(3, seating.size());
    }

    @Test
    void invalidClassroomIsRejected() {
        Classroom broken = new Classroom("R1", "R1", 0, 5, 3, 2);

        assertThrows(InvalidConstraintException.class,
                () -> distributor.assign(exam(List.of(broken)), students(3), List.of(broken), 1L));
    }

    @Test
    void seedDependsOnCourseAndStartTime() {
        Classroom r1 = new Classroom("R1", 10);
        Exam morning = exam(List.of(r1));
        Exam afternoon = new Exam("CS101", 1, ExamType.FINAL,
                Timeslot.of(MONDAY, LocalTime.of(14, 0), 75), List.of(r1));

        assertEquals(StudentDistributor.seedFor(morning, 42L), StudentDistributor.seedFor(morning, 42L));
        assertNotEquals(StudentDistributor.seedFor(morning, 42L), StudentDistributor.seedFor(afternoon, 42L));
    }
}
