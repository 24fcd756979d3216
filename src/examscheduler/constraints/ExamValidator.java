package examscheduler.constraints;

import examscheduler.model.Classroom;
import examscheduler.model.Exam;
import examscheduler.model.ExamWindow;
import examscheduler.model.SeatAssignment;
import examscheduler.model.SeatSpacing;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.*;

/**
 * Side-effect free checks shared by the timetable scheduler and the seating
 * assigner. Both engines call these before committing anything.
 */
public final class ExamValidator {

    private ExamValidator() {
    }

    /** Time windows intersect on the same date. Back-to-back exams do not overlap. */
    public static boolean overlaps(Exam a, Exam b) {
        return overlaps(a, b, 0);
    }

    /** Like {@link #overlaps(Exam, Exam)} but each exam keeps its room/students for {@code breakMinutes} more. */
    public static boolean overlaps(Exam a, Exam b, int breakMinutes) {
        return a.getTimeslot().overlaps(b.getTimeslot(), breakMinutes);
    }

    /**
     * Would the class-level's exam count on {@code date} go above {@code dailyCap}
     * once {@code proposed} is added? A scheduled exam of the same course is not
     * counted twice.
     */
    public static boolean dailyCountExceeded(int classLevel, LocalDate date, Exam proposed,
                                             Collection<Exam> scheduled, int dailyCap) {
        int count = 0;
        for (Exam e : scheduled) {
            if (e.getCourseId().equals(proposed.getCourseId()))
                continue;
            if (e.getClassLevel() == classLevel && e.getDate().equals(date))
                count++;
        }
        if (proposed.getClassLevel() == classLevel && proposed.getDate().equals(date))
            count++;
        return count > dailyCap;
    }

    public static boolean dailyCountExceeded(Exam proposed, Collection<Exam> scheduled, int dailyCap) {
        return dailyCountExceeded(proposed.getClassLevel(), proposed.getDate(), proposed, scheduled, dailyCap);
    }

    public static boolean capacitySufficient(Collection<Classroom> classrooms, int studentCount) {
        return capacitySufficient(classrooms, studentCount, SeatSpacing.FULL);
    }

    public static boolean capacitySufficient(Collection<Classroom> classrooms, int studentCount, SeatSpacing spacing) {
        return seatShortfall(classrooms, studentCount, spacing) == 0;
    }

    /** Students left without a seat, 0 when everybody fits. */
    public static int seatShortfall(Collection<Classroom> classrooms, int studentCount, SeatSpacing spacing) {
        return Math.max(0, studentCount - availableSeats(classrooms, spacing));
    }

    public static int availableSeats(Collection<Classroom> classrooms, SeatSpacing spacing) {
        int seats = 0;
        for (Classroom c : classrooms)
            seats += c.usableSeats(spacing);
        return seats;
    }

    public static boolean withinWindow(Exam exam, ExamWindow window, LocalTime dayStart, LocalTime dayEnd) {
        return window.contains(exam.getDate())
                && !exam.getStart().isBefore(dayStart)
                && !exam.getEnd().isAfter(dayEnd);
    }

    /**
     * Every invariant of a finished schedule. Returns human readable violations,
     * empty when the schedule can be committed. With {@code noParallel} no two
     * exams may overlap at all, break included.
     */
    public static List<String> verifySchedule(List<Exam> exams, Map<String, Set<String>> conflicts,
                                              ExamWindow window, LocalTime dayStart, LocalTime dayEnd,
                                              int dailyCap, int breakMinutes, boolean noParallel) {
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < exams.size(); i++) {
            Exam a = exams.get(i);
            if (!withinWindow(a, window, dayStart, dayEnd))
                violations.add(a.getCourseId() + " is outside the exam window or operating hours");
            if (dailyCountExceeded(a, exams, dailyCap))
                violations.add("class level " + a.getClassLevel() + " exceeds " + dailyCap + " exams on " + a.getDate());

            for (int j = i + 1; j < exams.size(); j++) {
                Exam b = exams.get(j);
                boolean shareStudents = conflicts.getOrDefault(a.getCourseId(), Collections.emptySet())
                        .contains(b.getCourseId());
                if (shareStudents && overlaps(a, b, breakMinutes))
                    violations.add(a.getCourseId() + " and " + b.getCourseId() + " share students and overlap");
                if (noParallel && overlaps(a, b, breakMinutes))
                    violations.add(a.getCourseId() + " and " + b.getCourseId() + " run in parallel");
                if (overlaps(a, b, breakMinutes)) {
                    for (Classroom r : a.getClassrooms()) {
                        if (b.usesClassroom(r.getId()))
                            violations.add(r.getId() + " is double booked by " + a.getCourseId() + " and " + b.getCourseId());
                    }
                }
            }
        }
        return violations;
    }

    /**
     * Seat uniqueness, student uniqueness and per-room capacity for one exam's assignments.
     */
    public static List<String> verifySeating(List<SeatAssignment> assignments, Collection<Classroom> classrooms,
                                             SeatSpacing spacing) {
        List<String> violations = new ArrayList<>();
        Set<String> seats = new HashSet<>();
        Set<String> students = new HashSet<>();
        Map<String, Integer> perRoom = new HashMap<>();

        for (SeatAssignment a : assignments) {
            String key = a.getExamId() + "|" + a.getClassroomId() + "|" + a.getSeat();
            if (!seats.add(key))
                violations.add("seat " + a.getSeat() + " in " + a.getClassroomId() + " assigned twice");
            if (!students.add(a.getExamId() + "|" + a.getStudentId()))
                violations.add("student " + a.getStudentId() + " seated twice");
            perRoom.merge(a.getClassroomId(), 1, Integer::sum);
        }
        for (Classroom c : classrooms) {
            int used = perRoom.getOrDefault(c.getId(), 0);
            if (used > c.usableSeats(spacing))
                violations.add(c.getId() + " holds " + used + " students, capacity " + c.usableSeats(spacing));
        }
        return violations;
    }
}
