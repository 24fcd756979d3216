package examscheduler.model;

import java.util.Objects;

public class SeatAssignment {
    private final String examId;
    private final String classroomId;
    private final Seat seat;
    private final String studentId;

    public SeatAssignment(String examId, String classroomId, Seat seat, String studentId) {
        this.examId = examId;
        this.classroomId = classroomId;
        this.seat = seat;
        this.studentId = studentId;
    }

    public String getExamId() { return examId; }
    public String getClassroomId() { return classroomId; }
    public Seat getSeat() { return seat; }
    public String getStudentId() { return studentId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeatAssignment)) return false;
        SeatAssignment a = (SeatAssignment) o;
        return examId.equals(a.examId) && classroomId.equals(a.classroomId)
                && seat.equals(a.seat) && studentId.equals(a.studentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(examId, classroomId, seat, studentId);
    }

    @Override
    public String toString() {
        return studentId + " -> " + classroomId + " " + seat;
    }
}
