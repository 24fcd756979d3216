package examscheduler.constraints;

import examscheduler.model.Classroom;
import examscheduler.model.Exam;

public class OneExamPerRoomPerTime implements Constraint {

    private final int breakMinutes;

    public OneExamPerRoomPerTime(int breakMinutes) {
        this.breakMinutes = breakMinutes;
    }

    @Override
    public boolean test(PartialSchedule state, Exam cand) {
        if (cand.getClassrooms().isEmpty())
            return true;
        for (Exam placed : state.getPlacements().values()) {
            if (placed.getCourseId().equals(cand.getCourseId()))
                continue;
            if (!ExamValidator.overlaps(placed, cand, breakMinutes))
                continue;
            for (Classroom r : cand.getClassrooms()) {
                if (placed.usesClassroom(r.getId()))
                    return false; // aynı anda aynı sınıf kullanılamaz
            }
        }
        return true;
    }

    @Override
    public String getViolationMessage() {
        return "Room is already occupied at that time";
    }
}
