package examscheduler.constraints;

import examscheduler.model.Exam;

public interface Constraint {
    // Aday sınav kurala uyuyor mu?
    boolean test(PartialSchedule state, Exam candidate);

    // Kural ihlal edilirse gösterilecek mesaj
    String getViolationMessage();
}
