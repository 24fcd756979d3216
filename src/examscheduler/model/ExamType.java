package examscheduler.model;

public enum ExamType {
    MIDTERM,
    FINAL,
    MAKEUP
}
