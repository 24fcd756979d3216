package examscheduler.core;

public class CapacityShortfallException extends SchedulingException {
    private final String examId;
    private final int required;
    private final int available;

    public CapacityShortfallException(String examId, int required, int available) {
        super("Not enough seats for " + examId + ": students=" + required
                + ", seats=" + available + ", missing=" + (required - available));
        this.examId = examId;
        this.required = required;
        this.available = available;
    }

    public String getExamId() {
        return examId;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }

    public int getShortfall() {
        return required - available;
    }
}
