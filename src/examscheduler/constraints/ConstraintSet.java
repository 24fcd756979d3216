package examscheduler.constraints;

import examscheduler.model.Exam;

import java.util.ArrayList;
import java.util.List;

public class ConstraintSet {
    private final List<Constraint> list = new ArrayList<>();

    public ConstraintSet add(Constraint c) {
        list.add(c);
        return this;
    }

    public boolean ok(PartialSchedule s, Exam candidate) {
        for (Constraint k : list) {
            if (!k.test(s, candidate))
                return false;
        }
        return true;
    }

    public List<String> explain(PartialSchedule s, Exam candidate) {
        List<String> reasons = new ArrayList<>();
        for (Constraint k : list) {
            if (!k.test(s, candidate)) {
                reasons.add(k.getViolationMessage());
            }
        }
        return reasons;
    }
}
