package examscheduler.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * No valid slot was found for one or more courses within the search budget.
 */
public class InfeasibleScheduleException extends SchedulingException {
    private final List<String> unplaceable;
    private final Map<String, String> reasons;

    public InfeasibleScheduleException(List<String> unplaceable, Map<String, String> reasons) {
        super("Infeasible under current constraints, unplaceable courses: " + unplaceable);
        this.unplaceable = List.copyOf(unplaceable);
        this.reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }

    public List<String> getUnplaceable() {
        return unplaceable;
    }

    /** courseId -> most frequent reason its candidates were rejected. */
    public Map<String, String> getReasons() {
        return reasons;
    }
}
