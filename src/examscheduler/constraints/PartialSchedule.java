package examscheduler.constraints;

import examscheduler.model.Exam;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PartialSchedule {
    // Yerleştirilen dersler (courseId -> Exam), yerleştirme sırasıyla
    private final Map<String, Exam> placements = new LinkedHashMap<>();

    public Map<String, Exam> getPlacements() {
        return Collections.unmodifiableMap(placements);
    }

    public List<Exam> exams() {
        return new ArrayList<>(placements.values());
    }

    public void addPlacement(Exam exam) {
        placements.put(exam.getCourseId(), exam);
    }

    public Exam removePlacement(String courseId) {
        return placements.remove(courseId);
    }

    public Exam get(String courseId) {
        return placements.get(courseId);
    }
}
