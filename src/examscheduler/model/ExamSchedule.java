package examscheduler.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Committed result of one scheduling run: every selected course's exam, ordered
 * by date and start time.
 */
public class ExamSchedule {
    private final ExamType type;
    private final List<Exam> exams;

    public ExamSchedule(ExamType type, List<Exam> exams) {
        this.type = type;
        List<Exam> sorted = new ArrayList<>(exams);
        sorted.sort(Comparator.comparing(Exam::getTimeslot).thenComparing(Exam::getCourseId));
        this.exams = Collections.unmodifiableList(sorted);
    }

    public ExamType getType() {
        return type;
    }

    public List<Exam> getExams() {
        return exams;
    }

    public Optional<Exam> find(String courseId) {
        return exams.stream().filter(e -> e.getCourseId().equals(courseId)).findFirst();
    }

    public int size() {
        return exams.size();
    }

    public Map<LocalDate, Integer> examsPerDate() {
        Map<LocalDate, Integer> load = new TreeMap<>();
        for (Exam e : exams)
            load.merge(e.getDate(), 1, Integer::sum);
        return load;
    }

    public int daysUsed() {
        return examsPerDate().size();
    }
}
