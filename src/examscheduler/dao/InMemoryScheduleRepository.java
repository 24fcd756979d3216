package examscheduler.dao;

import examscheduler.model.Exam;
import examscheduler.model.ExamType;
import examscheduler.model.SeatAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Keeps everything in an immutable snapshot that is swapped on every write.
 * Writers are serialized; readers never block and never see a half-applied replace.
 */
public class InMemoryScheduleRepository implements ScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScheduleRepository.class);

    private volatile Snapshot snapshot = new Snapshot(Map.of(), Map.of());

    @Override
    public synchronized void replace(ExamType type, Set<String> courseIds, List<Exam> exams,
                                     Map<String, List<SeatAssignment>> seating) {
        Set<String> newExamIds = new HashSet<>();
        for (Exam e : exams) {
            if (e.getType() != type)
                throw new IllegalArgumentException(e.getId() + " is not a " + type + " exam");
            if (!courseIds.contains(e.getCourseId()))
                throw new IllegalArgumentException(e.getCourseId() + " is not among the replaced courses");
            newExamIds.add(e.getId());
        }
        for (String examId : seating.keySet()) {
            if (!newExamIds.contains(examId))
                throw new IllegalArgumentException("Seating for unknown exam " + examId);
        }

        Snapshot current = snapshot;
        Map<String, Exam> examsById = new LinkedHashMap<>(current.exams);
        Map<String, List<SeatAssignment>> seatsByExam = new HashMap<>(current.seating);

        // önce aynı türdeki eski kayıtları sil
        Iterator<Map.Entry<String, Exam>> it = examsById.entrySet().iterator();
        int removed = 0;
        while (it.hasNext()) {
            Exam old = it.next().getValue();
            if (old.getType() == type && courseIds.contains(old.getCourseId())) {
                it.remove();
                seatsByExam.remove(old.getId());
                removed++;
            }
        }
        for (Exam e : exams)
            examsById.put(e.getId(), e);
        for (Map.Entry<String, List<SeatAssignment>> e : seating.entrySet())
            seatsByExam.put(e.getKey(), List.copyOf(e.getValue()));

        snapshot = new Snapshot(examsById, seatsByExam);
        log.info("Replaced {} {} exams with {} new ones", removed, type, exams.size());
    }

    @Override
    public synchronized void replaceSeating(String examId, List<SeatAssignment> seating) {
        Snapshot current = snapshot;
        if (!current.exams.containsKey(examId))
            throw new IllegalArgumentException("Unknown exam " + examId);
        for (SeatAssignment a : seating) {
            if (!a.getExamId().equals(examId))
                throw new IllegalArgumentException("Assignment " + a + " belongs to " + a.getExamId());
        }
        Map<String, List<SeatAssignment>> seatsByExam = new HashMap<>(current.seating);
        seatsByExam.put(examId, List.copyOf(seating));
        snapshot = new Snapshot(current.exams, seatsByExam);
    }

    @Override
    public List<Exam> findExams(ExamType type) {
        List<Exam> out = new ArrayList<>();
        for (Exam e : snapshot.exams.values()) {
            if (e.getType() == type)
                out.add(e);
        }
        out.sort(Comparator.comparing(Exam::getTimeslot).thenComparing(Exam::getCourseId));
        return out;
    }

    @Override
    public Optional<Exam> findExam(String examId) {
        return Optional.ofNullable(snapshot.exams.get(examId));
    }

    @Override
    public List<SeatAssignment> findSeating(String examId) {
        return snapshot.seating.getOrDefault(examId, List.of());
    }

    private static final class Snapshot {
        final Map<String, Exam> exams;
        final Map<String, List<SeatAssignment>> seating;

        Snapshot(Map<String, Exam> exams, Map<String, List<SeatAssignment>> seating) {
            this.exams = Collections.unmodifiableMap(new LinkedHashMap<>(exams));
            this.seating = Collections.unmodifiableMap(new HashMap<>(seating));
        }
    }
}
