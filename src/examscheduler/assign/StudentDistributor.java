package examscheduler.assign;

import examscheduler.constraints.ExamValidator;
import examscheduler.core.CapacityShortfallException;
import examscheduler.core.InputValidator;
import examscheduler.core.SchedulingException;
import examscheduler.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Seats the students of one exam. Students are shuffled with the supplied random
 * source, then handed seats in layout order, room by room in the order the rooms
 * are given. Either everybody gets a seat or nothing is returned.
 */
public class StudentDistributor {

    private static final Logger log = LoggerFactory.getLogger(StudentDistributor.class);

    private final SeatSpacing spacing;

    public StudentDistributor(SeatSpacing spacing) {
        this.spacing = spacing;
    }

    /**
     * Per-exam seed: every exam of a run gets its own shuffle while a run stays
     * reproducible from one base seed.
     */
    public static long seedFor(Exam exam, long baseSeed) {
        return baseSeed ^ exam.getCourseId().hashCode() ^ exam.getStart().toSecondOfDay();
    }

    /**
     * @param exam     Yerleşimi yapılacak sınav
     * @param students Bu sınava girecek öğrenciler
     * @param rooms    Paralel kullanılacak sınıflar, doldurma sırasıyla
     * @param seed     Karıştırma tohumu; aynı tohum aynı oturma planını verir
     */
    public List<SeatAssignment> assign(Exam exam, Collection<Student> students, List<Classroom> rooms, long seed)
            throws SchedulingException {
        return assign(exam, students, rooms, new Random(seed));
    }

    public List<SeatAssignment> assign(Exam exam, Collection<Student> students, List<Classroom> rooms, Random random)
            throws SchedulingException {
        InputValidator.checkClassrooms(rooms);

        // input order must not leak into the result, only the random source may
        TreeMap<String, Student> unique = new TreeMap<>();
        for (Student s : students)
            unique.putIfAbsent(s.getId(), s);
        List<String> pool = new ArrayList<>(unique.keySet());

        if (pool.isEmpty()) {
            log.debug("{} has no students, nothing to seat", exam.getId());
            return List.of();
        }

        int available = ExamValidator.availableSeats(rooms, spacing);
        if (!ExamValidator.capacitySufficient(rooms, pool.size(), spacing)) {
            log.warn("{}: {} students but only {} seats in {}", exam.getId(), pool.size(), available, rooms);
            throw new CapacityShortfallException(exam.getId(), pool.size(), available);
        }

        Collections.shuffle(pool, random);

        List<SeatAssignment> out = new ArrayList<>(pool.size());
        int index = 0;
        for (Classroom room : rooms) {
            List<Seat> seats = room.getSeats(spacing);
            int usable = room.usableSeats(spacing);
            int placedHere = 0;

            for (int k = 0; k < usable && index < pool.size(); k++) {
                out.add(new SeatAssignment(exam.getId(), room.getId(), seats.get(k), pool.get(index++)));
                placedHere++;
            }
            log.debug("{}: {} students in {}", exam.getId(), placedHere, room.getId());
            if (index >= pool.size())
                break; // tüm öğrenciler yerleşti
        }

        List<String> violations = ExamValidator.verifySeating(out, rooms, spacing);
        if (index < pool.size() || !violations.isEmpty())
            throw new IllegalStateException("Seating for " + exam.getId() + " is inconsistent: " + violations);

        return Collections.unmodifiableList(out);
    }
}
