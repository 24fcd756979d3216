package examscheduler.core;

import examscheduler.config.SchedulingConfig;
import examscheduler.constraints.*;
import examscheduler.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Places every selected course's exam on a (date, start time, rooms) candidate.
 * <p>
 * Courses are visited hardest first (conflict degree, then enrolment). Each one
 * takes its earliest feasible candidate. When a course has none, the search
 * jumps back to the latest placed course that could be blocking it and moves
 * that course to its next candidate. Decisions live on an explicit stack so an
 * undo is a pop; the number of jumps and the wall time are both capped.
 */
public class ExamScheduler {

        private static final Logger log = LoggerFactory.getLogger(ExamScheduler.class);

        private static final int MAX_ROOM_COMBOS = 50;

        private final SchedulingConfig config;
        private final ConflictGraphBuilder graphBuilder = new ConflictGraphBuilder();
        private final TimeslotBuilder timeslotBuilder = new TimeslotBuilder();

        public ExamScheduler(SchedulingConfig config) {
                this.config = config;
        }

        public ExamSchedule schedule(List<Course> courses,
                        Collection<Student> students,
                        List<Classroom> classrooms,
                        ExamType type,
                        ExamWindow window,
                        int dailyCap,
                        Map<String, Integer> durationOverrides) throws SchedulingException {

                Map<String, Integer> overrides = durationOverrides == null ? Map.of() : durationOverrides;
                InputValidator.checkConfig(config);
                InputValidator.checkWindow(window);
                InputValidator.checkDailyCap(dailyCap);
                InputValidator.checkClassrooms(classrooms);
                InputValidator.checkCourses(courses, overrides);

                List<DayWindow> dayWindows = timeslotBuilder.buildDayWindows(window, config);
                if (dayWindows.isEmpty())
                        throw new InvalidConstraintException("No usable exam date between " + window.getStart()
                                        + " and " + window.getEnd() + " (excluded days: " + config.getExcludedDays() + ")");

                log.info("Scheduling {} {} exams in {} ({} usable days, daily cap {})",
                                courses.size(), type, window, dayWindows.size(), dailyCap);

                // 1. Hazırlık: çakışma grafı, timeslotlar, oda adayları
                ConflictGraph graph = graphBuilder.build(students);
                RoomComboGenerator rcg = new RoomComboGenerator(config.getSeatSpacing());

                Set<String> selected = courses.stream().map(Course::getId).collect(Collectors.toSet());
                for (String id : overrides.keySet()) {
                        if (!selected.contains(id))
                                log.warn("Duration override for unknown course {} ignored", id);
                }

                List<CourseSlots> prepared = new ArrayList<>();
                Map<String, String> hopeless = new LinkedHashMap<>();
                for (Course c : courses) {
                        int duration = resolveDuration(c, overrides);
                        int studentCount = graph.studentCount(c.getId());
                        List<Timeslot> slots = timeslotBuilder.build(dayWindows, duration, config.getStepMinutes());
                        List<List<Classroom>> rooms = rcg.candidates(classrooms, studentCount, MAX_ROOM_COMBOS);

                        if (slots.isEmpty()) {
                                hopeless.put(c.getId(), "Configuration Error: a " + duration
                                                + " minute exam does not fit into operating hours");
                        } else if (rooms.isEmpty()) {
                                hopeless.put(c.getId(), "Infrastructure Error: Insufficient total room capacity (needed="
                                                + studentCount + ", available=" + rcg.totalCapacity(classrooms) + ")");
                        }
                        prepared.add(new CourseSlots(c, studentCount, slots, rooms));
                }
                if (!hopeless.isEmpty()) {
                        hopeless.forEach((id, why) -> log.warn("Course {} cannot be placed: {}", id, why));
                        throw new InfeasibleScheduleException(new ArrayList<>(hopeless.keySet()), hopeless);
                }

                List<CourseSlots> order = sortCourses(prepared, graph);
                ConstraintSet constraints = buildConstraints(graph, window, dailyCap);

                // 2. Arama
                PartialSchedule schedule = new PartialSchedule();
                SearchOutcome outcome = search(order, schedule, constraints, graph, type);
                if (!outcome.complete) {
                        Map<String, String> reasons = diagnose(order, constraints, type, graph);
                        reasons.forEach((id, why) -> log.warn("Course {} unplaceable: {}", id, why));
                        throw new InfeasibleScheduleException(new ArrayList<>(reasons.keySet()), reasons);
                }

                // 3. Doğrulama: tamamı geçerli değilse hiçbir şey dönmez
                List<Exam> exams = schedule.exams();
                List<String> violations = ExamValidator.verifySchedule(exams, graph.asMap(), window,
                                config.getDayStart(), config.getDayEnd(), dailyCap, config.getBreakMinutes(),
                                config.isNoParallelExams());
                if (!violations.isEmpty())
                        throw new IllegalStateException("Scheduler produced an invalid schedule: " + violations);

                ExamSchedule result = new ExamSchedule(type, exams);
                log.info("Scheduled {} exams on {} days after {} backtracks", result.size(), result.daysUsed(),
                                outcome.backtracks);
                return result;
        }

        // --- YARDIMCI METODLAR ---

        private int resolveDuration(Course c, Map<String, Integer> overrides) throws InvalidConstraintException {
                Integer override = overrides.get(c.getId());
                int duration;
                if (override != null)
                        duration = override;
                else if (c.hasOwnDuration())
                        duration = c.getDurationMinutes();
                else
                        duration = config.getDefaultDurationMinutes();
                if (duration <= 0)
                        throw new InvalidConstraintException("Course " + c.getId() + " has a non-positive duration: " + duration);
                return duration;
        }

        private ConstraintSet buildConstraints(ConflictGraph graph, ExamWindow window, int dailyCap) {
                ConstraintSet constraints = new ConstraintSet()
                                .add(new WithinExamWindow(window, config.getDayStart(), config.getDayEnd()))
                                .add(new NoStudentClashAndMinGap(graph, config.getBreakMinutes()))
                                .add(new MaxExamsPerDay(dailyCap))
                                .add(new OneExamPerRoomPerTime(config.getBreakMinutes()));
                if (config.isNoParallelExams())
                        constraints.add(new NoParallelExams(config.getBreakMinutes()));
                return constraints;
        }

        private List<CourseSlots> sortCourses(List<CourseSlots> courses, ConflictGraph graph) {
                List<CourseSlots> sorted = new ArrayList<>(courses);
                sorted.sort(Comparator
                                // 1) Conflict degree (yüksek = zor)
                                .comparingInt((CourseSlots c) -> graph.degree(c.course.getId())).reversed()
                                // 2) Öğrenci sayısı (yüksek = zor)
                                .thenComparing(Comparator.comparingInt((CourseSlots c) -> c.studentCount).reversed())
                                // Stabilite için
                                .thenComparing(c -> c.course.getId()));
                return sorted;
        }

        /**
         * Conflict-directed backjumping over the visit order. Each position keeps the
         * set of earlier positions that may have ruled out its candidates; on a dead
         * end the search resumes at the latest of them.
         */
        private SearchOutcome search(List<CourseSlots> order, PartialSchedule schedule, ConstraintSet constraints,
                        ConflictGraph graph, ExamType type) {
                int n = order.size();
                int[] next = new int[n];
                List<TreeSet<Integer>> conflictSets = new ArrayList<>();
                for (int i = 0; i < n; i++)
                        conflictSets.add(new TreeSet<>());

                Deque<Decision> stack = new ArrayDeque<>();
                long deadline = System.currentTimeMillis() + config.getDeadlineMs();
                int backtracks = 0;
                int pos = 0;

                while (pos < n) {
                        CourseSlots cs = order.get(pos);
                        int found = firstFeasible(cs, next[pos], schedule, constraints, type);

                        if (found >= 0) {
                                Exam placed = cs.candidate(found, type);
                                schedule.addPlacement(placed);
                                stack.push(new Decision(pos, found));
                                log.debug("Placed {} at {}", cs.course.getId(), placed.getTimeslot());
                                pos++;
                                if (pos < n) {
                                        next[pos] = 0;
                                        conflictSets.get(pos).clear();
                                }
                                continue;
                        }

                        // Dead end: who could be in the way?
                        TreeSet<Integer> culprits = conflictSets.get(pos);
                        for (Decision d : stack) {
                                if (related(order.get(d.position), cs, graph))
                                        culprits.add(d.position);
                        }
                        if (culprits.isEmpty()) {
                                log.debug("{} has no candidate left and nothing to undo", cs.course.getId());
                                return new SearchOutcome(false, backtracks);
                        }
                        if (++backtracks > config.getMaxBacktrackSteps() || System.currentTimeMillis() > deadline) {
                                log.warn("Backtracking budget exhausted after {} jumps at course {}", backtracks - 1,
                                                cs.course.getId());
                                return new SearchOutcome(false, backtracks);
                        }

                        int target = culprits.last();
                        TreeSet<Integer> inherited = new TreeSet<>(culprits.headSet(target));

                        Decision undone = stack.pop();
                        schedule.removePlacement(order.get(undone.position).course.getId());
                        while (undone.position > target) {
                                undone = stack.pop();
                                schedule.removePlacement(order.get(undone.position).course.getId());
                        }

                        conflictSets.get(target).addAll(inherited);
                        next[target] = undone.candidateIndex + 1;
                        pos = target;
                }
                return new SearchOutcome(true, backtracks);
        }

        /**
         * Two courses can block each other if they share students, share a class
         * level (daily cap), might compete for a room, or exams are strictly sequential.
         */
        private boolean related(CourseSlots a, CourseSlots b, ConflictGraph graph) {
                if (config.isNoParallelExams())
                        return true;
                if (graph.conflicts(a.course.getId(), b.course.getId()))
                        return true;
                if (a.course.getClassLevel() == b.course.getClassLevel())
                        return true;
                return !Collections.disjoint(a.roomIds, b.roomIds);
        }

        /**
         * Index of the first feasible candidate at or after {@code from}, -1 if none.
         * Candidates are numbered slot-major: all room combinations of a timeslot
         * before the next timeslot.
         */
        private int firstFeasible(CourseSlots cs, int from, PartialSchedule schedule, ConstraintSet constraints,
                        ExamType type) {
                for (int f = from; f < cs.candidateCount(); f++) {
                        Exam cand = cs.candidate(f, type);
                        if (constraints.ok(schedule, cand)
                                        && ExamValidator.capacitySufficient(cand.getClassrooms(), cs.studentCount,
                                                        config.getSeatSpacing()))
                                return f;
                }
                return -1;
        }

        /**
         * Greedy pass without backtracking, used only to explain a failure: every
         * course left without a candidate is reported with its most frequent
         * rejection reason.
         */
        private Map<String, String> diagnose(List<CourseSlots> order, ConstraintSet constraints, ExamType type,
                        ConflictGraph graph) {
                PartialSchedule schedule = new PartialSchedule();
                Map<String, String> reasons = new LinkedHashMap<>();
                for (CourseSlots cs : order) {
                        int found = firstFeasible(cs, 0, schedule, constraints, type);
                        if (found >= 0) {
                                schedule.addPlacement(cs.candidate(found, type));
                        } else {
                                reasons.put(cs.course.getId(), analyzeFailure(cs, schedule, constraints, type, graph));
                        }
                }
                return reasons;
        }

        private String analyzeFailure(CourseSlots cs, PartialSchedule schedule, ConstraintSet constraints,
                        ExamType type, ConflictGraph graph) {
                Map<String, Integer> counts = new HashMap<>();
                for (List<Classroom> rooms : cs.rooms) {
                        for (Timeslot t : cs.slots) {
                                Exam cand = new Exam(cs.course.getId(), cs.course.getClassLevel(), type, t, rooms);
                                constraints.explain(schedule, cand).forEach(r -> counts.merge(r, 1, Integer::sum));
                        }
                }
                String msg = counts.isEmpty() ? "Configuration Error: No valid timeslots."
                                : "Constraint Error: " + counts.entrySet().stream()
                                                .max(Map.Entry.<String, Integer>comparingByValue()
                                                                .thenComparing(Map.Entry.comparingByKey()))
                                                .get().getKey();

                String bottlenecks = formatBottleneckStudents(cs.course.getId(), schedule, graph);
                if (!bottlenecks.isEmpty())
                        msg = msg + " | Bottleneck students: " + bottlenecks;
                return msg;
        }

        private static final int BOTTLENECK_STUDENT_LIMIT = 10;

        private String formatBottleneckStudents(String courseId, PartialSchedule schedule, ConflictGraph graph) {
                Set<String> studentsInCourse = graph.studentsOf(courseId);
                if (studentsInCourse.isEmpty())
                        return "";

                Map<String, Integer> load = new HashMap<>();
                for (Exam e : schedule.getPlacements().values()) {
                        for (String sid : graph.studentsOf(e.getCourseId()))
                                load.merge(sid, 1, Integer::sum);
                }
                return studentsInCourse.stream()
                                .filter(sid -> load.getOrDefault(sid, 0) > 0)
                                .sorted(Comparator.comparingInt((String sid) -> load.getOrDefault(sid, 0)).reversed()
                                                .thenComparing(Comparator.naturalOrder()))
                                .limit(BOTTLENECK_STUDENT_LIMIT)
                                .map(sid -> sid + "(" + load.get(sid) + ")")
                                .collect(Collectors.joining(", "));
        }

        private static final class CourseSlots {
                final Course course;
                final int studentCount;
                final List<Timeslot> slots;
                final List<List<Classroom>> rooms;
                final Set<String> roomIds = new HashSet<>();

                CourseSlots(Course course, int studentCount, List<Timeslot> slots, List<List<Classroom>> rooms) {
                        this.course = course;
                        this.studentCount = studentCount;
                        this.slots = slots;
                        this.rooms = rooms;
                        for (List<Classroom> combo : rooms)
                                for (Classroom r : combo)
                                        roomIds.add(r.getId());
                }

                int candidateCount() {
                        return slots.size() * rooms.size();
                }

                Exam candidate(int index, ExamType type) {
                        Timeslot t = slots.get(index / rooms.size());
                        List<Classroom> combo = rooms.get(index % rooms.size());
                        return new Exam(course.getId(), course.getClassLevel(), type, t, combo);
                }
        }

        private static final class Decision {
                final int position;
                final int candidateIndex;

                Decision(int position, int candidateIndex) {
                        this.position = position;
                        this.candidateIndex = candidateIndex;
                }
        }

        private static final class SearchOutcome {
                final boolean complete;
                final int backtracks;

                SearchOutcome(boolean complete, int backtracks) {
                        this.complete = complete;
                        this.backtracks = backtracks;
                }
        }
}
