package examscheduler.service;

import examscheduler.assign.StudentDistributor;
import examscheduler.config.SchedulingConfig;
import examscheduler.core.ExamScheduler;
import examscheduler.core.SchedulingException;
import examscheduler.dao.ScheduleRepository;
import examscheduler.export.ScheduleExporter;
import examscheduler.io.EnrollmentSource;
import examscheduler.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Entry point for the host application. Scheduling and seating are pure
 * computations over the records handed in; storage, import and export go
 * through the collaborator interfaces.
 */
public class ExamPlanner {

    private static final Logger log = LoggerFactory.getLogger(ExamPlanner.class);

    private final SchedulingConfig config;
    private final ScheduleRepository repository;
    private final List<ScheduleExporter> exporters;

    public ExamPlanner(SchedulingConfig config, ScheduleRepository repository) {
        this(config, repository, List.of());
    }

    public ExamPlanner(SchedulingConfig config, ScheduleRepository repository, List<ScheduleExporter> exporters) {
        this.config = Objects.requireNonNull(config, "config");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.exporters = List.copyOf(exporters);
    }

    public ExamSchedule scheduleExams(List<Course> courses, Collection<Student> students, List<Classroom> classrooms,
                                      ExamType examType, ExamWindow window, int dailyCap,
                                      Map<String, Integer> durationOverrides) throws SchedulingException {
        return new ExamScheduler(config).schedule(courses, students, classrooms, examType, window, dailyCap,
                durationOverrides);
    }

    public List<SeatAssignment> assignSeating(Exam exam, Collection<Student> enrolledStudents,
                                              List<Classroom> classroomCandidates, long randomSeed)
            throws SchedulingException {
        return new StudentDistributor(config.getSeatSpacing())
                .assign(exam, enrolledStudents, classroomCandidates, randomSeed);
    }

    /**
     * Import, schedule, seat every exam in its scheduled rooms, then commit the
     * whole result and hand it to the exporters. A failure before the commit
     * leaves the repository untouched.
     *
     * @param courseIds courses to schedule, {@code null} or empty for all
     */
    public ExamPlan plan(EnrollmentSource source, ExamType examType, ExamWindow window, Set<String> courseIds,
                         Map<String, Integer> durationOverrides) throws SchedulingException, IOException {
        List<Course> allCourses = source.loadCourses();
        List<Student> students = source.loadStudents();
        List<Classroom> classrooms = source.loadClassrooms();

        List<Course> courses = (courseIds == null || courseIds.isEmpty())
                ? allCourses
                : allCourses.stream().filter(c -> courseIds.contains(c.getId())).collect(Collectors.toList());
        if (courseIds != null && courses.size() < courseIds.size())
            log.warn("{} selected course(s) not found in the source", courseIds.size() - courses.size());

        ExamSchedule schedule = scheduleExams(courses, students, classrooms, examType, window,
                config.getMaxExamsPerDay(), durationOverrides);

        Map<String, List<SeatAssignment>> seating = new LinkedHashMap<>();
        for (Exam exam : schedule.getExams()) {
            List<Student> enrolled = students.stream()
                    .filter(s -> s.isEnrolledIn(exam.getCourseId()))
                    .collect(Collectors.toList());
            seating.put(exam.getId(), assignSeating(exam, enrolled, exam.getClassrooms(),
                    StudentDistributor.seedFor(exam, config.getRandomSeed())));
        }

        Set<String> replaced = courses.stream().map(Course::getId).collect(Collectors.toSet());
        repository.replace(examType, replaced, schedule.getExams(), seating);
        log.info("Committed {} {} exams ({} days)", schedule.size(), examType, schedule.daysUsed());

        ExamPlan plan = new ExamPlan(schedule, seating);
        // records are already committed when an exporter fails
        for (ScheduleExporter exporter : exporters)
            exporter.export(schedule, plan.getSeating());
        return plan;
    }

    /**
     * Re-seats an already committed exam with a new seed, e.g. after a student
     * list correction.
     */
    public List<SeatAssignment> reseat(String examId, Collection<Student> enrolledStudents, long randomSeed)
            throws SchedulingException {
        Exam exam = repository.findExam(examId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown exam " + examId));
        List<SeatAssignment> seating = assignSeating(exam, enrolledStudents, exam.getClassrooms(), randomSeed);
        repository.replaceSeating(examId, seating);
        return seating;
    }
}
