package examscheduler.io;

import examscheduler.model.Classroom;
import examscheduler.model.Course;
import examscheduler.model.Student;

import java.io.IOException;
import java.util.List;

/**
 * Where course, student and classroom records come from (spreadsheet import,
 * database, test fixture). Duplicate and missing row handling is the source's job.
 */
public interface EnrollmentSource {

    List<Course> loadCourses() throws IOException;

    /** Students together with the ids of the courses they take. */
    List<Student> loadStudents() throws IOException;

    List<Classroom> loadClassrooms() throws IOException;
}
