package examscheduler.core;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of which courses share students. Built once per run by
 * {@link ConflictGraphBuilder}; never updated in place.
 */
public class ConflictGraph {
    private final Map<String, Set<String>> courseToStudents;
    private final Map<String, Set<String>> neighbours;

    ConflictGraph(Map<String, Set<String>> courseToStudents, Map<String, Set<String>> neighbours) {
        this.courseToStudents = courseToStudents;
        this.neighbours = neighbours;
    }

    public Set<String> conflictsOf(String courseId) {
        return neighbours.getOrDefault(courseId, Collections.emptySet());
    }

    public boolean conflicts(String a, String b) {
        return conflictsOf(a).contains(b);
    }

    public int degree(String courseId) {
        return conflictsOf(courseId).size();
    }

    public Set<String> studentsOf(String courseId) {
        return courseToStudents.getOrDefault(courseId, Collections.emptySet());
    }

    public int studentCount(String courseId) {
        return studentsOf(courseId).size();
    }

    public Set<String> courses() {
        return courseToStudents.keySet();
    }

    /** courseId -> conflicting courseIds, unmodifiable. */
    public Map<String, Set<String>> asMap() {
        return neighbours;
    }
}
