package examscheduler.core;

import examscheduler.model.Student;

import java.util.*;

/**
 * Derives the course conflict relation from enrolments. Work is done per
 * student (pairs of that student's courses), so cost grows with
 * students x courses-per-student squared and not with the number of course pairs.
 */
public class ConflictGraphBuilder {

    public ConflictGraph build(Collection<Student> students) {
        Map<String, Set<String>> c2s = buildCourseToStudents(students);
        Map<String, Set<String>> adj = new TreeMap<>();
        for (String c : c2s.keySet())
            adj.put(c, new TreeSet<>());

        for (Student s : students) {
            List<String> courses = new ArrayList<>(s.getCourseIds());
            // 0 veya 1 dersi olan öğrenci çakışma üretmez
            for (int i = 0; i < courses.size(); i++) {
                for (int j = i + 1; j < courses.size(); j++) {
                    String a = courses.get(i), b = courses.get(j);
                    if (a.equals(b)) continue;
                    adj.get(a).add(b);
                    adj.get(b).add(a);
                }
            }
        }

        Map<String, Set<String>> frozen = new TreeMap<>();
        for (Map.Entry<String, Set<String>> e : adj.entrySet())
            frozen.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        return new ConflictGraph(Collections.unmodifiableMap(c2s), Collections.unmodifiableMap(frozen));
    }

    // courseId -> öğrenciler kümesi
    public Map<String, Set<String>> buildCourseToStudents(Collection<Student> students) {
        Map<String, Set<String>> map = new TreeMap<>();
        for (Student s : students) {
            for (String courseId : s.getCourseIds()) {
                map.computeIfAbsent(courseId, k -> new TreeSet<>()).add(s.getId());
            }
        }
        Map<String, Set<String>> out = new TreeMap<>();
        for (Map.Entry<String, Set<String>> e : map.entrySet())
            out.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        return out;
    }
}
