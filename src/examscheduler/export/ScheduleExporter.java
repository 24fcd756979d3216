package examscheduler.export;

import examscheduler.model.ExamSchedule;
import examscheduler.model.SeatAssignment;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Receives a committed schedule and its seating plans, e.g. to write them out
 * as a spreadsheet or a printable list.
 */
public interface ScheduleExporter {

    /**
     * @param seating examId -> seat assignments of that exam
     */
    void export(ExamSchedule schedule, Map<String, List<SeatAssignment>> seating) throws IOException;
}
