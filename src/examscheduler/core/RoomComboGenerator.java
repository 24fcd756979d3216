package examscheduler.core;

import examscheduler.model.Classroom;
import examscheduler.model.SeatSpacing;

import java.util.*;

/**
 * Builds classroom combinations whose usable seats cover an exam's enrolment.
 * Single rooms first, then pairs, then triples.
 */
public class RoomComboGenerator {

    private final SeatSpacing spacing;

    public RoomComboGenerator(SeatSpacing spacing) {
        this.spacing = spacing;
    }

    /**
     * Ordered candidates for one exam: the greedy largest-first pick, then the
     * minimal combinations, without duplicates. An exam nobody sits needs no room.
     */
    public List<List<Classroom>> candidates(List<Classroom> rooms, int needed, int maxReturn) {
        if (needed <= 0)
            return List.of(List.of());

        Set<List<String>> seen = new HashSet<>();
        List<List<Classroom>> result = new ArrayList<>();

        List<Classroom> greedy = generateGreedyOrdered(rooms, needed);
        if (!greedy.isEmpty() && totalCapacity(greedy) >= needed) {
            result.add(greedy);
            seen.add(ids(greedy));
        }
        for (List<Classroom> combo : generateMinimalCombos(rooms, needed, maxReturn)) {
            if (result.size() >= maxReturn)
                break;
            if (seen.add(ids(combo)))
                result.add(combo);
        }
        return result;
    }

    public List<List<Classroom>> generateMinimalCombos(List<Classroom> rooms, int needed, int maxReturn) {
        if (rooms == null || rooms.isEmpty())
            return List.of();

        List<Classroom> sorted = sortedLargeFirst(rooms);
        List<List<Classroom>> result = new ArrayList<>();

        // 1) Tek sınıf
        for (Classroom r : sorted) {
            if (seats(r) >= needed) {
                result.add(List.of(r));
                if (result.size() >= maxReturn)
                    return result;
            }
        }

        // 2) İkili
        for (int i = 0; i < sorted.size(); i++) {
            Classroom a = sorted.get(i);
            if (seats(a) >= needed)
                continue; // tek başına yeterliydi
            for (int j = i + 1; j < sorted.size(); j++) {
                Classroom b = sorted.get(j);
                if (seats(b) >= needed)
                    continue;
                if (seats(a) + seats(b) >= needed) {
                    result.add(List.of(a, b));
                    if (result.size() >= maxReturn)
                        return result;
                }
            }
        }

        // 3) Üçlü
        for (int i = 0; i < sorted.size(); i++) {
            Classroom a = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                Classroom b = sorted.get(j);
                int capAB = seats(a) + seats(b);
                if (capAB >= needed)
                    continue; // ikili zaten yeterliydi
                for (int k = j + 1; k < sorted.size(); k++) {
                    Classroom c = sorted.get(k);
                    if (capAB + seats(c) >= needed) {
                        result.add(List.of(a, b, c));
                        if (result.size() >= maxReturn)
                            return result;
                    }
                }
            }
        }

        return result;
    }

    /**
     * Largest rooms first until the enrolment fits. If the result's capacity is
     * still short the caller reports the shortfall.
     */
    public List<Classroom> generateGreedyOrdered(List<Classroom> rooms, int needed) {
        if (rooms == null || rooms.isEmpty())
            return List.of();

        List<Classroom> chosen = new ArrayList<>();
        int total = 0;
        for (Classroom r : sortedLargeFirst(rooms)) {
            if (seats(r) <= 0)
                continue;
            chosen.add(r);
            total += seats(r);
            if (total >= needed)
                break;
        }
        return chosen;
    }

    public int totalCapacity(List<Classroom> rooms) {
        int sum = 0;
        for (Classroom r : rooms)
            sum += seats(r);
        return sum;
    }

    private int seats(Classroom r) {
        return r.usableSeats(spacing);
    }

    private List<Classroom> sortedLargeFirst(List<Classroom> rooms) {
        List<Classroom> sorted = new ArrayList<>(rooms);
        // stable: equal rooms keep their input order
        sorted.sort(Comparator.comparingInt(this::seats).reversed());
        return sorted;
    }

    private static List<String> ids(List<Classroom> rooms) {
        List<String> ids = new ArrayList<>();
        for (Classroom r : rooms)
            ids.add(r.getId());
        Collections.sort(ids);
        return ids;
    }
}
