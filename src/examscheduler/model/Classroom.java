package examscheduler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exam room. Seats are laid out as {@code rows x columns} benches, each bench
 * holding {@code seatGroup} seats (2, 3 or 4).
 */
public class Classroom {
    private final String id;
    private final String name;
    private final int capacity;
    private final int rows;
    private final int columns;
    private final int seatGroup;

    public Classroom(String id, int capacity) {
        // tek sütun, ikili sıralar
        this(id, id, capacity, Math.max(1, (capacity + 1) / 2), 1, 2);
    }

    public Classroom(String id, String name, int capacity, int rows, int columns, int seatGroup) {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("classroom id is required");
        this.id = id;
        this.name = (name == null) ? id : name;
        this.capacity = capacity;
        this.rows = rows;
        this.columns = columns;
        this.seatGroup = seatGroup;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getSeatGroup() {
        return seatGroup;
    }

    /**
     * Row-major seat coordinates. Seat column is {@code bench * seatGroup + position},
     * position counted from 1 inside the bench.
     */
    public List<Seat> getSeats(SeatSpacing spacing) {
        if (rows <= 0 || columns <= 0 || seatGroup <= 0)
            return Collections.emptyList();

        int[] positions = spacing.positions(seatGroup);
        List<Seat> seats = new ArrayList<>(rows * columns * positions.length);
        for (int r = 0; r < rows; r++) {
            for (int bench = 0; bench < columns; bench++) {
                for (int p : positions) {
                    seats.add(new Seat(r + 1, bench * seatGroup + p));
                }
            }
        }
        return seats;
    }

    /** Seats that can actually be handed out: capacity caps the layout. */
    public int usableSeats(SeatSpacing spacing) {
        if (capacity <= 0)
            return 0;
        return Math.min(capacity, getSeats(spacing).size());
    }

    @Override
    public String toString() {
        return id;
    }
}
