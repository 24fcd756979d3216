package examscheduler.model;

import java.util.Objects;

public class Seat implements Comparable<Seat> {
    private final int row;    // 1..rows
    private final int column; // 1..columns*seatGroup

    public Seat(int row, int column) {
        if (row < 1 || column < 1)
            throw new IllegalArgumentException("seat coordinates start at 1");
        this.row = row;
        this.column = column;
    }

    public int getRow() { return row; }
    public int getColumn() { return column; }

    @Override
    public int compareTo(Seat o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(column, o.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Seat)) return false;
        Seat seat = (Seat) o;
        return row == seat.row && column == seat.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return row + "-" + column;
    }
}
