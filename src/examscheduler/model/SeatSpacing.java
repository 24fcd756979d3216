package examscheduler.model;

/**
 * Which seats of a bench may be used during an exam.
 */
public enum SeatSpacing {
    /** Every seat of every bench. */
    FULL,
    /** Keep neighbours apart: 2 -> right seat only, 3 -> both ends, 4 -> both ends. */
    SPACED;

    public int[] positions(int seatGroup) {
        if (this == SPACED) {
            switch (seatGroup) {
                case 2:
                    return new int[]{2};
                case 3:
                    return new int[]{1, 3};
                case 4:
                    return new int[]{1, 4};
                default:
                    break;
            }
        }
        int[] all = new int[seatGroup];
        for (int i = 0; i < seatGroup; i++)
            all[i] = i + 1;
        return all;
    }
}
