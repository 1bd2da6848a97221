package noisemaps;

import java.util.BitSet;

/**
 * Reorders row completions from parallel workers so the callback still sees
 * rows 0, 1, 2, ... exactly once and in order.
 */
class RowProgressSequencer {
    private final int rowCount;
    private final NoiseMapBuilderCallback callback;
    private final BitSet completed;

    /** Next row index to hand to the callback */
    private int nextRow;

    RowProgressSequencer(int rowCount, NoiseMapBuilderCallback callback) {
        this.rowCount = rowCount;
        this.callback = callback;
        this.completed = new BitSet(rowCount);
        this.nextRow = 0;
    }

    /**
     * Record that a row finished and release every row that is now
     * contiguous with the already reported prefix.
     */
    synchronized void rowCompleted(int row) {
        if (row < nextRow || completed.get(row)) {
            throw new IllegalStateException("Row " + row + " reported twice");
        }
        completed.set(row);
        while (nextRow < rowCount && completed.get(nextRow)) {
            callback.onRowCompleted(nextRow);
            nextRow++;
        }
    }

    synchronized int getReportedRows() {
        return nextRow;
    }
}
