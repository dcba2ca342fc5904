package org.gamma.geobatch.processing;

import java.util.List;

/**
 * One accepted input row, ready to be geocoded. Row ids start at 1 and follow input order.
 */
public record Job(long rowId, String queryOrCoords, List<String> originalRow, GeocodeCommand command) {

    public Job {
        originalRow = List.copyOf(originalRow);
    }
}
