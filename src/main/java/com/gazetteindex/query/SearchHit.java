package com.gazetteindex.query;

import com.gazetteindex.storage.RowRecord;

public record SearchHit(
        int rowId,
        RowRecord record
) {
}
