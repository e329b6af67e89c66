package org.catalogregistry.csw.reader;

import java.util.List;

import org.catalogregistry.harvest.pipeline.ir.RawRecord;

/**
 * One page of a {@code GetRecords} response.
 *
 * @param matched {@code numberOfRecordsMatched}
 * @param nextRecord position of the next page, 0 when this was the last one
 * @param latestModified greatest {@code modified} value among the page's records, or null
 */
public record SearchResultsPage(
    List<RawRecord> records,
    int matched,
    int nextRecord,
    String latestModified
) {
    public SearchResultsPage {
        records = List.copyOf(records);
    }

    public boolean isLast(int startPosition) {
        return records.isEmpty() || nextRecord <= startPosition || nextRecord > matched;
    }
}
