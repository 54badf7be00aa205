package com.domain.correlation.ingest;

import com.domain.correlation.core.model.ObservationRecord;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Anything that can produce observation records for one analysis run.
 * The engine depends only on this contract, never on how records were gathered.
 *
 * <p>The stream must be finite. The engine consumes it exactly once per run.</p>
 */
@FunctionalInterface
public interface ObservationSource {

    /**
     * Returns the records of this source.
     */
    Stream<ObservationRecord> records();

    /**
     * Wraps an in-memory collection or any other iterable.
     */
    static ObservationSource of(Iterable<ObservationRecord> records) {
        Objects.requireNonNull(records, "records is required");
        return () -> StreamSupport.stream(records.spliterator(), false);
    }

    static ObservationSource of(ObservationRecord... records) {
        return of(List.of(records));
    }

    /**
     * Concatenates two sources, this one first.
     */
    default ObservationSource concat(ObservationSource other) {
        Objects.requireNonNull(other, "other is required");
        return () -> Stream.concat(records(), other.records());
    }
}
