package com.cusip.refdata.load.source;

import com.cusip.refdata.load.model.RecordType;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Resolves the raw PIP file for one record type and business date.
 *
 * <p>Returns empty when no file has been delivered. Transport or credential problems raise
 * {@link com.cusip.refdata.load.error.SourceUnavailableException}; more than one matching file
 * raises {@link com.cusip.refdata.load.error.AmbiguousSourceException}.
 */
public interface FileSource {

    Optional<SourceFile> fetch(RecordType recordType, LocalDate date);

    String describe();
}
