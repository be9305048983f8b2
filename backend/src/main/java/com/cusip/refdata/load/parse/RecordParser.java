package com.cusip.refdata.load.parse;

import com.cusip.refdata.load.error.FooterMismatchException;
import com.cusip.refdata.load.error.MalformedRecordException;
import com.cusip.refdata.load.error.SourceUnavailableException;
import com.cusip.refdata.load.model.ParseSummary;
import com.cusip.refdata.load.model.ParsedRow;
import com.cusip.refdata.load.model.RecordType;
import com.cusip.refdata.load.source.SourceFile;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Turns a PIP file into rows. The last non-blank line is the trailer: its first field is
 * {@value #FOOTER_MARKER} and its last numeric field is the number of data lines that precede it.
 */
@Component
public class RecordParser {
    private static final Logger log = LoggerFactory.getLogger(RecordParser.class);

    static final String FOOTER_MARKER = "999999";
    private static final char DELIMITER = '|';
    private static final char EOF_MARKER = '\u001a';
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final CSVFormat LINE_FORMAT = CSVFormat.DEFAULT.builder()
        .setDelimiter(DELIMITER)
        .setQuote('"')
        .setIgnoreEmptyLines(false)
        .build();

    /**
     * Lazy view over the file. Nothing is read until iteration starts, and every iteration re-reads
     * the file from the beginning.
     */
    public RecordStream parse(RecordType recordType, SourceFile file) {
        return new RecordStream(recordType, file);
    }

    static List<String> splitFields(String line, long lineNumber) {
        List<CSVRecord> records;
        try (CSVParser parser = CSVParser.parse(line, LINE_FORMAT)) {
            records = parser.getRecords();
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new MalformedRecordException(lineNumber, "unparseable line: " + e.getMessage(), e);
        }
        if (records.size() != 1) {
            throw new MalformedRecordException(lineNumber, "expected one record but found " + records.size());
        }
        CSVRecord record = records.get(0);
        List<String> fields = new ArrayList<>(record.size());
        for (String raw : record) {
            fields.add(normalizeField(raw));
        }
        return fields;
    }

    static String normalizeField(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static String cleanLine(String raw) {
        int end = raw.length();
        while (end > 0) {
            char c = raw.charAt(end - 1);
            if (c == '\r' || c == '\n' || c == EOF_MARKER) {
                end--;
            } else {
                break;
            }
        }
        return raw.substring(0, end);
    }

    static long footerCount(String line, long lineNumber) {
        String[] fields = line.split(Pattern.quote(String.valueOf(DELIMITER)), -1);
        if (!FOOTER_MARKER.equals(fields[0].trim())) {
            throw new FooterMismatchException("line " + lineNumber + " is the last line but is not a " + FOOTER_MARKER + " trailer");
        }
        for (int i = fields.length - 1; i >= 1; i--) {
            String candidate = fields[i].trim();
            if (DIGITS.matcher(candidate).matches()) {
                try {
                    return Long.parseLong(candidate);
                } catch (NumberFormatException e) {
                    throw new FooterMismatchException("trailer record count out of range: " + candidate);
                }
            }
        }
        throw new FooterMismatchException("trailer on line " + lineNumber + " carries no record count");
    }

    public static final class RecordStream implements Iterable<ParsedRow> {
        private final RecordType recordType;
        private final SourceFile file;

        private RecordStream(RecordType recordType, SourceFile file) {
            this.recordType = recordType;
            this.file = file;
        }

        public RecordType recordType() {
            return recordType;
        }

        public SourceFile file() {
            return file;
        }

        /**
         * Reads the whole file once and checks every line and the trailer count.
         */
        public ParseSummary validate() {
            RowIterator iterator = new RowIterator(recordType, file);
            while (iterator.hasNext()) {
                iterator.next();
            }
            ParseSummary summary = new ParseSummary(iterator.dataLines, iterator.footerCount);
            if (summary.isEmpty()) {
                log.warn("{} contains a trailer and no data lines", file.name());
            }
            return summary;
        }

        @Override
        public Iterator<ParsedRow> iterator() {
            return new RowIterator(recordType, file);
        }
    }

    /**
     * Closing releases the underlying reader early when the caller stops before the trailer.
     */
    private static final class RowIterator implements Iterator<ParsedRow>, Closeable {
        private final RecordType recordType;
        private final SourceFile file;
        private BufferedReader reader;
        private long physicalLine;
        private String lookahead;
        private long lookaheadLine;
        private ParsedRow next;
        private boolean finished;
        private long dataLines;
        private long footerCount = -1;

        private RowIterator(RecordType recordType, SourceFile file) {
            this.recordType = recordType;
            this.file = file;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !finished) {
                advance();
            }
            return next != null;
        }

        @Override
        public ParsedRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ParsedRow row = next;
            next = null;
            return row;
        }

        private void advance() {
            if (reader == null) {
                open();
                readAhead();
            }
            String current = lookahead;
            long currentLine = lookaheadLine;
            if (current == null) {
                finish();
                throw new FooterMismatchException(file.name() + " is empty; expected a " + FOOTER_MARKER + " trailer");
            }
            readAhead();
            if (lookahead == null) {
                footerCount = footerCount(current, currentLine);
                finish();
                if (footerCount != dataLines) {
                    throw new FooterMismatchException(
                        file.name() + " trailer declares " + footerCount + " records but " + dataLines + " data lines were read"
                    );
                }
                return;
            }
            next = toRow(current, currentLine);
            dataLines++;
        }

        private ParsedRow toRow(String line, long lineNumber) {
            List<String> fields = splitFields(line, lineNumber);
            if (fields.size() != recordType.fieldCount()) {
                finish();
                throw new MalformedRecordException(
                    lineNumber,
                    "expected " + recordType.fieldCount() + " fields for " + recordType.apiName() + " but found " + fields.size()
                );
            }
            return new ParsedRow(lineNumber, fields);
        }

        private void open() {
            try {
                reader = new BufferedReader(new InputStreamReader(file.openStream(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                finished = true;
                throw new SourceUnavailableException("Failed to open " + file.location() + ": " + e.getMessage(), e);
            }
        }

        private void readAhead() {
            lookahead = null;
            try {
                String raw;
                while ((raw = reader.readLine()) != null) {
                    physicalLine++;
                    String cleaned = cleanLine(raw);
                    if (!cleaned.isBlank()) {
                        lookahead = cleaned;
                        lookaheadLine = physicalLine;
                        return;
                    }
                }
            } catch (IOException e) {
                finish();
                throw new SourceUnavailableException("Failed to read " + file.location() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            finish();
        }

        private void finish() {
            finished = true;
            next = null;
            if (reader != null) {
                try {
                    reader.close();
                } catch (IOException e) {
                    log.debug("Failed to close reader for {}", file.location(), e);
                }
            }
        }
    }
}
