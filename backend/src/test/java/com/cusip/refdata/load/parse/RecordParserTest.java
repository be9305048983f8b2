package com.cusip.refdata.load.parse;

import com.cusip.refdata.load.PipFixtures;
import com.cusip.refdata.load.error.FooterMismatchException;
import com.cusip.refdata.load.error.MalformedRecordException;
import com.cusip.refdata.load.model.ParseSummary;
import com.cusip.refdata.load.model.ParsedRow;
import com.cusip.refdata.load.model.RecordType;
import com.cusip.refdata.load.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordParserTest {

    private final RecordParser parser = new RecordParser();

    @Test
    void mapsFieldsByPositionTrimmingAndNullingBlanks() {
        String content = PipFixtures.file(List.of(
            PipFixtures.issuer("000001", "  ACME  "),
            PipFixtures.issuer("000002", "GLOBEX")
        ));

        List<ParsedRow> rows = collect(parser.parse(RecordType.ISSUER, file(content)));

        assertEquals(2, rows.size());
        ParsedRow first = rows.get(0);
        assertEquals(1, first.lineNumber());
        assertEquals("000001", first.value(RecordType.ISSUER, "issuer_num"));
        assertEquals("ACME", first.value(RecordType.ISSUER, "issuer_name_1"));
        assertNull(first.value(RecordType.ISSUER, "issuer_name_2"));
        assertNull(first.value(RecordType.ISSUER, "issuer_del_date"));
        assertEquals("GLOBEX", rows.get(1).value(RecordType.ISSUER, "issuer_name_1"));
    }

    @Test
    void sequenceCanBeIteratedMoreThanOnce() {
        String content = PipFixtures.file(List.of(PipFixtures.issuer("000001", "ACME")));
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file(content));

        ParseSummary summary = stream.validate();
        List<ParsedRow> firstPass = collect(stream);
        List<ParsedRow> secondPass = collect(stream);

        assertEquals(1, summary.dataLines());
        assertEquals(1, summary.footerCount());
        assertEquals(firstPass, secondPass);
    }

    @Test
    void closingAnUnfinishedIteratorReleasesTheFile() throws IOException {
        byte[] content = PipFixtures.file(List.of(
            PipFixtures.issuer("000001", "ACME"),
            PipFixtures.issuer("000002", "GLOBEX")
        )).getBytes(StandardCharsets.UTF_8);
        AtomicBoolean released = new AtomicBoolean();
        SourceFile file = new SourceFile("CED01-15R.PIP", "memory:CED01-15R.PIP", () -> new ByteArrayInputStream(content) {
            @Override
            public void close() throws IOException {
                released.set(true);
                super.close();
            }
        });

        Iterator<ParsedRow> rows = parser.parse(RecordType.ISSUER, file).iterator();
        rows.next();
        assertFalse(released.get());

        assertThat(rows).isInstanceOf(Closeable.class);
        ((Closeable) rows).close();
        assertTrue(released.get());
    }

    @Test
    void footerCountMismatchFailsTheFile() {
        String content = PipFixtures.file(List.of(PipFixtures.issuer("000001", "ACME")), 5);
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file(content));

        assertThatThrownBy(stream::validate)
            .isInstanceOf(FooterMismatchException.class)
            .hasMessageContaining("declares 5")
            .hasMessageContaining("1 data lines");
    }

    @Test
    void missingTrailerIsFooterMismatch() {
        String content = PipFixtures.issuer("000001", "ACME") + "\n" + PipFixtures.issuer("000002", "GLOBEX") + "\n";
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file(content));

        assertThatThrownBy(stream::validate)
            .isInstanceOf(FooterMismatchException.class)
            .hasMessageContaining("999999");
    }

    @Test
    void emptyFileIsFooterMismatch() {
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file("\n\n"));

        assertThatThrownBy(stream::validate).isInstanceOf(FooterMismatchException.class);
    }

    @Test
    void trailerWithoutCountIsFooterMismatch() {
        String content = PipFixtures.issuer("000001", "ACME") + "\n999999|TRAILER\n";
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file(content));

        assertThatThrownBy(stream::validate)
            .isInstanceOf(FooterMismatchException.class)
            .hasMessageContaining("no record count");
    }

    @Test
    void footerOnlyFileIsValidAndEmpty() {
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file("999999|0\n"));

        ParseSummary summary = stream.validate();

        assertThat(summary.isEmpty()).isTrue();
        assertThat(collect(stream)).isEmpty();
    }

    @Test
    void wrongFieldCountNamesTheLine() {
        String content = PipFixtures.file(List.of(
            PipFixtures.issuer("000001", "ACME"),
            "000002|1|SHORT ROW"
        ));
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file(content));

        assertThatThrownBy(stream::validate)
            .isInstanceOf(MalformedRecordException.class)
            .hasMessageContaining("line 2")
            .hasMessageContaining("expected 16 fields");
    }

    @Test
    void blankLinesAndEofMarkerAreIgnored() {
        String content = "\r\n" + PipFixtures.issuer("000001", "ACME") + "\r\n\r\n999999|1\r\n\u001a";
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file(content));

        List<ParsedRow> rows = collect(stream);

        assertEquals(1, rows.size());
        assertEquals(2, rows.get(0).lineNumber());
        assertEquals("2024-01-15", rows.get(0).value(RecordType.ISSUER, "issuer_update_date"));
    }

    @Test
    void quotedFieldMayContainDelimiter() {
        String line = PipFixtures.issuer("000001", "\"ACME | SONS\"");
        String content = PipFixtures.file(List.of(line));

        List<ParsedRow> rows = collect(parser.parse(RecordType.ISSUER, file(content)));

        assertEquals("ACME | SONS", rows.get(0).value(RecordType.ISSUER, "issuer_name_1"));
    }

    @Test
    void unterminatedQuoteIsMalformed() {
        String line = PipFixtures.issuer("000001", "\"ACME");
        String content = PipFixtures.file(List.of(line));
        RecordParser.RecordStream stream = parser.parse(RecordType.ISSUER, file(content));

        assertThatThrownBy(stream::validate)
            .isInstanceOf(MalformedRecordException.class)
            .hasMessageContaining("line 1");
    }

    @Test
    void footerCountUsesLastNumericField() {
        assertEquals(42, RecordParser.footerCount("999999|CED01-15R|00000042", 7));
        assertEquals(3, RecordParser.footerCount("999999|3|  ", 7));
    }

    private static SourceFile file(String content) {
        return SourceFile.ofBytes("CED01-15R.PIP", "memory:CED01-15R.PIP", content.getBytes(StandardCharsets.UTF_8));
    }

    private static List<ParsedRow> collect(Iterable<ParsedRow> rows) {
        List<ParsedRow> result = new ArrayList<>();
        rows.forEach(result::add);
        return result;
    }
}
