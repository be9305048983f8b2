package com.cusip.refdata.load.persistence;

import com.cusip.refdata.config.LoaderProperties;
import com.cusip.refdata.load.error.LoadCancelledException;
import com.cusip.refdata.load.error.LoadFailureException;
import com.cusip.refdata.load.error.StagingFailedException;
import com.cusip.refdata.load.model.ParsedRow;
import com.cusip.refdata.load.model.RecordType;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Scratch tables: one all-text table per record type plus the source line number. Must run inside
 * the merge transaction so a failed attempt never leaves a half-written scratch table behind.
 */
@Repository
public class StagingJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(StagingJdbcRepository.class);
    static final String LINE_NO_COLUMN = "line_no";
    private static final CSVFormat COPY_FORMAT = CSVFormat.DEFAULT.builder()
        .setDelimiter('|')
        .setQuoteMode(QuoteMode.MINIMAL)
        .setRecordSeparator('\n')
        .build();

    private final NamedParameterJdbcTemplate jdbc;
    private final LoaderProperties properties;
    private final boolean postgres;

    public StagingJdbcRepository(NamedParameterJdbcTemplate jdbc, LoaderProperties properties) {
        this.jdbc = jdbc;
        this.properties = properties;
        this.postgres = DatabaseDialect.isPostgres(jdbc);
    }

    /**
     * Empties the scratch table for the record type and writes every row. Returns rows written.
     */
    public long replace(RecordType recordType, Iterable<ParsedRow> rows) {
        Iterator<ParsedRow> iterator = rows.iterator();
        try {
            clear(recordType);
            long written = postgres ? copyRows(recordType, iterator) : insertRows(recordType, iterator);
            log.debug("Staged {} rows into {}", written, recordType.stagingTable());
            return written;
        } catch (LoadFailureException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new StagingFailedException(
                "Failed to stage " + recordType.apiName() + " rows: " + rootMessage(e),
                e
            );
        } finally {
            closeQuietly(recordType, iterator);
        }
    }

    private void clear(RecordType recordType) {
        // H2 commits implicitly on TRUNCATE, which would break the surrounding transaction
        String sql = postgres
            ? "TRUNCATE TABLE " + recordType.stagingTable()
            : "DELETE FROM " + recordType.stagingTable();
        jdbc.getJdbcTemplate().update(sql);
    }

    private long insertRows(RecordType recordType, Iterator<ParsedRow> rows) {
        String sql = insertSql(recordType);
        List<String> columns = recordType.columnNames();
        int batchSize = properties.getStaging().getBatchSize();
        List<SqlParameterSource> batch = new ArrayList<>(batchSize);
        long written = 0;
        while (rows.hasNext()) {
            ParsedRow row = rows.next();
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue(LINE_NO_COLUMN, row.lineNumber());
            for (int i = 0; i < columns.size(); i++) {
                params.addValue(columns.get(i), row.values().get(i));
            }
            batch.add(params);
            if (batch.size() >= batchSize) {
                written += flushBatch(recordType, sql, batch);
            }
        }
        if (!batch.isEmpty()) {
            written += flushBatch(recordType, sql, batch);
        }
        return written;
    }

    private long flushBatch(RecordType recordType, String sql, List<SqlParameterSource> batch) {
        checkInterrupted(recordType);
        jdbc.batchUpdate(sql, batch.toArray(new SqlParameterSource[0]));
        long size = batch.size();
        batch.clear();
        return size;
    }

    private long copyRows(RecordType recordType, Iterator<ParsedRow> rows) {
        DataSource dataSource = jdbc.getJdbcTemplate().getDataSource();
        if (dataSource == null) {
            throw new StagingFailedException("No data source available for COPY", null);
        }
        // transaction-bound connection; released by the transaction manager, not here
        Connection connection = DataSourceUtils.getConnection(dataSource);
        String sql = copySql(recordType);
        int chunkSize = properties.getStaging().getBatchSize();
        long written = 0;
        try {
            CopyManager copyManager = connection.unwrap(PGConnection.class).getCopyAPI();
            StringWriter buffer = new StringWriter();
            CSVPrinter printer = new CSVPrinter(buffer, COPY_FORMAT);
            int pending = 0;
            while (rows.hasNext()) {
                ParsedRow row = rows.next();
                printer.print(row.lineNumber());
                for (String value : row.values()) {
                    printer.print(value);
                }
                printer.println();
                pending++;
                if (pending >= chunkSize) {
                    written += flushCopy(recordType, copyManager, sql, printer, buffer);
                    buffer = new StringWriter();
                    printer = new CSVPrinter(buffer, COPY_FORMAT);
                    pending = 0;
                }
            }
            if (pending > 0) {
                written += flushCopy(recordType, copyManager, sql, printer, buffer);
            }
            return written;
        } catch (SQLException | IOException e) {
            throw new StagingFailedException(
                "COPY into " + recordType.stagingTable() + " failed: " + e.getMessage(),
                e
            );
        }
    }

    private long flushCopy(
        RecordType recordType,
        CopyManager copyManager,
        String sql,
        CSVPrinter printer,
        StringWriter buffer
    ) throws SQLException, IOException {
        checkInterrupted(recordType);
        printer.flush();
        return copyManager.copyIn(sql, new StringReader(buffer.toString()));
    }

    private void checkInterrupted(RecordType recordType) {
        if (Thread.currentThread().isInterrupted()) {
            throw new LoadCancelledException("Load of " + recordType.apiName() + " cancelled while staging");
        }
    }

    private static void closeQuietly(RecordType recordType, Iterator<ParsedRow> iterator) {
        if (iterator instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.debug("Failed to close {} rows", recordType.apiName(), e);
            }
        }
    }

    static String insertSql(RecordType recordType) {
        List<String> columns = recordType.columnNames();
        StringBuilder sql = new StringBuilder("INSERT INTO ")
            .append(recordType.stagingTable())
            .append(" (")
            .append(LINE_NO_COLUMN);
        for (String column : columns) {
            sql.append(", ").append(column);
        }
        sql.append(") VALUES (:").append(LINE_NO_COLUMN);
        for (String column : columns) {
            sql.append(", :").append(column);
        }
        return sql.append(')').toString();
    }

    static String copySql(RecordType recordType) {
        return "COPY " + recordType.stagingTable()
            + " (" + LINE_NO_COLUMN + ", " + String.join(", ", recordType.columnNames()) + ")"
            + " FROM STDIN WITH (FORMAT csv, DELIMITER '|', NULL '')";
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
