package com.cusip.refdata.load.persistence;

import com.cusip.refdata.load.error.LoadFailureException;
import com.cusip.refdata.load.error.MergeFailedException;
import com.cusip.refdata.load.error.ReferentialViolationException;
import com.cusip.refdata.load.error.TypeCoercionException;
import com.cusip.refdata.load.model.MergeOutcome;
import com.cusip.refdata.load.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Sole writer of the master tables. Every method expects to run inside the merge transaction
 * opened by the caller; nothing here commits.
 */
@Repository
public class MasterJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(MasterJdbcRepository.class);
    private static final int MAX_REPORTED_KEYS = 5;
    private static final long ADVISORY_LOCK_BASE = 0x4355_5349_5000L;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public MasterJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = DatabaseDialect.isPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (RecordType type : RecordType.values()) {
            counts.put(type.masterTable(), countTable(type.masterTable()));
        }
        return counts;
    }

    /**
     * Cross-instance exclusion for one record type, released when the transaction ends. No-op
     * outside PostgreSQL.
     */
    public void acquireMergeLock(RecordType recordType) {
        if (!postgres) {
            return;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", ADVISORY_LOCK_BASE + recordType.ordinal());
        jdbc.query("SELECT pg_advisory_xact_lock(:key)", params, (ResultSetExtractor<Void>) rs -> null);
    }

    /**
     * Upserts the staged rows of a record type into its master table. Within one file the row
     * with the highest line number wins for each key.
     */
    public MergeOutcome merge(RecordType recordType) {
        try {
            long staged = countTable(recordType.stagingTable());
            long distinctKeys = countDistinctStagedKeys(recordType);
            rejectMissingKeys(recordType);
            rejectOrphans(recordType);
            int upserted = jdbc.getJdbcTemplate().update(postgres ? postgresUpsertSql(recordType) : h2MergeSql(recordType));
            log.debug(
                "Merged {} into {}: staged={}, upserted={}",
                recordType.stagingTable(),
                recordType.masterTable(),
                staged,
                upserted
            );
            return new MergeOutcome(staged, upserted, staged - distinctKeys);
        } catch (DataAccessException e) {
            throw classify(recordType, e);
        }
    }

    private void rejectMissingKeys(RecordType recordType) {
        String missing = recordType.keyColumns().stream()
            .map(column -> "s." + column + " IS NULL")
            .collect(Collectors.joining(" OR "));
        Long line = jdbc.getJdbcTemplate().queryForObject(
            "SELECT MIN(s.line_no) FROM " + recordType.stagingTable() + " s WHERE " + missing,
            Long.class
        );
        if (line != null) {
            throw new TypeCoercionException(
                "line " + line + ": " + recordType.apiName() + " key " + String.join("/", recordType.keyColumns()) + " is blank",
                null
            );
        }
    }

    private void rejectOrphans(RecordType recordType) {
        RecordType parent = recordType.parent();
        if (parent == null) {
            return;
        }
        List<String> orphans = findOrphanKeys(recordType, parent);
        if (!orphans.isEmpty()) {
            throw new ReferentialViolationException(
                recordType.apiName() + " rows reference missing " + parent.apiName() + " records: "
                    + String.join(", ", orphans),
                orphans
            );
        }
    }

    List<String> findOrphanKeys(RecordType recordType, RecordType parent) {
        String keys = recordType.keyColumns().stream()
            .map(column -> "s." + column)
            .collect(Collectors.joining(", "));
        String join = parent.keyColumns().stream()
            .map(column -> "p." + column + " = s." + column)
            .collect(Collectors.joining(" AND "));
        String sql = "SELECT " + keys + " FROM " + recordType.stagingTable() + " s"
            + " WHERE NOT EXISTS (SELECT 1 FROM " + parent.masterTable() + " p WHERE " + join + ")"
            + " GROUP BY " + keys
            + " ORDER BY " + keys
            + " LIMIT " + MAX_REPORTED_KEYS;
        int width = recordType.keyColumns().size();
        return jdbc.getJdbcTemplate().query(sql, (rs, rowNum) -> {
            StringBuilder key = new StringBuilder();
            for (int i = 1; i <= width; i++) {
                if (i > 1) {
                    key.append('/');
                }
                key.append(rs.getString(i));
            }
            return key.toString();
        });
    }

    private long countDistinctStagedKeys(RecordType recordType) {
        String keys = String.join(", ", recordType.keyColumns());
        Long value = jdbc.getJdbcTemplate().queryForObject(
            "SELECT COUNT(*) FROM (SELECT DISTINCT " + keys + " FROM " + recordType.stagingTable() + ") k",
            Long.class
        );
        return value == null ? 0L : value;
    }

    private long countTable(String table) {
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return value == null ? 0L : value;
    }

    static String postgresUpsertSql(RecordType recordType) {
        List<String> columns = recordType.columnNames();
        String keys = String.join(", ", recordType.keyColumns());
        String updates = columns.stream()
            .filter(column -> !recordType.keyColumns().contains(column))
            .map(column -> column + " = EXCLUDED." + column)
            .collect(Collectors.joining(", "));
        String orderKeys = recordType.keyColumns().stream()
            .map(column -> "s." + column)
            .collect(Collectors.joining(", "));
        return "INSERT INTO " + recordType.masterTable() + " (" + String.join(", ", columns) + ")"
            + " SELECT DISTINCT ON (" + orderKeys + ") " + castList(recordType)
            + " FROM " + recordType.stagingTable() + " s"
            + " ORDER BY " + orderKeys + ", s.line_no DESC"
            + " ON CONFLICT (" + keys + ") DO UPDATE SET " + updates;
    }

    static String h2MergeSql(RecordType recordType) {
        String latest = recordType.keyColumns().stream()
            .map(column -> "l." + column + " = s." + column)
            .collect(Collectors.joining(" AND "));
        return "MERGE INTO " + recordType.masterTable() + " (" + String.join(", ", recordType.columnNames()) + ")"
            + " KEY (" + String.join(", ", recordType.keyColumns()) + ")"
            + " SELECT " + castList(recordType)
            + " FROM " + recordType.stagingTable() + " s"
            + " WHERE s.line_no = (SELECT MAX(l.line_no) FROM " + recordType.stagingTable() + " l WHERE " + latest + ")";
    }

    private static String castList(RecordType recordType) {
        return recordType.columns().stream()
            .map(column -> column.castExpression("s"))
            .collect(Collectors.joining(", "));
    }

    static LoadFailureException classify(RecordType recordType, DataAccessException error) {
        String sqlState = sqlState(error);
        String detail = rootMessage(error);
        if (sqlState != null && (sqlState.startsWith("22") || sqlState.equals("23502"))) {
            return new TypeCoercionException(
                "Failed to convert staged " + recordType.apiName() + " rows: " + detail,
                error
            );
        }
        if ("23503".equals(sqlState) || "23506".equals(sqlState)) {
            return new ReferentialViolationException(
                recordType.apiName() + " rows violate a reference constraint: " + detail,
                error
            );
        }
        return new MergeFailedException(
            "Failed to merge " + recordType.apiName() + " rows"
                + (sqlState == null ? "" : " (SQLSTATE " + sqlState + ")") + ": " + detail,
            error
        );
    }

    static String sqlState(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
