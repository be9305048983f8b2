package com.cusip.refdata.load.persistence;

import com.cusip.refdata.load.error.FailureKind;
import com.cusip.refdata.load.error.LoadFailureException;
import com.cusip.refdata.load.model.RecordType;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MasterJdbcRepositoryTest {

    @Test
    void dataExceptionsAreCoercionFailures() {
        LoadFailureException error = MasterJdbcRepository.classify(
            RecordType.ISSUE,
            new UncategorizedSQLException("merge", "MERGE", new SQLException("Cannot parse DATE '2024-13-45'", "22007"))
        );

        assertEquals(FailureKind.TYPE_COERCION, error.kind());
        assertThat(error.getMessage()).contains("2024-13-45");
    }

    @Test
    void notNullViolationsAreCoercionFailures() {
        LoadFailureException error = MasterJdbcRepository.classify(
            RecordType.ISSUER,
            new DataIntegrityViolationException("x", new SQLException("null value", "23502"))
        );

        assertEquals(FailureKind.TYPE_COERCION, error.kind());
    }

    @Test
    void foreignKeyViolationsAreReferential() {
        assertEquals(
            FailureKind.REFERENTIAL_VIOLATION,
            MasterJdbcRepository.classify(
                RecordType.ISSUE,
                new DataIntegrityViolationException("x", new SQLException("fk", "23503"))
            ).kind()
        );
        assertEquals(
            FailureKind.REFERENTIAL_VIOLATION,
            MasterJdbcRepository.classify(
                RecordType.ISSUE,
                new DataIntegrityViolationException("x", new SQLException("fk", "23506"))
            ).kind()
        );
    }

    @Test
    void everythingElseIsAMergeFailure() {
        LoadFailureException error = MasterJdbcRepository.classify(
            RecordType.ISSUER,
            new BadSqlGrammarException("merge", "MERGE", new SQLException("syntax", "42601"))
        );

        assertEquals(FailureKind.MERGE_FAILED, error.kind());
        assertThat(error.getMessage()).contains("SQLSTATE 42601");
    }

    @Test
    void sqlStateIsFoundThroughWrappedCauses() {
        SQLException inner = new SQLException("deep", "23503");
        RuntimeException wrapped = new RuntimeException(new SQLException("outer", null, inner));

        assertEquals("23503", MasterJdbcRepository.sqlState(wrapped));
        assertNull(MasterJdbcRepository.sqlState(new RuntimeException("no sql")));
    }

    @Test
    void postgresUpsertKeepsTheLastLinePerKey() {
        String sql = MasterJdbcRepository.postgresUpsertSql(RecordType.ISSUE);

        assertThat(sql)
            .startsWith("INSERT INTO issue (")
            .contains("SELECT DISTINCT ON (s.issuer_num, s.issue_num)")
            .contains("ORDER BY s.issuer_num, s.issue_num, s.line_no DESC")
            .contains("ON CONFLICT (issuer_num, issue_num) DO UPDATE SET")
            .contains("maturity_date = EXCLUDED.maturity_date")
            .contains("CAST(s.rate AS DECIMAL(6,3))")
            .doesNotContain("issuer_num = EXCLUDED.issuer_num");
    }

    @Test
    void h2MergeKeepsTheLastLinePerKey() {
        String sql = MasterJdbcRepository.h2MergeSql(RecordType.ISSUER);

        assertThat(sql)
            .startsWith("MERGE INTO issuer (")
            .contains("KEY (issuer_num)")
            .contains("CAST(s.issuer_update_date AS DATE)")
            .endsWith("WHERE s.line_no = (SELECT MAX(l.line_no) FROM stg_issuer l WHERE l.issuer_num = s.issuer_num)");
    }
}
