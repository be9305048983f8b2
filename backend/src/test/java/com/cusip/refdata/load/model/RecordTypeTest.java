package com.cusip.refdata.load.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RecordTypeTest {

    @Test
    void declaredInDependencyOrder() {
        assertEquals(List.of(RecordType.ISSUER, RecordType.ISSUE, RecordType.ISSUE_ATTRIBUTE), List.of(RecordType.values()));
        assertNull(RecordType.ISSUER.parent());
        assertEquals(RecordType.ISSUER, RecordType.ISSUE.parent());
        assertEquals(RecordType.ISSUE, RecordType.ISSUE_ATTRIBUTE.parent());
    }

    @Test
    void fieldCountsMatchFileLayouts() {
        assertEquals(16, RecordType.ISSUER.fieldCount());
        assertEquals(17, RecordType.ISSUE.fieldCount());
        assertEquals(53, RecordType.ISSUE_ATTRIBUTE.fieldCount());
        assertThat(RecordType.ISSUE_ATTRIBUTE.columnNames()).startsWith("issuer_num", "issue_num");
    }

    @Test
    void resolvesApiAndEnumNames() {
        assertEquals(RecordType.ISSUE_ATTRIBUTE, RecordType.fromApiName("issue_attr"));
        assertEquals(RecordType.ISSUE_ATTRIBUTE, RecordType.fromApiName("issue-attribute"));
        assertEquals(RecordType.ISSUER, RecordType.fromApiName(" ISSUER "));
        assertThatThrownBy(() -> RecordType.fromApiName("bond"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bond");
    }

    @Test
    void typedColumnsCastFromStagedText() {
        ColumnSpec rate = RecordType.ISSUE.columns().get(RecordType.ISSUE.columnNames().indexOf("rate"));

        assertEquals("CAST(s.rate AS DECIMAL(6,3))", rate.castExpression("s"));
        assertEquals("s.issue_desc_1", ColumnSpec.text("issue_desc_1").castExpression("s"));
        assertEquals("CAST(s.maturity_date AS DATE)", ColumnSpec.date("maturity_date").castExpression("s"));
    }
}
