package com.cusip.refdata.load.model;

import java.util.List;
import java.util.Locale;

import static com.cusip.refdata.load.model.ColumnSpec.date;
import static com.cusip.refdata.load.model.ColumnSpec.decimal;
import static com.cusip.refdata.load.model.ColumnSpec.integer;
import static com.cusip.refdata.load.model.ColumnSpec.text;

/**
 * The three PIP record types, declared in dependency order: an issue references its issuer and
 * an issue attribute references its issue, so loads must run in {@link #values()} order.
 */
public enum RecordType {
    ISSUER(
        "issuer",
        'R',
        "issuer",
        "stg_issuer",
        List.of("issuer_num"),
        null,
        List.of(
            text("issuer_num"),
            text("issuer_check"),
            text("issuer_name_1"),
            text("issuer_name_2"),
            text("issuer_name_3"),
            text("issuer_adl_1"),
            text("issuer_adl_2"),
            text("issuer_adl_3"),
            text("issuer_adl_4"),
            text("issuer_sort_key"),
            text("issuer_type"),
            text("issuer_status"),
            date("issuer_del_date"),
            text("issuer_transaction"),
            text("issuer_state_code"),
            date("issuer_update_date")
        )
    ),
    ISSUE(
        "issue",
        'E',
        "issue",
        "stg_issue",
        List.of("issuer_num", "issue_num"),
        ISSUER,
        List.of(
            text("issuer_num"),
            text("issue_num"),
            text("issue_check"),
            text("issue_desc_1"),
            text("issue_desc_2"),
            text("issue_adl_1"),
            text("issue_adl_2"),
            text("issue_adl_3"),
            text("issue_adl_4"),
            text("issue_status"),
            date("dated_date"),
            date("maturity_date"),
            integer("partial_maturity"),
            decimal("rate", 6, 3),
            text("govt_stimulus_program"),
            text("issue_transaction"),
            date("issue_update_date")
        )
    ),
    ISSUE_ATTRIBUTE(
        "issue_attr",
        'A',
        "issue_attribute",
        "stg_issue_attribute",
        List.of("issuer_num", "issue_num"),
        ISSUE,
        List.of(
            text("issuer_num"),
            text("issue_num"),
            text("alternative_min_tax"),
            text("bank_q"),
            text("callable"),
            date("activity_date"),
            date("first_coupon_date"),
            text("init_pub_off"),
            text("payment_frequency"),
            text("currency_code"),
            text("domicile_code"),
            text("underwriter"),
            text("us_cfi_code"),
            date("closing_date"),
            text("ticker_symbol"),
            text("iso_cfi"),
            text("depos_eligible"),
            text("pre_refund"),
            text("refundable"),
            text("remarketed"),
            text("sinking_fund"),
            text("taxable"),
            text("form"),
            text("enhancements"),
            text("fund_distrb_policy"),
            text("fund_inv_policy"),
            text("fund_type"),
            text("guarantee"),
            text("income_type"),
            text("insured_by"),
            text("ownership_restr"),
            text("payment_status"),
            text("preferred_type"),
            text("putable"),
            text("rate_type"),
            text("redemption"),
            text("source_doc"),
            text("sponsoring"),
            text("voting_rights"),
            text("warrant_assets"),
            text("warrant_status"),
            text("warrant_type"),
            text("where_traded"),
            text("auditor"),
            text("paying_agent"),
            text("tender_agent"),
            text("xfer_agent"),
            text("bond_counsel"),
            text("financial_advisor"),
            date("municipal_sale_date"),
            text("sale_type"),
            decimal("offering_amount", 5, 1),
            text("offering_amount_code")
        )
    );

    private final String apiName;
    private final char fileSuffix;
    private final String masterTable;
    private final String stagingTable;
    private final List<String> keyColumns;
    private final RecordType parent;
    private final List<ColumnSpec> columns;

    RecordType(
        String apiName,
        char fileSuffix,
        String masterTable,
        String stagingTable,
        List<String> keyColumns,
        RecordType parent,
        List<ColumnSpec> columns
    ) {
        this.apiName = apiName;
        this.fileSuffix = fileSuffix;
        this.masterTable = masterTable;
        this.stagingTable = stagingTable;
        this.keyColumns = keyColumns;
        this.parent = parent;
        this.columns = columns;
    }

    public String apiName() {
        return apiName;
    }

    public char fileSuffix() {
        return fileSuffix;
    }

    public String masterTable() {
        return masterTable;
    }

    public String stagingTable() {
        return stagingTable;
    }

    public List<String> keyColumns() {
        return keyColumns;
    }

    /**
     * Record type whose master rows must exist before rows of this type can be merged, or null.
     */
    public RecordType parent() {
        return parent;
    }

    public List<ColumnSpec> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSpec::name).toList();
    }

    public int fieldCount() {
        return columns.size();
    }

    public static RecordType fromApiName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("record type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RecordType type : values()) {
            if (type.apiName.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown record type: " + raw);
    }
}
