package com.cusip.refdata.load;

import com.cusip.refdata.load.model.RecordType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class PipFixtures {

    private PipFixtures() {
    }

    public static String line(RecordType type, Map<String, String> values) {
        List<String> columns = type.columnNames();
        String[] fields = new String[columns.size()];
        Arrays.fill(fields, "");
        values.forEach((column, value) -> {
            int index = columns.indexOf(column);
            if (index < 0) {
                throw new IllegalArgumentException("Unknown column " + column);
            }
            fields[index] = value == null ? "" : value;
        });
        return String.join("|", fields);
    }

    public static String issuer(String issuerNum, String name) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("issuer_num", issuerNum);
        values.put("issuer_check", "1");
        values.put("issuer_name_1", name);
        values.put("issuer_sort_key", name);
        values.put("issuer_type", "C");
        values.put("issuer_status", "A");
        values.put("issuer_transaction", "A");
        values.put("issuer_state_code", "NY");
        values.put("issuer_update_date", "2024-01-15");
        return line(RecordType.ISSUER, values);
    }

    public static String issue(String issuerNum, String issueNum, String description, String maturityDate) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("issuer_num", issuerNum);
        values.put("issue_num", issueNum);
        values.put("issue_check", "2");
        values.put("issue_desc_1", description);
        values.put("issue_status", "A");
        values.put("dated_date", "2024-01-01");
        values.put("maturity_date", maturityDate);
        values.put("rate", "5.250");
        values.put("issue_transaction", "A");
        values.put("issue_update_date", "2024-01-15");
        return line(RecordType.ISSUE, values);
    }

    public static String issue(String issuerNum, String issueNum, String description) {
        return issue(issuerNum, issueNum, description, "2034-01-01");
    }

    public static String attribute(String issuerNum, String issueNum, String ticker) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("issuer_num", issuerNum);
        values.put("issue_num", issueNum);
        values.put("callable", "N");
        values.put("activity_date", "2024-01-15");
        values.put("payment_frequency", "5");
        values.put("currency_code", "USD");
        values.put("domicile_code", "US");
        values.put("ticker_symbol", ticker);
        values.put("sale_type", "C");
        values.put("offering_amount", "12.5");
        values.put("offering_amount_code", "M");
        return line(RecordType.ISSUE_ATTRIBUTE, values);
    }

    public static String footer(long count) {
        return "999999|" + count;
    }

    /**
     * Data lines followed by a trailer that declares their count.
     */
    public static String file(List<String> lines) {
        return file(lines, lines.size());
    }

    public static String file(List<String> lines, long declaredCount) {
        List<String> all = new ArrayList<>(lines);
        all.add(footer(declaredCount));
        return String.join("\r\n", all) + "\r\n";
    }

    public static String fileName(RecordType type, int month, int day) {
        return String.format("CED%02d-%02d%s.PIP", month, day, type.fileSuffix());
    }

    public static Path write(Path directory, String name, String content) throws IOException {
        Path path = directory.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }
}
