package com.cusip.refdata.load.source;

import com.cusip.refdata.load.model.RecordType;

import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * File name template with {@code {MM}}, {@code {DD}} and {@code {TYPE}} placeholders, an optional
 * {@code {YYYY}} placeholder and {@code *} as a free segment, e.g. {@code CED{MM}-{DD}*{TYPE}.PIP}.
 */
public final class FileNameTemplate {
    private static final String MONTH = "{MM}";
    private static final String DAY = "{DD}";
    private static final String YEAR = "{YYYY}";
    private static final String TYPE = "{TYPE}";

    private final String template;

    private FileNameTemplate(String template) {
        this.template = template;
    }

    public static FileNameTemplate parse(String template) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("file name template is blank");
        }
        String trimmed = template.trim();
        for (String required : new String[] {MONTH, DAY, TYPE}) {
            if (!trimmed.contains(required)) {
                throw new IllegalArgumentException("file name template " + trimmed + " is missing " + required);
            }
        }
        if (trimmed.contains("/")) {
            throw new IllegalArgumentException("file name template must not contain '/': " + trimmed);
        }
        return new FileNameTemplate(trimmed);
    }

    /**
     * Case-insensitive pattern matching the bare file name for the given record type and date.
     */
    public Pattern patternFor(RecordType recordType, LocalDate date) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            String placeholder = placeholderAt(i);
            if (placeholder != null) {
                regex.append(Pattern.quote(substitute(placeholder, recordType, date)));
                i += placeholder.length();
                continue;
            }
            char c = template.charAt(i);
            if (c == '*') {
                regex.append(".*");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }

    /**
     * Fixed leading part of the name for a date, up to the first wildcard or type placeholder.
     * Used to narrow object-store listings.
     */
    public String literalPrefix(LocalDate date) {
        StringBuilder prefix = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            String placeholder = placeholderAt(i);
            if (TYPE.equals(placeholder) || template.charAt(i) == '*') {
                break;
            }
            if (placeholder != null) {
                prefix.append(substitute(placeholder, null, date));
                i += placeholder.length();
                continue;
            }
            prefix.append(template.charAt(i));
            i++;
        }
        return prefix.toString();
    }

    public boolean matches(String fileName, RecordType recordType, LocalDate date) {
        return fileName != null && patternFor(recordType, date).matcher(fileName).matches();
    }

    public String describe(RecordType recordType, LocalDate date) {
        return template
            .replace(MONTH, twoDigits(date.getMonthValue()))
            .replace(DAY, twoDigits(date.getDayOfMonth()))
            .replace(YEAR, String.valueOf(date.getYear()))
            .replace(TYPE, String.valueOf(recordType.fileSuffix()));
    }

    @Override
    public String toString() {
        return template;
    }

    private String placeholderAt(int index) {
        for (String placeholder : new String[] {MONTH, DAY, YEAR, TYPE}) {
            if (template.startsWith(placeholder, index)) {
                return placeholder;
            }
        }
        return null;
    }

    private static String substitute(String placeholder, RecordType recordType, LocalDate date) {
        return switch (placeholder) {
            case MONTH -> twoDigits(date.getMonthValue());
            case DAY -> twoDigits(date.getDayOfMonth());
            case YEAR -> String.valueOf(date.getYear());
            case TYPE -> String.valueOf(recordType.fileSuffix());
            default -> throw new IllegalStateException("Unknown placeholder " + placeholder);
        };
    }

    private static String twoDigits(int value) {
        return String.format(Locale.ROOT, "%02d", value);
    }
}
