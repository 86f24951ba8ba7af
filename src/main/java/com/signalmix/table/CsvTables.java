package com.signalmix.table;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the pipeline's CSV artifacts.
 */
public final class CsvTables {
    private CsvTables() {
    }

    /**
     * @return empty when the file does not exist; a header-only table when it has no data rows
     */
    public static Optional<Table> read(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        String text = Files.readString(path, StandardCharsets.UTF_8);
        return Optional.of(parse(text));
    }

    public static Table parse(String text) {
        String body = text == null ? "" : text;
        if (body.startsWith("\uFEFF")) {
            body = body.substring(1);
        }
        List<List<String>> records = splitRecords(body);
        if (records.isEmpty()) {
            return Table.empty(List.of());
        }

        List<String> header = dedupeHeader(records.get(0));
        Table table = new Table(header);
        for (int i = 1; i < records.size(); i++) {
            List<String> cols = records.get(i);
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                String value = c < cols.size() ? cols.get(c) : null;
                row.put(header.get(c), value == null || value.isEmpty() ? null : value);
            }
            table.addRow(row);
        }
        return table;
    }

    public static void write(Path path, Table table) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, format(table), StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }

    public static String format(Table table) {
        StringBuilder sb = new StringBuilder();
        List<String> columns = table.columns();
        appendLine(sb, columns);
        for (Map<String, String> row : table.rows()) {
            List<String> values = new ArrayList<>(columns.size());
            for (String column : columns) {
                values.add(row.get(column));
            }
            appendLine(sb, values);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(values.get(i)));
        }
        sb.append('\n');
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean quote = value.indexOf(',') >= 0
                || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0
                || (!value.isEmpty() && (Character.isWhitespace(value.charAt(0))
                || Character.isWhitespace(value.charAt(value.length() - 1))));
        if (!quote) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    // Quoted fields may span lines.
    private static List<List<String>> splitRecords(String text) {
        List<List<String>> out = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuote = false;
        boolean lineHasContent = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inQuote) {
                if (ch == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuote = false;
                    }
                } else {
                    field.append(ch);
                }
                continue;
            }
            if (ch == '"') {
                inQuote = true;
                lineHasContent = true;
            } else if (ch == ',') {
                current.add(field.toString());
                field.setLength(0);
                lineHasContent = true;
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                if (lineHasContent) {
                    current.add(field.toString());
                    out.add(current);
                }
                current = new ArrayList<>();
                field.setLength(0);
                lineHasContent = false;
            } else {
                field.append(ch);
                if (!Character.isWhitespace(ch)) {
                    lineHasContent = true;
                }
            }
        }
        if (lineHasContent) {
            current.add(field.toString());
            out.add(current);
        }
        return out;
    }

    private static List<String> dedupeHeader(List<String> raw) {
        List<String> out = new ArrayList<>(raw.size());
        Map<String, Integer> seen = new HashMap<>();
        for (String name : raw) {
            String column = name == null ? "" : name;
            int count = seen.merge(column, 1, Integer::sum);
            out.add(count == 1 ? column : column + "." + (count - 1));
        }
        return out;
    }
}
