package cli;

import model.Dataset;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Чтение набора данных из CSV-файла с заголовком.
 *
 * <p>Значения, которые разбираются как число, становятся {@link Double}; пустые ячейки - {@code null};
 * остальные остаются строками. Поддерживаются значения в двойных кавычках со вложенными запятыми
 * и удвоенными кавычками.
 */
public final class CsvDatasetReader {

    public Dataset read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String name = file.getFileName() != null ? file.getFileName().toString() : "dataset";
            return read(name, reader);
        }
    }

    public Dataset read(String name, BufferedReader reader) throws IOException {
        String headerLine = reader.readLine();
        if (headerLine == null) {
            throw new IOException("CSV file is empty");
        }
        if (headerLine.startsWith("\uFEFF")) {
            headerLine = headerLine.substring(1);
        }
        List<String> columns = new ArrayList<>();
        for (String header : splitLine(headerLine)) {
            columns.add(header.trim());
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> cells = splitLine(line);
            if (cells.size() > columns.size()) {
                throw new IOException("Line " + lineNumber + " has " + cells.size() +
                    " values, expected " + columns.size());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < cells.size() ? parseValue(cells.get(i)) : null);
            }
            rows.add(row);
        }
        return new Dataset(name, columns, rows);
    }

    static Object parseValue(String raw) {
        String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    static List<String> splitLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }
}
