package webui.model;

import model.Dataset;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Набор данных в JSON: имя, порядок колонок и строки "колонка -> значение".
 * Если колонки не указаны, они берутся из ключей строк в порядке появления.
 */
public record DatasetPayload(
    String name,
    List<String> columns,
    List<Map<String, Object>> rows
) {
    public Dataset toDataset() {
        List<Map<String, Object>> safeRows = rows != null ? rows : List.of();
        List<String> safeColumns = columns;
        if (safeColumns == null || safeColumns.isEmpty()) {
            Set<String> seen = new LinkedHashSet<>();
            safeRows.forEach(row -> seen.addAll(row.keySet()));
            safeColumns = new ArrayList<>(seen);
        }
        return new Dataset(name, safeColumns, safeRows);
    }
}
