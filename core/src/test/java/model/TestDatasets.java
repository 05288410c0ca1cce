package model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Наборы данных для тестов.
 */
public final class TestDatasets {

    private TestDatasets() {
    }

    /**
     * Ряд из {@code n} наблюдений с колонками date (строка) и sales (число).
     */
    public static Dataset series(int n) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", "2024-01-" + (i + 1));
            row.put("sales", 100.0 + Math.sin(i) * 10);
            rows.add(row);
        }
        return new Dataset("sales.csv", List.of("date", "sales"), rows);
    }

    /**
     * Таблица из {@code n} строк с числовыми колонками.
     */
    public static Dataset numeric(int n, String... columns) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < columns.length; c++) {
                row.put(columns[c], (double) (i * (c + 1) % 17));
            }
            rows.add(row);
        }
        return new Dataset("table.csv", List.of(columns), rows);
    }
}
