package model;

import java.util.*;

/**
 * Активный набор данных, на котором работает мастер анализа.
 *
 * <p>Набор данных передается в ядро уже загруженным (из файла, примера или внешнего приложения):
 * ядро не читает данные самостоятельно. Каждая строка - отображение "имя колонки -> значение",
 * где числовые значения представлены экземплярами {@link Number}.
 *
 * <p>Объект неизменяемый: смена набора данных всегда означает создание нового экземпляра,
 * что позволяет сессии мастера обнаруживать смену данных по идентичности и равенству.
 */
public final class Dataset {
    private final String name;
    private final List<String> columns;
    private final List<Map<String, Object>> rows;
    private final List<String> numericColumns;

    public Dataset(String name, List<String> columns, List<Map<String, Object>> rows) {
        this.name = name != null ? name : "dataset";
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns cannot be null"));
        List<Map<String, Object>> copied = new ArrayList<>();
        for (Map<String, Object> row : Objects.requireNonNull(rows, "rows cannot be null")) {
            copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copied);
        this.numericColumns = detectNumericColumns();
    }

    public static Dataset empty() {
        return new Dataset("empty", List.of(), List.of());
    }

    public String getName() {
        return name;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    /**
     * Колонки, все непустые значения которых числовые (и хотя бы одно значение присутствует).
     */
    public List<String> getNumericColumns() {
        return numericColumns;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Числовой ряд колонки: нечисловые и пустые значения отбрасываются.
     */
    public List<Double> numericValues(String column) {
        List<Double> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (row.get(column) instanceof Number number) {
                values.add(number.doubleValue());
            }
        }
        return values;
    }

    private List<String> detectNumericColumns() {
        List<String> numeric = new ArrayList<>();
        for (String column : columns) {
            boolean sawNumber = false;
            boolean allNumeric = true;
            for (Map<String, Object> row : rows) {
                Object value = row.get(column);
                if (value == null) {
                    continue;
                }
                if (value instanceof Number) {
                    sawNumber = true;
                } else {
                    allNumeric = false;
                    break;
                }
            }
            if (sawNumber && allNumeric) {
                numeric.add(column);
            }
        }
        return Collections.unmodifiableList(numeric);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset other)) return false;
        return name.equals(other.name) && columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset{name=" + name + ", columns=" + columns.size() + ", rows=" + rows.size() + "}";
    }
}
