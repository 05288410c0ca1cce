package screen;

import java.util.*;

/**
 * Описание области результатов экрана: то, что попадает в табличный экспорт,
 * и то, что выкладывается на страницу для растеризации в PNG.
 *
 * <p>Макет строится из закэшированного результата и не зависит от способа отображения.
 */
public final class ExportLayout {
    private final String title;
    private final List<Section> sections;
    private final Map<String, String> plots;

    private ExportLayout(Builder builder) {
        this.title = Objects.requireNonNull(builder.title, "title cannot be null");
        this.sections = List.copyOf(builder.sections);
        this.plots = Collections.unmodifiableMap(new LinkedHashMap<>(builder.plots));
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    public String getTitle() {
        return title;
    }

    public List<Section> getSections() {
        return sections;
    }

    /**
     * Графики результата: имя -> изображение в base64 (PNG) или ссылка на удаленный ресурс.
     */
    public Map<String, String> getPlots() {
        return plots;
    }

    /**
     * Раздел: необязательный заголовок, пары "метка - значение" и необязательная таблица.
     */
    public record Section(String heading, List<Row> rows, Table table) {
        public Section {
            rows = List.copyOf(rows);
        }

        public Optional<Table> optionalTable() {
            return Optional.ofNullable(table);
        }
    }

    public record Row(String label, String value) {
        public Row {
            Objects.requireNonNull(label, "label cannot be null");
            value = value != null ? value : "";
        }
    }

    public record Table(List<String> headers, List<List<String>> rows) {
        public Table {
            headers = List.copyOf(headers);
            List<List<String>> copied = new ArrayList<>();
            for (List<String> row : rows) {
                copied.add(List.copyOf(row));
            }
            rows = Collections.unmodifiableList(copied);
        }
    }

    public static class Builder {
        private final String title;
        private final List<Section> sections = new ArrayList<>();
        private final Map<String, String> plots = new LinkedHashMap<>();

        private String heading;
        private List<Row> rows = new ArrayList<>();
        private Table table;
        private boolean open;

        private Builder(String title) {
            this.title = title;
        }

        /**
         * Начать новый раздел; предыдущий раздел закрывается.
         */
        public Builder section(String heading) {
            flush();
            this.heading = heading;
            this.open = true;
            return this;
        }

        public Builder row(String label, Object value) {
            this.open = true;
            this.rows.add(new Row(label, value != null ? String.valueOf(value) : ""));
            return this;
        }

        public Builder table(List<String> headers, List<List<String>> tableRows) {
            this.open = true;
            this.table = new Table(headers, tableRows);
            return this;
        }

        /**
         * Добавить график, если он присутствует в ответе.
         */
        public Builder plot(String name, String image) {
            if (image != null && !image.isBlank()) {
                this.plots.put(name, image);
            }
            return this;
        }

        public ExportLayout build() {
            flush();
            return new ExportLayout(this);
        }

        private void flush() {
            if (open) {
                sections.add(new Section(heading, rows, table));
            }
            heading = null;
            rows = new ArrayList<>();
            table = null;
            open = false;
        }
    }
}
