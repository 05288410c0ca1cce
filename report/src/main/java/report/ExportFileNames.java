package report;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Имена файлов экспорта: {@code <AnalysisName>_<yyyy-MM-dd>.<ext>}.
 */
public final class ExportFileNames {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private ExportFileNames() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String fileName(String analysisName, ExportKind kind, LocalDate date) {
        return analysisName + "_" + DATE.format(date) + "." + kind.getExtension();
    }

    public static String fileName(String analysisName, ExportKind kind, Clock clock) {
        return fileName(analysisName, kind, LocalDate.now(clock));
    }
}
