package report;

import analysis.AnalysisConfig;
import analysis.AnalysisResult;

import java.time.Instant;
import java.util.Objects;

/**
 * Одна операция экспорта. Живет только пока выполняется.
 */
public record ExportJob<C extends AnalysisConfig>(ExportKind kind, AnalysisResult<C> source, Instant timestamp) {
    public ExportJob {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
