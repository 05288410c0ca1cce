package webui.model;

import screen.AnalysisScreen;

/**
 * Информация об экране анализа для выбора в интерфейсе.
 */
public record ScreenInfo(
    String slug,
    String displayName,
    String exportName,
    String endpoint,
    String scriptFile
) {
    public static ScreenInfo of(AnalysisScreen<?> screen) {
        return new ScreenInfo(screen.getSlug(), screen.getDisplayName(), screen.getExportName(),
            screen.getEndpoint(), screen.getScriptFile());
    }
}
