package cli;

import analysis.AnalysisState;
import model.Notification;
import wizard.WizardListener;
import wizard.WizardProgress;
import wizard.WizardSession;

import java.io.PrintWriter;

/**
 * Вывод событий мастера в консоль.
 */
final class ConsoleWizardListener implements WizardListener {
    private final PrintWriter out;
    private final boolean verbose;

    ConsoleWizardListener(PrintWriter out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    @Override
    public void onProgress(WizardSession<?> session, WizardProgress progress) {
        if (verbose) {
            out.println("  Step " + progress.current().getId() + "/6: " + progress.current().getLabel());
        }
    }

    @Override
    public void onAnalysisState(WizardSession<?> session, AnalysisState state) {
        if (state == AnalysisState.PENDING) {
            out.println("Running " + session.getScreen().getDisplayName() + "...");
        }
    }

    @Override
    public void onNotification(WizardSession<?> session, Notification notification) {
        String prefix = switch (notification.level()) {
            case ERROR -> "ERROR: ";
            case SUCCESS -> "OK: ";
            case INFO -> "";
        };
        String description = notification.description() != null ? " - " + notification.description() : "";
        out.println(prefix + notification.title() + description);
    }
}
