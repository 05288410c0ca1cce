package validator;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Набор результатов проверок. {@link #allPassed()} - конъюнкция всех проверок.
 */
public record ValidationReport(List<ValidationCheck> checks) {
    public ValidationReport {
        checks = List.copyOf(checks);
    }

    public boolean allPassed() {
        return checks.stream().allMatch(ValidationCheck::passed);
    }

    public List<ValidationCheck> failedChecks() {
        return checks.stream().filter(check -> !check.passed()).collect(Collectors.toList());
    }

    public int passedCount() {
        return checks.size() - failedChecks().size();
    }
}
