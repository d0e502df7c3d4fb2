package nl.bytesoflife.deltacnc.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ValidationReport {

    private final List<ValidationIssue> issues = new ArrayList<>();

    public void addIssue(ValidationIssue issue) {
        issues.add(issue);
    }

    public List<ValidationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public List<ValidationIssue> getErrors() {
        return issues.stream()
                .filter(i -> i.severity() == Severity.ERROR)
                .toList();
    }

    public List<ValidationIssue> getWarnings() {
        return issues.stream()
                .filter(i -> i.severity() == Severity.WARNING)
                .toList();
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.severity() == Severity.ERROR);
    }

    public boolean isClean() {
        return issues.isEmpty();
    }

    /**
     * Human-readable messages in check order.
     */
    public List<String> getMessages() {
        return issues.stream()
                .map(ValidationIssue::message)
                .toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Validation Report:\n");
        sb.append("  Issues: ").append(issues.size())
          .append(" (").append(getErrors().size()).append(" errors, ")
          .append(getWarnings().size()).append(" warnings)\n");
        for (ValidationIssue issue : issues) {
            sb.append("  - ").append(issue).append("\n");
        }
        return sb.toString();
    }
}
