package wizardrunner.model;

import java.util.List;

/**
 * Thrown when a wizard structure document is unreadable or structurally
 * invalid. Carries every problem found, not only the first.
 */
public class WizardStructureException extends RuntimeException {

    private final List<String> problems;

    public WizardStructureException(String source, List<String> problems) {
        super("Invalid wizard structure " + source + ":\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public WizardStructureException(String msg, Throwable cause) {
        super(msg, cause);
        this.problems = List.of(msg);
    }

    public List<String> getProblems() {
        return problems;
    }
}
