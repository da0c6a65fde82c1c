package wizardrunner.runner;

/**
 * Unchecked exception thrown by runner components when a step cannot be
 * completed. The {@link ErrorKind} becomes the failed result's error type.
 */
public class WizardRunnerException extends RuntimeException {

    private final ErrorKind kind;

    public WizardRunnerException(String msg) {
        this(ErrorKind.INTERNAL, msg, null);
    }

    public WizardRunnerException(String msg, Throwable cause) {
        this(ErrorKind.INTERNAL, msg, cause);
    }

    protected WizardRunnerException(ErrorKind kind, String msg, Throwable cause) {
        super(msg, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }
}
