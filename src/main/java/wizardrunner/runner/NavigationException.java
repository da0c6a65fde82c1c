package wizardrunner.runner;

/**
 * The wizard's start URL could not be loaded within the retry policy.
 */
public class NavigationException extends WizardRunnerException {

    private final String url;
    private final int attempts;

    public NavigationException(String url, int attempts, Throwable lastFailure) {
        super(ErrorKind.NAVIGATION,
                "Failed to load " + url + " after " + attempts + " attempt(s)"
                        + (lastFailure != null ? ": " + firstLine(lastFailure.getMessage()) : ""),
                lastFailure);
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl()   { return url; }
    public int getAttempts() { return attempts; }

    /** Selenium messages carry multi-line build info; keep only the headline. */
    static String firstLine(String message) {
        if (message == null) return "";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
