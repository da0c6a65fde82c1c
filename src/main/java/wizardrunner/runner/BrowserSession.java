package wizardrunner.runner;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * One isolated browser session, opened for a single execution and always
 * closed when that execution ends.
 *
 * <p>Page-load and script timeouts come from the {@link TimeoutBudget};
 * implicit waits are never set.
 */
public final class BrowserSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserSession.class);

    private final WebDriver driver;
    private final TimeoutBudget budget;
    private final Sleeper sleeper;
    private final WaitStrategy wait;
    private boolean closed;

    private BrowserSession(WebDriver driver, TimeoutBudget budget, Clock clock, Sleeper sleeper) {
        this.driver = driver;
        this.budget = budget;
        this.sleeper = sleeper;
        this.wait = new WaitStrategy(driver, budget.operation(), clock, sleeper);
    }

    /**
     * Starts a browser through {@code factory} and applies the session timeouts.
     *
     * @throws WizardRunnerException if the browser cannot be started
     */
    public static BrowserSession open(WebDriverFactory factory, RunnerConfig config,
                                      TimeoutBudget budget, Clock clock, Sleeper sleeper) {
        WebDriver driver = factory.create(config);
        if (driver == null) {
            throw new WizardRunnerException("WebDriverFactory returned no driver");
        }
        BrowserSession session = new BrowserSession(driver, budget, clock, sleeper);
        try {
            WebDriver.Timeouts timeouts = driver.manage().timeouts();
            timeouts.pageLoadTimeout(budget.navigationAttempt());
            timeouts.scriptTimeout(budget.operation());
        } catch (WebDriverException e) {
            session.close();
            throw new WizardRunnerException("Could not configure browser timeouts", e);
        }
        return session;
    }

    public WebDriver driver()   { return driver; }

    /** Waits bounded by the page-operation timeout. */
    public WaitStrategy waits() { return wait; }

    /**
     * Loads {@code url}, retrying per {@code policy}. Each attempt is a
     * navigation followed by a wait for {@code document.readyState}.
     *
     * @return the number of attempts used (1 when the first one succeeded)
     * @throws NavigationException        once every attempt has failed
     * @throws ExecutionTimeoutException  if the execution budget runs out between attempts
     */
    public int navigate(String url, NavigationRetryPolicy policy, ExecutionDeadline deadline) {
        WaitStrategy loadWait = wait.withTimeout(policy.attemptTimeout());
        RuntimeException last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                log.info("Retrying navigation in {}ms (attempt {}/{})",
                        policy.delay().toMillis(), attempt, policy.maxAttempts());
                Pacing.settle(sleeper, policy.delay());
            }
            deadline.check("navigation attempt " + attempt);
            try {
                driver.get(url);
                loadWait.waitForPageLoad();
                log.info("Loaded {} on attempt {}", url, attempt);
                return attempt;
            } catch (WebDriverException | WizardRunnerException e) {
                last = e;
                log.warn("Navigation attempt {}/{} to {} failed: {}",
                        attempt, policy.maxAttempts(), url, NavigationException.firstLine(e.getMessage()));
            }
        }
        throw new NavigationException(url, policy.maxAttempts(), last);
    }

    /** Waits for {@code document.readyState == 'complete'} within the navigation bound. */
    public void waitForPageLoad() {
        wait.withTimeout(budget.navigationAttempt()).waitForPageLoad();
    }

    /** Quits the browser. Safe to call more than once. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            driver.quit();
            log.debug("Browser session closed");
        } catch (WebDriverException e) {
            log.warn("Failed to quit browser cleanly: {}", NavigationException.firstLine(e.getMessage()));
        }
    }
}
