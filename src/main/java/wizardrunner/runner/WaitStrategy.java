package wizardrunner.runner;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedCondition;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.FluentWait;
import org.openqa.selenium.support.ui.Sleeper;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Centralises all explicit wait logic for the runner. Implicit waits are
 * NEVER set; every wait goes through this class with a bound taken from
 * {@link TimeoutBudget}.
 */
public class WaitStrategy {

    private static final Logger log = LoggerFactory.getLogger(WaitStrategy.class);

    static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final WebDriver driver;
    private final WebDriverWait wait;
    private final Duration timeout;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * @param driver  active WebDriver session
     * @param timeout maximum time to wait for any condition
     */
    public WaitStrategy(WebDriver driver, Duration timeout) {
        this(driver, timeout, Clock.systemDefaultZone(), Sleeper.SYSTEM_SLEEPER);
    }

    public WaitStrategy(WebDriver driver, Duration timeout, Clock clock, Sleeper sleeper) {
        this.driver = driver;
        this.timeout = timeout;
        this.clock = clock;
        this.sleeper = sleeper;
        this.wait = new WebDriverWait(driver, timeout, POLL_INTERVAL, clock, sleeper);
    }

    /** Same driver, clock and sleeper with a different bound. */
    public WaitStrategy withTimeout(Duration other) {
        return new WaitStrategy(driver, other, clock, sleeper);
    }

    // ── Element conditions ──────────────────────────────────────────────

    /** Located element once it is attached, visible or not. Used for click controls read by JavaScript. */
    public WebElement waitForPresent(By locator) {
        return await(ExpectedConditions.presenceOfElementLocated(locator), "present", locator);
    }

    /** Located element once it is displayed; fill targets go through here. */
    public WebElement waitForVisible(By locator) {
        return await(ExpectedConditions.visibilityOfElementLocated(locator), "visible", locator);
    }

    /** Located element once it is displayed and enabled. */
    public WebElement waitForClickable(By locator) {
        return await(ExpectedConditions.elementToBeClickable(locator), "clickable", locator);
    }

    private WebElement await(ExpectedCondition<WebElement> condition, String state, By locator) {
        log.debug("Awaiting {} {} (bound {}ms)", state, locator, timeout.toMillis());
        try {
            return wait.until(condition);
        } catch (WebDriverException e) {
            throw new WizardRunnerException(
                    locator + " not " + state + " after " + timeout.toMillis() + "ms", e);
        }
    }

    /**
     * Blocks until {@code document.readyState} reads {@code complete}.
     *
     * @throws WizardRunnerException when the bound elapses first
     */
    public void waitForPageLoad() {
        try {
            wait.until(d -> "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
        } catch (WebDriverException e) {
            throw new WizardRunnerException(
                    "Page still loading after " + timeout.toMillis() + "ms", e);
        }
    }

    // ── Bounded attempts ────────────────────────────────────────────────

    /**
     * Repeats {@code action} until it completes, or until {@code bound}
     * elapses. A missing or stale element and a disabled control
     * ({@link UnsupportedOperationException} from Selenium's {@code Select})
     * count as misses and are retried.
     *
     * @return {@code true} if the action completed, {@code false} on timeout
     * @throws org.openqa.selenium.WebDriverException any other failure raised by the action
     */
    public boolean attemptWithin(Duration bound, Consumer<WebDriver> action) {
        FluentWait<WebDriver> attempt = new FluentWait<>(driver, clock, sleeper)
                .withTimeout(bound)
                .pollingEvery(POLL_INTERVAL)
                .ignoring(NoSuchElementException.class)
                .ignoring(StaleElementReferenceException.class)
                .ignoring(UnsupportedOperationException.class);
        try {
            attempt.until(d -> {
                action.accept(d);
                return Boolean.TRUE;
            });
            return true;
        } catch (TimeoutException e) {
            log.debug("Attempt did not succeed within {}ms: {}", bound.toMillis(),
                    e.getCause() != null ? NavigationException.firstLine(e.getCause().getMessage()) : "timeout");
            return false;
        }
    }
}
