package wizardrunner.runner;

import com.fasterxml.jackson.databind.JsonNode;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.StartAction;
import wizardrunner.model.UserData;
import wizardrunner.model.WizardField;
import wizardrunner.model.WizardPage;
import wizardrunner.model.WizardStructure;
import wizardrunner.validation.SchemaValidator;
import wizardrunner.validation.ValidationResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs one wizard end-to-end in a fresh browser session.
 *
 * <p>For each execution the runner:
 * <ol>
 *   <li>Validates the user data against the data schema. Rejected data
 *       returns a result straight away; no browser is started.</li>
 *   <li>Opens a {@link BrowserSession} and loads the wizard URL with retries.</li>
 *   <li>Clicks the start action, if the wizard declares one.</li>
 *   <li>For every page: fills each field in declared order, then clicks
 *       continue and waits for the next page.</li>
 *   <li>Extracts results from the terminal page.</li>
 * </ol>
 *
 * <p>A screenshot is captured at each step. Any failure captures one more
 * screenshot of the failure point and becomes a failed {@link ExecutionResult};
 * {@code execute} itself does not throw. The browser is closed on every path.
 *
 * <p>The runner holds no per-execution state, so one instance can serve
 * concurrent executions, each with its own browser.
 */
public class WizardRunner {

    private static final Logger log = LoggerFactory.getLogger(WizardRunner.class);

    private final RunnerConfig config;
    private final TimeoutBudget budget;
    private final NavigationRetryPolicy navigationPolicy;
    private final WebDriverFactory driverFactory;
    private final SchemaValidator validator;
    private final FieldExecutor fieldExecutor;
    private final ResultExtractor resultExtractor;
    private final DropdownFactory dropdowns;
    private final Clock clock;
    private final Sleeper sleeper;

    // ── Constructors ──────────────────────────────────────────────────────

    /**
     * Creates a runner that starts local browsers.
     *
     * @throws IllegalStateException if the configured timeouts are out of order
     */
    public WizardRunner(RunnerConfig config) {
        this(config, new DefaultWebDriverFactory());
    }

    public WizardRunner(RunnerConfig config, WebDriverFactory driverFactory) {
        this(config, driverFactory, new SchemaValidator(), new FieldExecutor(),
                DropdownFactory.SELENIUM, Clock.systemUTC(), Sleeper.SYSTEM_SLEEPER);
    }

    /**
     * Package-private constructor for unit tests: accepts pre-built
     * collaborators so mocks, a fixed clock and a no-op sleeper can be
     * injected without starting a real browser.
     */
    WizardRunner(RunnerConfig config, WebDriverFactory driverFactory, SchemaValidator validator,
                 FieldExecutor fieldExecutor, DropdownFactory dropdowns, Clock clock, Sleeper sleeper) {
        this.config           = config;
        this.budget           = config.timeoutBudget();
        this.navigationPolicy = config.navigationRetryPolicy();
        this.driverFactory    = driverFactory;
        this.validator        = validator;
        this.fieldExecutor    = fieldExecutor;
        this.resultExtractor  = new ResultExtractor(config.getResultsMaxTextChars());
        this.dropdowns        = dropdowns;
        this.clock            = clock;
        this.sleeper          = sleeper;
        budget.warnIfNavigationExceedsTotal(navigationPolicy);
    }

    // ── Public API ────────────────────────────────────────────────────────

    /** Checks {@code userData} against {@code schema} without touching a browser. */
    public ValidationResult validate(JsonNode schema, UserData userData) {
        return validator.validate(schema, userData);
    }

    /**
     * Validates {@code userData} and, if it passes, drives the wizard.
     *
     * @return the outcome; never {@code null}
     */
    public ExecutionResult execute(WizardStructure wizard, JsonNode schema, UserData userData) {
        Instant started = clock.instant();
        ExecutionMode mode = config.getMode();

        ValidationResult validation = validator.validate(schema, userData);
        if (!validation.isValid()) {
            log.warn("Rejected data for wizard '{}': {}", wizard.getWizardId(), validation.summary());
            return ExecutionResult.rejected(wizard.getWizardId(), validation, mode, millisSince(started));
        }
        return run(wizard, userData, mode, started);
    }

    // ── Execution ─────────────────────────────────────────────────────────

    private ExecutionResult run(WizardStructure wizard, UserData userData, ExecutionMode mode, Instant started) {
        String wizardId = wizard.getWizardId();
        log.info("Starting wizard '{}' ({} page(s), mode={}) at {}",
                wizardId, wizard.getPageCount(), mode, wizard.getUrl());

        ExecutionDeadline deadline = new ExecutionDeadline(clock, budget.totalExecution());
        ExecutionResult.Builder run = new ExecutionResult.Builder(wizardId, mode);
        ScreenshotRecorder recorder = new ScreenshotRecorder(
                wizardId, config.getJpegQuality(), config.getScreenshotSaveDir(), clock);
        ScreenshotRetention.Outcome outcome = ScreenshotRetention.Outcome.SUCCESS;

        final BrowserSession session;
        try {
            session = BrowserSession.open(driverFactory, config, budget, clock, sleeper);
        } catch (RuntimeException e) {
            recordFailure(run, e);
            return finish(run, recorder, mode, ScreenshotRetention.Outcome.FAILURE, started);
        }

        try (session) {
            try {
                walk(session, wizard, userData, run, recorder, deadline);
            } catch (RuntimeException e) {
                outcome = ScreenshotRetention.Outcome.FAILURE;
                recordFailure(run, e);
                recorder.capture(session.driver(), "error");
            }
        }
        return finish(run, recorder, mode, outcome, started);
    }

    private void walk(BrowserSession session, WizardStructure wizard, UserData userData,
                      ExecutionResult.Builder run, ScreenshotRecorder recorder, ExecutionDeadline deadline) {
        WebDriver driver = session.driver();

        // INIT -> NAVIGATED
        run.navigationAttempts(session.navigate(wizard.getUrl(), navigationPolicy, deadline));
        run.state(ExecutionState.NAVIGATED);
        Pacing.settle(sleeper, config.getPageSettle());
        recorder.capture(driver, "initial");

        // NAVIGATED -> STARTED
        StartAction start = wizard.getStartAction();
        if (start != null) {
            deadline.check("start action");
            log.info("Clicking start action {}", start);
            clickControl(session, "start_action", start);
            awaitNextPage(session);
            run.state(ExecutionState.STARTED);
            recorder.capture(driver, "after_start_action");
        }

        // PAGE[1..N]
        FieldContext ctx = FieldContext.of(session, config, budget, sleeper, dropdowns);
        List<WizardPage> pages = wizard.getPages();
        for (WizardPage page : pages) {
            int n = page.getPageNumber();
            run.state(ExecutionState.PAGE);
            log.info("Page {}/{}{}", n, pages.size(),
                    page.getPageTitle() != null ? ": " + page.getPageTitle() : "");

            for (WizardField field : page.getFields()) {
                deadline.check("field '" + field.getFieldId() + "' on page " + n);
                run.fieldReport(fieldExecutor.execute(ctx, field, userData.get(field.getFieldId())));
            }
            recorder.capture(driver, "page_" + n + "_filled");

            deadline.check("continue on page " + n);
            clickControl(session, "continue_button[page " + n + "]", page.getContinueButton());
            awaitNextPage(session);
            run.pageCompleted();
            recorder.capture(driver, "page_" + n + "_continued");
        }

        // RESULTS -> DONE
        run.state(ExecutionState.RESULTS);
        deadline.check("result extraction");
        run.results(resultExtractor.extract(driver, wizard.effectiveResults()));
        run.state(ExecutionState.DONE);
    }

    private void clickControl(BrowserSession session, String controlId, ElementSelector control) {
        try {
            Selectors.resolveClickable(control, session.waits()).click();
        } catch (WizardRunnerException | WebDriverException e) {
            throw new FieldFillException(controlId, String.valueOf(control),
                    "could not click: " + NavigationException.firstLine(e.getMessage()), e);
        }
    }

    private void awaitNextPage(BrowserSession session) {
        session.waitForPageLoad();
        Pacing.settle(sleeper, config.getPageSettle());
    }

    // ── Result assembly ───────────────────────────────────────────────────

    private void recordFailure(ExecutionResult.Builder run, RuntimeException e) {
        if (e instanceof NavigationException ne) {
            run.navigationAttempts(ne.getAttempts());
        }
        if (e instanceof WizardRunnerException wre) {
            log.error("Wizard '{}' failed in state {}: {}", run.wizardId(), run.state(), e.getMessage());
            run.failure(wre.getKind(), e.getMessage());
        } else {
            log.error("Wizard '{}' failed in state {} with an unexpected error", run.wizardId(), run.state(), e);
            run.failure(ErrorKind.INTERNAL,
                    e.getClass().getSimpleName() + ": " + NavigationException.firstLine(e.getMessage()));
        }
    }

    private ExecutionResult finish(ExecutionResult.Builder run, ScreenshotRecorder recorder,
                                   ExecutionMode mode, ScreenshotRetention.Outcome outcome, Instant started) {
        List<Screenshot> captured = recorder.getAll();
        run.screenshots(captured.size(), ScreenshotRetention.select(mode, outcome, captured));
        run.executionTimeMs(millisSince(started));
        ExecutionResult result = run.build();
        log.info("{}", result);
        return result;
    }

    private long millisSince(Instant started) {
        return Duration.between(started, clock.instant()).toMillis();
    }
}
