package wizardrunner.runner;

import com.fasterxml.jackson.databind.JsonNode;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Sleeper;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import wizardrunner.Fixtures;
import wizardrunner.model.UserData;
import wizardrunner.model.WizardIO;
import wizardrunner.model.WizardStructure;
import wizardrunner.validation.SchemaValidator;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link WizardRunner}.
 *
 * <p>The browser is a mock; schema validation, field handling, waits and
 * screenshot capture are real. Uses the package-private constructor so a
 * no-op sleeper and short timeouts keep every test fast.
 */
public class WizardRunnerTest {

    // ── Mock interfaces ───────────────────────────────────────────────────

    /** Combined interface so Mockito can create a mock satisfying all Selenium needs. */
    private interface FullDriver extends WebDriver, JavascriptExecutor, TakesScreenshot {}

    /** Clock that moves one second forward every time it is read. */
    private static final class TickingClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public synchronized Instant instant() {
            now = now.plusSeconds(1);
            return now;
        }
    }

    // ── Mocks ─────────────────────────────────────────────────────────────

    @Mock FullDriver driver;
    @Mock WebDriver.Options options;
    @Mock WebDriver.Timeouts timeouts;
    @Mock WebElement element;
    @Mock Dropdown dropdown;
    @Mock Sleeper sleeper;
    @Mock WebDriverFactory factory;

    private AutoCloseable mocks;
    private Properties props;
    private WizardStructure twoPage;
    private JsonNode twoPageSchema;
    private UserData ada;

    @BeforeMethod
    public void setUp() throws IOException {
        mocks = MockitoAnnotations.openMocks(this);

        when(factory.create(any())).thenReturn(driver);
        when(driver.manage()).thenReturn(options);
        when(options.timeouts()).thenReturn(timeouts);
        when(driver.executeScript("return document.readyState")).thenReturn("complete");
        when(driver.findElement(any(By.class))).thenReturn(element);
        when(driver.getCurrentUrl()).thenReturn("https://wizard.example.test/done");
        when(driver.getTitle()).thenReturn("Done");
        when(driver.getScreenshotAs(OutputType.BYTES)).thenReturn(new byte[]{1, 2, 3});
        when(element.isDisplayed()).thenReturn(true);
        when(element.isEnabled()).thenReturn(true);

        props = new Properties();
        props.setProperty(RunnerConfig.KEY_SELECT_TIMEOUT, "50");
        props.setProperty(RunnerConfig.KEY_OPERATION_TIMEOUT, "100");
        props.setProperty(RunnerConfig.KEY_NAVIGATION_TIMEOUT, "200");
        props.setProperty(RunnerConfig.KEY_COMMAND_TIMEOUT, "1000");
        props.setProperty(RunnerConfig.KEY_EXECUTION_TIMEOUT, "5");
        props.setProperty(RunnerConfig.KEY_HOST_TIMEOUT, "10");
        props.setProperty(RunnerConfig.KEY_NAVIGATION_RETRIES, "2");
        props.setProperty(RunnerConfig.KEY_NAVIGATION_DELAY, "0");
        props.setProperty(RunnerConfig.KEY_FIELD_SETTLE, "0");
        props.setProperty(RunnerConfig.KEY_TYPEAHEAD_SETTLE, "0");
        props.setProperty(RunnerConfig.KEY_GROUP_ITEM_SETTLE, "0");
        props.setProperty(RunnerConfig.KEY_PAGE_SETTLE, "0");
        props.setProperty(RunnerConfig.KEY_MODE, "debug");

        twoPage = Fixtures.structure(Fixtures.TWO_PAGE);
        twoPageSchema = Fixtures.schema(Fixtures.TWO_PAGE);
        ada = WizardIO.readUserData(Fixtures.resource("data/two-page-valid.json"));
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private WizardRunner runner() {
        return runner(Clock.systemUTC());
    }

    private WizardRunner runner(Clock clock) {
        return new WizardRunner(new RunnerConfig(props), factory, new SchemaValidator(),
                new FieldExecutor(), el -> dropdown, clock, sleeper);
    }

    // ── Successful runs ───────────────────────────────────────────────────

    @Test(description = "Valid data walks both pages and returns the terminal page")
    public void testTwoPageWizardSucceeds() {
        ExecutionResult result = runner().execute(twoPage, twoPageSchema, ada);

        assertThat(result.isSuccess()).as(String.valueOf(result)).isTrue();
        assertThat(result.getFinalState()).isEqualTo(ExecutionState.DONE);
        assertThat(result.getFailedState()).isNull();
        assertThat(result.getPagesCompleted()).isEqualTo(2);
        assertThat(result.getNavigationAttempts()).isEqualTo(1);
        assertThat(result.getResults())
                .containsEntry("page_url", "https://wizard.example.test/done")
                .containsEntry("page_title", "Done");
        assertThat(result.getFieldReports())
                .extracting(FieldReport::getFieldId, FieldReport::getSelectStrategy)
                .containsExactly(
                        tuple("name", null),
                        tuple("country", SelectStrategy.VALUE));

        verify(driver).get("https://wizard.example.test/start");
        verify(element).sendKeys("Ada Lovelace");
        verify(dropdown).selectByValue("USA");
        verify(element, times(2)).click();
        verify(driver).quit();
    }

    @Test(description = "Debug mode returns every screenshot, in capture order")
    public void testDebugModeReturnsAllScreenshots() {
        ExecutionResult result = runner().execute(twoPage, twoPageSchema, ada);

        assertThat(result.getMode()).isEqualTo(ExecutionMode.DEBUG);
        assertThat(result.getScreenshotCount()).isEqualTo(5);
        assertThat(result.getScreenshots()).extracting(Screenshot::getLabel).containsExactly(
                "initial", "page_1_filled", "page_1_continued", "page_2_filled", "page_2_continued");
    }

    @Test(description = "Start action, typeahead, JavaScript click and group fields run in one wizard")
    public void testLoanEstimatorWithStartActionAndGroup() throws IOException {
        WebElement estimate = mock(WebElement.class);
        when(estimate.getText()).thenReturn(" $412 / month ");
        when(driver.findElements(By.cssSelector("#estimate"))).thenReturn(List.of(estimate));
        UserData data = UserData.of(Map.of(
                "household_size", 2,
                "state", "CA",
                "married", true,
                "loans", List.of(Map.of("amount", 12000, "kind", "Federal"))));

        ExecutionResult result = runner().execute(Fixtures.structure(Fixtures.LOAN_ESTIMATOR),
                Fixtures.schema(Fixtures.LOAN_ESTIMATOR), data);

        assertThat(result.isSuccess()).as(String.valueOf(result)).isTrue();
        assertThat(result.getPagesCompleted()).isEqualTo(2);
        assertThat(result.getFieldReports()).extracting(FieldReport::getFieldId)
                .containsExactly("household_size", "state", "married", "loans");
        assertThat(result.getFieldReports().get(3).getItemsAdded()).isEqualTo(1);
        assertThat(result.getResults()).containsEntry("estimate", "$412 / month").containsEntry("eligibility", null);
        assertThat(result.getScreenshots()).extracting(Screenshot::getLabel).contains("after_start_action");
        verify(driver).executeScript(JavascriptClickHandler.CLICK_SCRIPT, element);
    }

    @Test(description = "Same inputs against the same page produce the same outcome")
    public void testDeterministic() {
        WizardRunner runner = runner();

        ExecutionResult first = runner.execute(twoPage, twoPageSchema, ada);
        ExecutionResult second = runner.execute(twoPage, twoPageSchema, ada);

        assertThat(second.isSuccess()).isEqualTo(first.isSuccess());
        assertThat(second.getPagesCompleted()).isEqualTo(first.getPagesCompleted());
        assertThat(second.getFieldReports()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(first.getFieldReports());
        assertThat(second.getScreenshotCount()).isEqualTo(first.getScreenshotCount());
        verify(factory, times(2)).create(any());
        verify(driver, times(2)).quit();
    }

    // ── Rejected data ─────────────────────────────────────────────────────

    @Test(description = "Data failing the schema is rejected before any browser starts")
    public void testInvalidDataNeverOpensBrowser() throws IOException {
        UserData missingName = WizardIO.readUserData(Fixtures.resource("data/two-page-missing-name.json"));

        ExecutionResult result = runner().execute(twoPage, twoPageSchema, missingName);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo(ErrorKind.SCHEMA_VALIDATION);
        assertThat(result.getFailedState()).isEqualTo(ExecutionState.INIT);
        assertThat(result.getValidation().missingFieldIds()).containsExactly("name");
        assertThat(result.getScreenshots()).isEmpty();
        verify(factory, never()).create(any());
    }

    // ── Failures ──────────────────────────────────────────────────────────

    @Test(description = "An unreachable URL fails after every retry with a screenshot and a closed browser")
    public void testNavigationFailure() {
        doThrow(new WebDriverException("net::ERR_NAME_NOT_RESOLVED")).when(driver).get(anyString());

        ExecutionResult result = runner().execute(twoPage, twoPageSchema, ada);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo(ErrorKind.NAVIGATION);
        assertThat(result.getFailedState()).isEqualTo(ExecutionState.INIT);
        assertThat(result.getNavigationAttempts()).isEqualTo(3);
        assertThat(result.getError()).contains("ERR_NAME_NOT_RESOLVED");
        assertThat(result.getScreenshots()).extracting(Screenshot::getLabel).containsExactly("error");
        verify(driver, times(3)).get("https://wizard.example.test/start");
        verify(driver).quit();
    }

    @Test(description = "A dropdown with no matching option fails on its page")
    public void testFieldFailure() {
        doThrow(new NoSuchElementException("no option")).when(dropdown).selectByValue(anyString());
        doThrow(new NoSuchElementException("no option")).when(dropdown).selectByLabel(anyString());

        ExecutionResult result = runner().execute(twoPage, twoPageSchema, ada);

        assertThat(result.getErrorType()).isEqualTo(ErrorKind.FIELD_FILL);
        assertThat(result.getFailedState()).isEqualTo(ExecutionState.PAGE);
        assertThat(result.getPagesCompleted()).isEqualTo(1);
        assertThat(result.getError()).contains("country").contains("tried: value, label");
        assertThat(result.getScreenshots()).last().extracting(Screenshot::getLabel).isEqualTo("error");
        verify(driver).quit();
    }

    @Test(description = "A missing continue button is a field failure on the control")
    public void testContinueButtonFailure() {
        when(driver.findElement(By.cssSelector("#next"))).thenThrow(new NoSuchElementException("#next"));

        ExecutionResult result = runner().execute(twoPage, twoPageSchema, ada);

        assertThat(result.getErrorType()).isEqualTo(ErrorKind.FIELD_FILL);
        assertThat(result.getError()).contains("continue_button[page 1]");
        assertThat(result.getPagesCompleted()).isZero();
    }

    @Test(description = "A browser that cannot start yields a failed result, not an exception")
    public void testBrowserStartFailure() {
        when(factory.create(any())).thenThrow(new WizardRunnerException("chromedriver not found"));

        ExecutionResult result = runner().execute(twoPage, twoPageSchema, ada);

        assertThat(result.getErrorType()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(result.getError()).contains("chromedriver not found");
        assertThat(result.getScreenshotCount()).isZero();
    }

    @Test(description = "The total execution budget stops the run between steps")
    public void testExecutionTimeout() {
        ExecutionResult result = runner(new TickingClock()).execute(twoPage, twoPageSchema, ada);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo(ErrorKind.EXECUTION_TIMEOUT);
        verify(driver).quit();
    }

    // ── Production retention ──────────────────────────────────────────────

    @Test(description = "Production mode returns only the final screenshot of a successful run")
    public void testProductionSuccessKeepsOne() {
        props.setProperty(RunnerConfig.KEY_MODE, "production");

        ExecutionResult result = runner().execute(twoPage, twoPageSchema, ada);

        assertThat(result.getScreenshotCount()).isEqualTo(5);
        assertThat(result.getScreenshots()).extracting(Screenshot::getLabel).containsExactly("page_2_continued");
    }

    @Test(description = "Production mode returns the failure screenshot and the one before it")
    public void testProductionFailureKeepsTwo() {
        props.setProperty(RunnerConfig.KEY_MODE, "production");
        doThrow(new NoSuchElementException("no option")).when(dropdown).selectByValue(anyString());
        doThrow(new NoSuchElementException("no option")).when(dropdown).selectByLabel(anyString());

        ExecutionResult result = runner().execute(twoPage, twoPageSchema, ada);

        assertThat(result.getScreenshots()).hasSizeLessThanOrEqualTo(2);
        assertThat(result.getScreenshots()).extracting(Screenshot::getLabel)
                .containsExactly("page_1_continued", "error");
    }
}
