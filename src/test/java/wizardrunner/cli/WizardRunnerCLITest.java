package wizardrunner.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import picocli.CommandLine;
import wizardrunner.Fixtures;
import wizardrunner.model.WizardIO;
import wizardrunner.runner.ExecutionMode;
import wizardrunner.runner.RunnerConfig;
import wizardrunner.runner.WebDriverFactory;
import wizardrunner.runner.WizardRunner;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link WizardRunnerCLI} against the fixture catalog.
 *
 * <p>{@code execute} runs a real {@link WizardRunner} whose browser is a mock,
 * so the whole command path is exercised without starting one.
 */
public class WizardRunnerCLITest {

    /** Combined interface so Mockito can create a mock satisfying all Selenium needs. */
    private interface FullDriver extends WebDriver, JavascriptExecutor, TakesScreenshot {}

    @Mock FullDriver driver;
    @Mock WebDriver.Options options;
    @Mock WebDriver.Timeouts timeouts;
    @Mock WebElement element;
    @Mock WebDriverFactory driverFactory;

    private AutoCloseable mocks;
    private StringWriter out;
    private StringWriter err;
    private List<RunnerConfig> runnerConfigs;
    private String wizardsDir;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(driverFactory.create(any())).thenReturn(driver);
        when(driver.manage()).thenReturn(options);
        when(options.timeouts()).thenReturn(timeouts);
        when(driver.executeScript("return document.readyState")).thenReturn("complete");
        when(driver.findElement(any(By.class))).thenReturn(element);
        when(driver.getScreenshotAs(OutputType.BYTES)).thenReturn(new byte[]{1, 2, 3});
        when(element.isDisplayed()).thenReturn(true);
        when(element.isEnabled()).thenReturn(true);
        // selectByValue on a real Select needs an <option> to pick
        WebElement option = mock(WebElement.class);
        when(element.getTagName()).thenReturn("select");
        when(element.findElements(any(By.class))).thenReturn(List.of(option));
        when(option.isEnabled()).thenReturn(true);
        when(option.isDisplayed()).thenReturn(true);

        out = new StringWriter();
        err = new StringWriter();
        runnerConfigs = new ArrayList<>();
        wizardsDir = Fixtures.wizardsRoot().toString();
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private int run(String... args) {
        Properties props = new Properties();
        props.setProperty("runner.select.strategy.timeout.ms", "50");
        props.setProperty("runner.operation.timeout.ms", "100");
        props.setProperty("runner.navigation.timeout.ms", "200");
        props.setProperty("runner.browser.command.timeout.ms", "1000");
        props.setProperty("runner.execution.timeout.sec", "5");
        props.setProperty("runner.host.request.timeout.sec", "10");
        props.setProperty("runner.navigation.retry.delay.ms", "0");
        props.setProperty("runner.field.settle.ms", "0");
        props.setProperty("runner.page.settle.ms", "0");

        WizardRunnerCLI cli = new WizardRunnerCLI(new RunnerConfig(props), cfg -> {
            runnerConfigs.add(cfg);
            return new WizardRunner(cfg, driverFactory);
        });
        CommandLine cmd = new CommandLine(cli);
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private static String data(String name) {
        return Fixtures.resource("data/" + name).toString();
    }

    // ── list ──────────────────────────────────────────────────────────────

    @Test(description = "list shows every loadable wizard and skips broken documents")
    public void testList() {
        int exit = run("-w", wizardsDir, "list");

        assertThat(exit).isEqualTo(WizardRunnerCLI.EXIT_OK);
        assertThat(out.toString())
                .contains("WIZARD")
                .contains("two-page")
                .contains("Two Page Estimator")
                .contains("loan-estimator")
                .doesNotContain("broken");
    }

    @Test
    public void testListEmptyCatalog() throws IOException {
        Path empty = Files.createTempDirectory("catalog");

        int exit = run("-w", empty.toString(), "list");

        assertThat(exit).isEqualTo(WizardRunnerCLI.EXIT_OK);
        assertThat(out.toString()).contains("No wizards found under");
    }

    // ── info ──────────────────────────────────────────────────────────────

    @Test
    public void testInfo() {
        int exit = run("-w", wizardsDir, "info", "two-page");

        assertThat(exit).isEqualTo(WizardRunnerCLI.EXIT_OK);
        assertThat(out.toString())
                .contains("Wizard : two-page")
                .contains("Page 1: About you")
                .contains("name")
                .contains("(required)")
                .contains("Page 2: Where you live")
                .contains("Required data: [\"name\",\"country\"]");
    }

    @Test(description = "Unknown and malformed wizard ids are input errors")
    public void testInfoUnknownWizard() {
        assertThat(run("-w", wizardsDir, "info", "nope")).isEqualTo(WizardRunnerCLI.EXIT_INPUT);
        assertThat(err.toString()).contains("nope");

        assertThat(run("-w", wizardsDir, "info", "../secrets")).isEqualTo(WizardRunnerCLI.EXIT_INPUT);
    }

    // ── validate ──────────────────────────────────────────────────────────

    @Test
    public void testValidateValidData() {
        int exit = run("-w", wizardsDir, "validate", "two-page", "--data", data("two-page-valid.json"));

        assertThat(exit).isEqualTo(WizardRunnerCLI.EXIT_OK);
        assertThat(out.toString()).contains("Data is valid.");
    }

    @Test
    public void testValidateMissingField() {
        int exit = run("-w", wizardsDir, "validate", "two-page", "-d", data("two-page-missing-name.json"));

        assertThat(exit).isEqualTo(WizardRunnerCLI.EXIT_FAILED);
        assertThat(out.toString())
                .contains("Data is NOT valid.")
                .contains("missing  name")
                .contains("Applicant's full name");
    }

    @Test
    public void testValidateMissingDataFile() {
        int exit = run("-w", wizardsDir, "validate", "two-page", "-d", "does-not-exist.json");

        assertThat(exit).isEqualTo(WizardRunnerCLI.EXIT_INPUT);
        assertThat(err.toString()).contains("Data file not found");
    }

    // ── execute ───────────────────────────────────────────────────────────

    @Test(description = "Rejected data prints the failed result and never starts a browser")
    public void testExecuteRejectedData() throws IOException {
        int exit = run("-w", wizardsDir, "execute", "two-page", "-d", data("two-page-missing-name.json"));

        assertThat(exit).isEqualTo(WizardRunnerCLI.EXIT_FAILED);
        JsonNode json = WizardIO.getMapper().readTree(out.toString());
        assertThat(json.path("success").asBoolean()).isFalse();
        assertThat(json.path("error_type").asText()).isEqualTo("SCHEMA_VALIDATION");
        assertThat(err.toString()).contains("missing  name");
        verify(driverFactory, never()).create(any());
    }

    @Test(description = "Command-line options override the configured browser, headless flag and mode")
    public void testExecuteAppliesOverrides() throws IOException {
        int exit = run("-w", wizardsDir, "execute", "two-page", "-d", data("two-page-valid.json"),
                "--browser", "firefox", "--headless", "--mode", "debug");

        assertThat(exit).as(err.toString()).isEqualTo(WizardRunnerCLI.EXIT_OK);
        RunnerConfig used = runnerConfigs.get(0);
        assertThat(used.getBrowser()).isEqualTo("firefox");
        assertThat(used.isHeadless()).isTrue();
        assertThat(used.getMode()).isEqualTo(ExecutionMode.DEBUG);

        JsonNode json = WizardIO.getMapper().readTree(out.toString());
        assertThat(json.path("success").asBoolean()).isTrue();
        assertThat(json.path("pages_completed").asInt()).isEqualTo(2);
        assertThat(json.path("screenshots")).hasSize(5);
        verify(driver).quit();
    }

    @Test
    public void testExecuteWritesOutputFile() throws IOException {
        Path target = Files.createTempDirectory("results").resolve("nested/two-page.json");

        int exit = run("-w", wizardsDir, "execute", "two-page", "-d", data("two-page-valid.json"),
                "-o", target.toString());

        assertThat(exit).as(err.toString()).isEqualTo(WizardRunnerCLI.EXIT_OK);
        assertThat(target).exists();
        assertThat(WizardIO.getMapper().readTree(target.toFile()).path("wizard_id").asText()).isEqualTo("two-page");
        assertThat(out.toString()).contains("Result written to");
    }
}
