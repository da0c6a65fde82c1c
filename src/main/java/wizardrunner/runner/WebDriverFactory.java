package wizardrunner.runner;

import org.openqa.selenium.WebDriver;

/**
 * Creates one fresh browser session per execution.
 */
@FunctionalInterface
public interface WebDriverFactory {

    /**
     * @param config browser kind, headless flag and viewport
     * @throws WizardRunnerException if the browser cannot be started
     */
    WebDriver create(RunnerConfig config);
}
