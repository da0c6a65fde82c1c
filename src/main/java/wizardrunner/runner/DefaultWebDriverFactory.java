package wizardrunner.runner;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeDriverService;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeDriverService;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.openqa.selenium.firefox.GeckoDriverService;
import org.openqa.selenium.remote.http.ClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local browser sessions. Selenium Manager (built into Selenium 4.11+)
 * downloads the matching driver binary, so no manual chromedriver or
 * geckodriver setup is needed.
 *
 * <p>Each driver talks to its service through a {@link ClientConfig} whose
 * read timeout is the configured browser-command bound, so a hung command
 * fails instead of waiting out Selenium's built-in default.
 */
public class DefaultWebDriverFactory implements WebDriverFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultWebDriverFactory.class);

    @Override
    public WebDriver create(RunnerConfig config) {
        String browser = config.getBrowser();
        int width = config.getViewportWidth();
        int height = config.getViewportHeight();
        ClientConfig client = clientConfig(config.timeoutBudget());
        log.info("Starting {} (headless={}, viewport={}x{}, command timeout={}ms)", browser, config.isHeadless(),
                width, height, client.readTimeout().toMillis());
        try {
            return switch (browser) {
                case "firefox" -> {
                    FirefoxOptions opts = new FirefoxOptions();
                    if (config.isHeadless()) opts.addArguments("-headless");
                    opts.addArguments("--width=" + width, "--height=" + height);
                    yield new FirefoxDriver(GeckoDriverService.createDefaultService(), opts, client);
                }
                case "edge" -> {
                    EdgeOptions opts = new EdgeOptions();
                    if (config.isHeadless()) opts.addArguments("--headless=new");
                    opts.addArguments("--window-size=" + width + "," + height);
                    yield new EdgeDriver(EdgeDriverService.createDefaultService(), opts, client);
                }
                default -> {
                    if (!"chrome".equals(browser)) {
                        log.warn("Unknown browser '{}'; falling back to chrome", browser);
                    }
                    ChromeOptions opts = new ChromeOptions();
                    if (config.isHeadless()) opts.addArguments("--headless=new");
                    opts.addArguments("--window-size=" + width + "," + height);
                    yield new ChromeDriver(ChromeDriverService.createDefaultService(), opts, client);
                }
            };
        } catch (WebDriverException e) {
            throw new WizardRunnerException("Could not start " + browser + ": "
                    + NavigationException.firstLine(e.getMessage()), e);
        }
    }

    static ClientConfig clientConfig(TimeoutBudget budget) {
        return ClientConfig.defaultConfig().readTimeout(budget.browserCommand());
    }
}
