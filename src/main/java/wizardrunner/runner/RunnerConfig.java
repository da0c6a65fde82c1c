package wizardrunner.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed runner
 * configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 *
 * <p>Every timeout the runner uses comes from here, through
 * {@link #timeoutBudget()}; no component falls back to a library default.
 */
public class RunnerConfig {

    private static final Logger log = LoggerFactory.getLogger(RunnerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_BROWSER              = "runner.browser";
    static final String KEY_HEADLESS             = "runner.headless";
    static final String KEY_MODE                 = "runner.mode";
    static final String KEY_VIEWPORT_WIDTH       = "runner.viewport.width";
    static final String KEY_VIEWPORT_HEIGHT      = "runner.viewport.height";
    static final String KEY_SELECT_TIMEOUT       = "runner.select.strategy.timeout.ms";
    static final String KEY_OPERATION_TIMEOUT    = "runner.operation.timeout.ms";
    static final String KEY_NAVIGATION_TIMEOUT   = "runner.navigation.timeout.ms";
    static final String KEY_COMMAND_TIMEOUT      = "runner.browser.command.timeout.ms";
    static final String KEY_NAVIGATION_RETRIES   = "runner.navigation.max.retries";
    static final String KEY_NAVIGATION_DELAY     = "runner.navigation.retry.delay.ms";
    static final String KEY_EXECUTION_TIMEOUT    = "runner.execution.timeout.sec";
    static final String KEY_HOST_TIMEOUT         = "runner.host.request.timeout.sec";
    static final String KEY_FIELD_SETTLE         = "runner.field.settle.ms";
    static final String KEY_TYPEAHEAD_SETTLE     = "runner.typeahead.settle.ms";
    static final String KEY_GROUP_ITEM_SETTLE    = "runner.group.item.settle.ms";
    static final String KEY_PAGE_SETTLE          = "runner.page.settle.ms";
    static final String KEY_JPEG_QUALITY         = "runner.screenshot.jpeg.quality";
    static final String KEY_SCREENSHOT_SAVE_DIR  = "runner.screenshot.save.dir";
    static final String KEY_RESULTS_MAX_CHARS    = "runner.results.max.text.chars";
    static final String KEY_WIZARDS_DIR          = "runner.wizards.dir";

    // Defaults
    private static final String  DEFAULT_BROWSER             = "chrome";
    private static final boolean DEFAULT_HEADLESS            = false;
    private static final int     DEFAULT_VIEWPORT_WIDTH      = 1280;
    private static final int     DEFAULT_VIEWPORT_HEIGHT     = 1024;
    private static final long    DEFAULT_SELECT_TIMEOUT      = 5_000L;
    private static final long    DEFAULT_OPERATION_TIMEOUT   = 10_000L;
    private static final long    DEFAULT_NAVIGATION_TIMEOUT  = 20_000L;
    private static final long    DEFAULT_COMMAND_TIMEOUT     = 30_000L;
    private static final int     DEFAULT_NAVIGATION_RETRIES  = 4;
    private static final long    DEFAULT_NAVIGATION_DELAY    = 2_000L;
    private static final long    DEFAULT_EXECUTION_TIMEOUT   = 180L;
    private static final long    DEFAULT_HOST_TIMEOUT        = 300L;
    private static final long    DEFAULT_FIELD_SETTLE        = 300L;
    private static final long    DEFAULT_TYPEAHEAD_SETTLE    = 500L;
    private static final long    DEFAULT_GROUP_ITEM_SETTLE   = 500L;
    private static final long    DEFAULT_PAGE_SETTLE         = 1_500L;
    private static final int     DEFAULT_JPEG_QUALITY        = 80;
    private static final int     DEFAULT_RESULTS_MAX_CHARS   = 2_000;
    private static final String  DEFAULT_WIZARDS_DIR         = "wizards";

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws RuntimeException if the base config.properties cannot be loaded
     */
    public RunnerConfig() {
        props = new Properties();

        // Load base config; required
        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new RuntimeException("Cannot load " + CONFIG_FILE, e);
        }

        // Load local overrides; optional, no error if missing
        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}; using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Accepts an already-populated {@link Properties} instance; unset keys
     * take their defaults. Used by tests and by the CLI.
     */
    public RunnerConfig(Properties props) {
        this.props = props;
    }

    /** Returns a copy of this configuration with the given keys replaced. */
    public RunnerConfig withOverrides(Map<String, String> overrides) {
        Properties copy = new Properties();
        copy.putAll(props);
        overrides.forEach((k, v) -> {
            if (v != null) copy.setProperty(k, v);
        });
        return new RunnerConfig(copy);
    }

    // ── Browser ────────────────────────────────────────────────────────────

    /** Browser engine: chrome, firefox or edge (default: chrome). */
    public String getBrowser() {
        return props.getProperty(KEY_BROWSER, DEFAULT_BROWSER).trim().toLowerCase();
    }

    /** Whether the browser runs headless (default: false). */
    public boolean isHeadless() {
        return getBool(KEY_HEADLESS, DEFAULT_HEADLESS);
    }

    /**
     * Execution mode. When {@code runner.mode} is unset or unrecognised,
     * headless runs are PRODUCTION and visible runs are DEBUG.
     */
    public ExecutionMode getMode() {
        String raw = props.getProperty(KEY_MODE);
        if (raw != null && !raw.isBlank()) {
            try {
                return ExecutionMode.valueOf(raw.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                log.warn("Invalid mode '{}' for key '{}'; deriving from headless flag", raw, KEY_MODE);
            }
        }
        return isHeadless() ? ExecutionMode.PRODUCTION : ExecutionMode.DEBUG;
    }

    public int getViewportWidth()  { return getInt(KEY_VIEWPORT_WIDTH, DEFAULT_VIEWPORT_WIDTH); }
    public int getViewportHeight() { return getInt(KEY_VIEWPORT_HEIGHT, DEFAULT_VIEWPORT_HEIGHT); }

    // ── Timeouts ───────────────────────────────────────────────────────────

    /**
     * All nested timeout bounds, checked for ordering.
     *
     * @throws IllegalStateException if an outer bound does not exceed the inner one
     */
    public TimeoutBudget timeoutBudget() {
        TimeoutBudget budget = new TimeoutBudget(
                Duration.ofMillis(getLong(KEY_SELECT_TIMEOUT, DEFAULT_SELECT_TIMEOUT)),
                Duration.ofMillis(getLong(KEY_OPERATION_TIMEOUT, DEFAULT_OPERATION_TIMEOUT)),
                Duration.ofMillis(getLong(KEY_NAVIGATION_TIMEOUT, DEFAULT_NAVIGATION_TIMEOUT)),
                Duration.ofMillis(getLong(KEY_COMMAND_TIMEOUT, DEFAULT_COMMAND_TIMEOUT)),
                Duration.ofSeconds(getLong(KEY_EXECUTION_TIMEOUT, DEFAULT_EXECUTION_TIMEOUT)),
                Duration.ofSeconds(getLong(KEY_HOST_TIMEOUT, DEFAULT_HOST_TIMEOUT)));
        budget.verify();
        return budget;
    }

    /** Navigation attempts, delay and per-attempt bound. */
    public NavigationRetryPolicy navigationRetryPolicy() {
        return new NavigationRetryPolicy(
                Math.max(0, getInt(KEY_NAVIGATION_RETRIES, DEFAULT_NAVIGATION_RETRIES)),
                Duration.ofMillis(Math.max(0L, getLong(KEY_NAVIGATION_DELAY, DEFAULT_NAVIGATION_DELAY))),
                Duration.ofMillis(getLong(KEY_NAVIGATION_TIMEOUT, DEFAULT_NAVIGATION_TIMEOUT)));
    }

    // ── Pacing ─────────────────────────────────────────────────────────────

    /** Pause after each filled field (default: 300 ms). */
    public Duration getFieldSettle()     { return millis(KEY_FIELD_SETTLE, DEFAULT_FIELD_SETTLE); }

    /** Pause after the ENTER of a fill_enter field (default: 500 ms). */
    public Duration getTypeaheadSettle() { return millis(KEY_TYPEAHEAD_SETTLE, DEFAULT_TYPEAHEAD_SETTLE); }

    /** Pause after each group add and save click (default: 500 ms). */
    public Duration getGroupItemSettle() { return millis(KEY_GROUP_ITEM_SETTLE, DEFAULT_GROUP_ITEM_SETTLE); }

    /** Pause after a start action or continue click (default: 1500 ms). */
    public Duration getPageSettle()      { return millis(KEY_PAGE_SETTLE, DEFAULT_PAGE_SETTLE); }

    // ── Screenshots and results ────────────────────────────────────────────

    /** JPEG quality 1..100 for captured screenshots (default: 80). */
    public int getJpegQuality() {
        int q = getInt(KEY_JPEG_QUALITY, DEFAULT_JPEG_QUALITY);
        return Math.max(1, Math.min(100, q));
    }

    /** Directory screenshots are also written to, or {@code null} to keep them in memory only. */
    public String getScreenshotSaveDir() {
        String raw = props.getProperty(KEY_SCREENSHOT_SAVE_DIR);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    /** Maximum characters of page text kept in a whole-page result (default: 2000). */
    public int getResultsMaxTextChars() {
        return Math.max(0, getInt(KEY_RESULTS_MAX_CHARS, DEFAULT_RESULTS_MAX_CHARS));
    }

    /** Root of the wizard catalog (default: "wizards"). */
    public String getWizardsDir() {
        return props.getProperty(KEY_WIZARDS_DIR, DEFAULT_WIZARDS_DIR).trim();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Duration millis(String key, long defaultValue) {
        return Duration.ofMillis(Math.max(0L, getLong(key, defaultValue)));
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
