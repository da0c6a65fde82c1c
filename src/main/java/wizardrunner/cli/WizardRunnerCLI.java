package wizardrunner.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import wizardrunner.model.UserData;
import wizardrunner.model.WizardCatalog;
import wizardrunner.model.WizardField;
import wizardrunner.model.WizardIO;
import wizardrunner.model.WizardNotFoundException;
import wizardrunner.model.WizardPage;
import wizardrunner.model.WizardStructure;
import wizardrunner.model.WizardStructureException;
import wizardrunner.runner.ExecutionResult;
import wizardrunner.runner.RunnerConfig;
import wizardrunner.runner.WizardRunner;
import wizardrunner.validation.InvalidField;
import wizardrunner.validation.MissingField;
import wizardrunner.validation.SchemaValidator;
import wizardrunner.validation.ValidationResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line entry point for the wizard runner.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code wizard-runner list}                        lists the wizards in the catalog</li>
 *   <li>{@code wizard-runner info <id>}                   shows a wizard's pages and fields</li>
 *   <li>{@code wizard-runner validate <id> --data f}      checks user data against the wizard's schema</li>
 *   <li>{@code wizard-runner execute <id> --data f}       runs the wizard in a browser</li>
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 bad input (unknown wizard, unreadable file),
 * 2 rejected data or failed execution.
 */
@Command(
        name        = "wizard-runner",
        description = "Drives multi-page web wizards from a declarative structure and validated user data",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                WizardRunnerCLI.ListCommand.class,
                WizardRunnerCLI.InfoCommand.class,
                WizardRunnerCLI.ValidateCommand.class,
                WizardRunnerCLI.ExecuteCommand.class
        }
)
public class WizardRunnerCLI implements Callable<Integer> {

    static final int EXIT_OK     = 0;
    static final int EXIT_INPUT  = 1;
    static final int EXIT_FAILED = 2;

    @Spec
    CommandSpec spec;

    @Option(
            names       = {"-w", "--wizards-dir"},
            description = "Wizard catalog root (default: runner.wizards.dir from config.properties)"
    )
    Path wizardsDir;

    private RunnerConfig config;
    private final Function<RunnerConfig, WizardRunner> runnerFactory;

    public WizardRunnerCLI() {
        this(null, WizardRunner::new);
    }

    /** For tests: a fixed configuration and a runner built around mocks. */
    WizardRunnerCLI(RunnerConfig config, Function<RunnerConfig, WizardRunner> runnerFactory) {
        this.config = config;
        this.runnerFactory = runnerFactory;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new WizardRunnerCLI()).execute(args);
        System.exit(exit);
    }

    // ── Shared helpers ──────────────────────────────────────────────────────

    RunnerConfig config() {
        if (config == null) {
            config = new RunnerConfig();
        }
        return config;
    }

    WizardCatalog catalog() {
        Path root = wizardsDir != null ? wizardsDir : Path.of(config().getWizardsDir());
        return new WizardCatalog(root);
    }

    PrintWriter out() { return spec.commandLine().getOut(); }
    PrintWriter err() { return spec.commandLine().getErr(); }

    static void printValidation(PrintWriter out, ValidationResult validation) {
        if (validation.isValid()) {
            out.println("Data is valid.");
            return;
        }
        out.println("Data is NOT valid.");
        for (MissingField m : validation.getMissingFields()) {
            out.printf("  missing  %-24s %s%n", m.getFieldId(),
                    m.getDescription() != null ? m.getDescription() : "");
        }
        for (InvalidField f : validation.getInvalidFields()) {
            out.printf("  invalid  %-24s got %s, expected %s%n", f.getPath(),
                    f.getProvidedValue(), f.getExpected());
        }
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Lists every wizard in the catalog.
     */
    @Command(
            name        = "list",
            description = "List the wizards in the catalog",
            mixinStandardHelpOptions = true
    )
    static class ListCommand implements Callable<Integer> {

        @ParentCommand
        WizardRunnerCLI parent;

        @Override
        public Integer call() {
            WizardCatalog catalog = parent.catalog();
            List<WizardCatalog.WizardSummary> wizards = catalog.list();
            PrintWriter out = parent.out();
            if (wizards.isEmpty()) {
                out.println("No wizards found under " + catalog.getRoot().toAbsolutePath());
                return EXIT_OK;
            }
            out.printf("%-28s %-6s %-7s %s%n", "WIZARD", "PAGES", "SCHEMA", "NAME");
            for (WizardCatalog.WizardSummary w : wizards) {
                out.printf("%-28s %-6d %-7s %s%n", w.wizardId(), w.pageCount(),
                        w.hasSchema() ? "yes" : "no", w.name() != null ? w.name() : "");
            }
            return EXIT_OK;
        }
    }

    /**
     * Shows the pages and fields of one wizard.
     */
    @Command(
            name        = "info",
            description = "Show the pages and fields of a wizard",
            mixinStandardHelpOptions = true
    )
    static class InfoCommand implements Callable<Integer> {

        @ParentCommand
        WizardRunnerCLI parent;

        @Parameters(index = "0", description = "Wizard id")
        String wizardId;

        @Override
        public Integer call() throws IOException {
            WizardStructure wizard;
            try {
                wizard = parent.catalog().loadStructure(wizardId);
            } catch (WizardNotFoundException | WizardStructureException | IllegalArgumentException e) {
                parent.err().println(e.getMessage());
                return EXIT_INPUT;
            }
            PrintWriter out = parent.out();
            out.printf("Wizard : %s%n", wizard.getWizardId());
            if (wizard.getName() != null) out.printf("Name   : %s%n", wizard.getName());
            out.printf("URL    : %s%n", wizard.getUrl());
            if (wizard.getStartAction() != null) out.printf("Start  : %s%n", wizard.getStartAction());
            for (WizardPage page : wizard.getPages()) {
                out.printf("%nPage %d%s%n", page.getPageNumber(),
                        page.getPageTitle() != null ? ": " + page.getPageTitle() : "");
                for (WizardField field : page.getFields()) {
                    out.printf("  %-28s %-17s %s%s%n", field.getFieldId(), field.getInteraction(),
                            field.isGroup() ? "add " + field.getAddSelector() : field.toElementSelector(),
                            field.isRequired() ? " (required)" : "");
                }
                out.printf("  -> continue %s%n", page.getContinueButton());
            }
            try {
                JsonNode schema = parent.catalog().loadSchema(wizardId);
                out.printf("%nRequired data: %s%n", schema.path("required"));
            } catch (WizardNotFoundException e) {
                out.printf("%nNo data schema found%n");
            }
            return EXIT_OK;
        }
    }

    /**
     * Validates a user data file against a wizard's data schema.
     */
    @Command(
            name        = "validate",
            description = "Check user data against a wizard's data schema",
            mixinStandardHelpOptions = true
    )
    static class ValidateCommand implements Callable<Integer> {

        @ParentCommand
        WizardRunnerCLI parent;

        @Parameters(index = "0", description = "Wizard id")
        String wizardId;

        @Option(names = {"-d", "--data"}, required = true, description = "Path to the user data JSON file")
        Path dataFile;

        @Override
        public Integer call() throws IOException {
            JsonNode schema;
            UserData data;
            try {
                schema = parent.catalog().loadSchema(wizardId);
                data = readData(parent, dataFile);
            } catch (WizardNotFoundException | IllegalArgumentException e) {
                parent.err().println(e.getMessage());
                return EXIT_INPUT;
            }
            if (data == null) return EXIT_INPUT;

            ValidationResult validation = new SchemaValidator().validate(schema, data);
            printValidation(parent.out(), validation);
            return validation.isValid() ? EXIT_OK : EXIT_FAILED;
        }
    }

    /**
     * Runs a wizard end-to-end and reports the execution result as JSON.
     */
    @Command(
            name        = "execute",
            description = "Run a wizard in a browser with the given user data",
            mixinStandardHelpOptions = true
    )
    static class ExecuteCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ExecuteCommand.class);

        @ParentCommand
        WizardRunnerCLI parent;

        @Parameters(index = "0", description = "Wizard id")
        String wizardId;

        @Option(names = {"-d", "--data"}, required = true, description = "Path to the user data JSON file")
        Path dataFile;

        @Option(names = {"-b", "--browser"}, description = "Browser to use: chrome, firefox, edge")
        String browser;

        @Option(names = {"--headless"}, description = "Run the browser headless", negatable = true)
        Boolean headless;

        @Option(names = {"-m", "--mode"}, description = "Screenshot retention: debug or production")
        String mode;

        @Option(names = {"-o", "--output"}, description = "Write the result JSON here instead of stdout")
        Path output;

        @Override
        public Integer call() throws IOException {
            WizardCatalog catalog = parent.catalog();
            WizardStructure wizard;
            JsonNode schema;
            UserData data;
            try {
                wizard = catalog.loadStructure(wizardId);
                schema = catalog.loadSchema(wizardId);
                data = readData(parent, dataFile);
            } catch (WizardNotFoundException | WizardStructureException | IllegalArgumentException e) {
                parent.err().println(e.getMessage());
                return EXIT_INPUT;
            }
            if (data == null) return EXIT_INPUT;

            Map<String, String> overrides = new HashMap<>();
            if (browser != null)  overrides.put("runner.browser", browser);
            if (headless != null) overrides.put("runner.headless", headless.toString());
            if (mode != null)     overrides.put("runner.mode", mode);
            RunnerConfig effective = parent.config().withOverrides(overrides);

            ExecutionResult result = parent.runnerFactory.apply(effective).execute(wizard, schema, data);
            String json = WizardIO.getMapper().writeValueAsString(result);

            PrintWriter out = parent.out();
            if (output != null) {
                if (output.toAbsolutePath().getParent() != null) {
                    Files.createDirectories(output.toAbsolutePath().getParent());
                }
                Files.writeString(output, json);
                log.info("Result written to {}", output.toAbsolutePath());
                out.println(result);
                out.println("Result written to " + output.toAbsolutePath());
            } else {
                out.println(json);
            }
            if (!result.isSuccess() && result.getValidation() != null) {
                printValidation(parent.err(), result.getValidation());
            }
            return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
        }
    }

    /** Reads user data, reporting a missing or malformed file on stderr and returning {@code null}. */
    static UserData readData(WizardRunnerCLI parent, Path dataFile) {
        if (!Files.exists(dataFile)) {
            parent.err().println("Data file not found: " + dataFile.toAbsolutePath());
            return null;
        }
        try {
            return WizardIO.readUserData(dataFile);
        } catch (IOException e) {
            parent.err().println("Cannot read data file " + dataFile + ": " + e.getMessage());
            return null;
        }
    }
}
