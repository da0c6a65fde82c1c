package wizardrunner.runner;

/**
 * A single-value dropdown. Both operations throw
 * {@link org.openqa.selenium.NoSuchElementException} when no option matches.
 */
public interface Dropdown {

    void selectByValue(String value);

    void selectByLabel(String label);
}
