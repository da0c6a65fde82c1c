package wizardrunner.runner;

import org.openqa.selenium.WebElement;

/**
 * Wraps a located element as a {@link Dropdown}.
 */
@FunctionalInterface
public interface DropdownFactory {

    DropdownFactory SELENIUM = SeleniumDropdown::new;

    Dropdown open(WebElement element);
}
