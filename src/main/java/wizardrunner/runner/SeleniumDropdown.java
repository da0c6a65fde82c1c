package wizardrunner.runner;

import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Select;

/**
 * {@link Dropdown} over a native {@code <select>} element.
 *
 * @throws org.openqa.selenium.support.ui.UnexpectedTagNameException if the element is not a select
 */
class SeleniumDropdown implements Dropdown {

    private final Select select;

    SeleniumDropdown(WebElement element) {
        this.select = new Select(element);
    }

    @Override
    public void selectByValue(String value) {
        select.selectByValue(value);
    }

    @Override
    public void selectByLabel(String label) {
        select.selectByVisibleText(label);
    }
}
