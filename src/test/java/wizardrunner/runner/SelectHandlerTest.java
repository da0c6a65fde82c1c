package wizardrunner.runner;

import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Sleeper;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import wizardrunner.model.ElementSelector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SelectHandler}.
 *
 * <p>Each strategy runs once through a mocked {@link WaitStrategy}; the
 * dropdown itself is a mock so option matching is fully scripted.
 */
public class SelectHandlerTest {

    private static final ElementSelector COUNTRY = ElementSelector.css("#country");

    @Mock WebDriver driver;
    @Mock WaitStrategy wait;
    @Mock Sleeper sleeper;
    @Mock WebElement selectElement;
    @Mock Dropdown dropdown;

    private AutoCloseable mocks;
    private FieldContext ctx;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(driver.findElement(By.cssSelector("#country"))).thenReturn(selectElement);
        Contexts.runAttemptsOnce(wait, driver);
        ctx = Contexts.of(driver, wait, sleeper, el -> dropdown);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test(description = "An option whose value matches is selected by the first strategy")
    public void testValueStrategyWins() {
        FieldReport report = new SelectHandler().handle(ctx, "country", COUNTRY, "USA");

        assertThat(report.getSelectStrategy()).isEqualTo(SelectStrategy.VALUE);
        assertThat(report.getOutcome()).isEqualTo(FieldReport.Outcome.FILLED);
        verify(dropdown).selectByValue("USA");
        verify(dropdown, never()).selectByLabel(anyString());
    }

    @Test(description = "A plain apostrophe matches a label spelled with a typographic one")
    public void testNormalizedLabelStrategy() {
        doThrow(new NoSuchElementException("no value")).when(dropdown).selectByValue(anyString());
        doThrow(new NoSuchElementException("no label")).when(dropdown).selectByLabel("Parent's PLUS");

        FieldReport report = new SelectHandler().handle(ctx, "kind", COUNTRY, "Parent's PLUS");

        assertThat(report.getSelectStrategy()).isEqualTo(SelectStrategy.LABEL_NORMALIZED);
        InOrder order = inOrder(dropdown);
        order.verify(dropdown).selectByValue("Parent's PLUS");
        order.verify(dropdown).selectByValue("Parent’s PLUS");
        order.verify(dropdown).selectByLabel("Parent's PLUS");
        order.verify(dropdown).selectByLabel("Parent’s PLUS");
    }

    @Test(description = "Exhaustion names every strategy actually tried; normalized ones are skipped when they change nothing")
    public void testExhaustionListsAttemptedStrategies() {
        doThrow(new NoSuchElementException("none")).when(dropdown).selectByValue(anyString());
        doThrow(new NoSuchElementException("none")).when(dropdown).selectByLabel(anyString());

        assertThatThrownBy(() -> new SelectHandler().handle(ctx, "country", COUNTRY, "Mexico"))
                .isInstanceOf(FieldFillException.class)
                .hasMessageContaining("Field 'country'")
                .hasMessageContaining("no enabled dropdown option matched 'Mexico'")
                .satisfies(e -> assertThat(((FieldFillException) e).getAttemptedStrategies())
                        .containsExactly("value", "label"));
        verify(wait, times(2)).attemptWithin(eq(Contexts.SELECT_TIMEOUT), any());
    }

    @Test(description = "A driver error in one strategy does not stop the next one")
    public void testDriverErrorMovesToNextStrategy() {
        doThrow(new WebDriverException("element not interactable")).when(dropdown).selectByValue("Canada");

        FieldReport report = new SelectHandler().handle(ctx, "country", COUNTRY, "Canada");

        assertThat(report.getSelectStrategy()).isEqualTo(SelectStrategy.LABEL);
    }

    @Test
    public void testNumericValueRenderedWithoutDecimal() {
        new SelectHandler().handle(ctx, "size", COUNTRY, 3.0);

        verify(dropdown).selectByValue("3");
    }

    @Test(description = "Group sub-fields only match on option values")
    public void testValueStrategiesOnly() {
        assertThat(SelectHandler.valueStrategies().getStrategies())
                .containsExactly(SelectStrategy.VALUE, SelectStrategy.VALUE_NORMALIZED);

        doThrow(new NoSuchElementException("none")).when(dropdown).selectByValue(anyString());

        assertThatThrownBy(() -> SelectHandler.valueStrategies().handle(ctx, "loans[0].kind", COUNTRY, "Federal"))
                .isInstanceOf(FieldFillException.class);
        verify(dropdown, never()).selectByLabel(anyString());
    }
}
