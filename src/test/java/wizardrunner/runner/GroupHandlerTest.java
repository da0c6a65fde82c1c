package wizardrunner.runner;

import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Sleeper;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import wizardrunner.Fixtures;
import wizardrunner.model.WizardField;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link GroupHandler} using the "loans" group of the
 * loan-estimator fixture.
 */
public class GroupHandlerTest {

    private static final By ADD    = By.cssSelector("#add-loan");
    private static final By SAVE   = By.xpath("//*[normalize-space(text())='Save']");
    private static final By AMOUNT = By.cssSelector("#loan-amount");
    private static final By KIND   = By.cssSelector("#loan-kind");

    @Mock WebDriver driver;
    @Mock WaitStrategy wait;
    @Mock Sleeper sleeper;
    @Mock WebElement addButton;
    @Mock WebElement saveButton;
    @Mock WebElement amountInput;
    @Mock WebElement kindSelect;
    @Mock Dropdown dropdown;

    private AutoCloseable mocks;
    private FieldContext ctx;
    private WizardField loans;
    private GroupHandler handler;

    @BeforeMethod
    public void setUp() throws IOException {
        mocks = MockitoAnnotations.openMocks(this);
        when(wait.waitForClickable(ADD)).thenReturn(addButton);
        when(wait.waitForClickable(SAVE)).thenReturn(saveButton);
        when(wait.waitForVisible(AMOUNT)).thenReturn(amountInput);
        when(driver.findElement(KIND)).thenReturn(kindSelect);
        Contexts.runAttemptsOnce(wait, driver);
        ctx = Contexts.of(driver, wait, sleeper, el -> dropdown);

        loans = Fixtures.structure(Fixtures.LOAN_ESTIMATOR).getPages().get(1).getFields().get(0);
        handler = new GroupHandler();
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test(description = "An empty item list touches neither the add control nor any sub-field")
    public void testEmptyListIsSkipped() {
        FieldReport report = handler.handle(ctx, loans, List.of());

        assertThat(report.getOutcome()).isEqualTo(FieldReport.Outcome.SKIPPED);
        assertThat(report.getItemsAdded()).isZero();
        verifyNoInteractions(wait, driver, dropdown);
    }

    @Test(description = "Each item runs add, fill sub-fields, save in that order")
    public void testItemsAreAddedInOrder() {
        List<Map<String, Object>> items = List.of(
                Map.of("amount", 12000, "kind", "Federal"),
                Map.of("amount", 3500.0));

        FieldReport report = handler.handle(ctx, loans, items);

        assertThat(report.getItemsAdded()).isEqualTo(2);
        assertThat(report.getOutcome()).isEqualTo(FieldReport.Outcome.FILLED);

        InOrder order = inOrder(addButton, amountInput, dropdown, saveButton);
        order.verify(addButton).click();
        order.verify(amountInput).sendKeys("12000");
        order.verify(dropdown).selectByValue("Federal");
        order.verify(saveButton).click();
        order.verify(addButton).click();
        order.verify(amountInput).sendKeys("3500");
        order.verify(saveButton).click();
        verify(dropdown, times(1)).selectByValue(any());
    }

    @Test
    public void testTooManyItemsRejectedBeforeAnyClick() {
        Map<String, Object> item = Map.of("amount", 1);

        assertThatThrownBy(() -> handler.handle(ctx, loans, List.of(item, item, item, item)))
                .isInstanceOf(FieldFillException.class)
                .hasMessageContaining("at most 3");
        verify(addButton, never()).click();
    }

    @Test
    public void testTooFewItemsRejected() {
        loans.setMinItems(2);

        assertThatThrownBy(() -> handler.handle(ctx, loans, List.of(Map.of("amount", 1))))
                .isInstanceOf(FieldFillException.class)
                .hasMessageContaining("at least 2");
    }

    @Test(description = "A missing required sub-field fails with the item path")
    public void testMissingRequiredSubField() {
        Map<String, Object> second = new HashMap<>();
        second.put("kind", "Private");

        assertThatThrownBy(() -> handler.handle(ctx, loans, List.of(Map.of("amount", 5), second)))
                .isInstanceOf(FieldFillException.class)
                .satisfies(e -> assertThat(((FieldFillException) e).getFieldId()).isEqualTo("loans[1].amount"));
    }

    @Test
    public void testNonListValueRejected() {
        assertThatThrownBy(() -> handler.handle(ctx, loans, "three loans"))
                .isInstanceOf(FieldFillException.class)
                .hasMessageContaining("Expected a list of records");
    }

    @Test(description = "An unclickable save control surfaces as a field failure for that item")
    public void testSaveControlFailure() {
        when(wait.waitForClickable(SAVE)).thenThrow(new WizardRunnerException("Timed out waiting for Save"));

        assertThatThrownBy(() -> handler.handle(ctx, loans, List.of(Map.of("amount", 5))))
                .isInstanceOf(FieldFillException.class)
                .hasMessageContaining("loans[0]")
                .hasMessageContaining("could not click save control");
    }
}
