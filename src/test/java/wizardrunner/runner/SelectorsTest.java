package wizardrunner.runner;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import wizardrunner.model.ElementSelector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link Selectors}.
 */
public class SelectorsTest {

    @Mock WaitStrategy wait;
    @Mock WebElement element;

    private AutoCloseable mocks;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    // ── toBy ──────────────────────────────────────────────────────────────

    @Test(description = "ID selectors resolve to #id CSS with or without the leading hash")
    public void testIdSelector() {
        assertThat(Selectors.toBy(ElementSelector.id("name"))).isEqualTo(By.cssSelector("#name"));
        assertThat(Selectors.toBy(ElementSelector.id("#name"))).isEqualTo(By.cssSelector("#name"));
    }

    @Test
    public void testCssSelector() {
        assertThat(Selectors.toBy(ElementSelector.css("form button.primary")))
                .isEqualTo(By.cssSelector("form button.primary"));
    }

    @Test(description = "Text selectors match the element's own normalised text")
    public void testTextSelector() {
        assertThat(Selectors.toBy(ElementSelector.text(" Start Estimate ")))
                .isEqualTo(By.xpath("//*[normalize-space(text())='Start Estimate']"));
    }

    // ── xpathLiteral ──────────────────────────────────────────────────────

    @Test
    public void testXpathLiteralQuoting() {
        assertThat(Selectors.xpathLiteral("Next")).isEqualTo("'Next'");
        assertThat(Selectors.xpathLiteral("Don't stop")).isEqualTo("\"Don't stop\"");
        assertThat(Selectors.xpathLiteral("Say \"don't\""))
                .isEqualTo("concat('Say \"don', \"'\", 't\"')");
    }

    // ── resolve ───────────────────────────────────────────────────────────

    @Test
    public void testResolveClickableWaitsOnConvertedLocator() {
        when(wait.waitForClickable(By.cssSelector("#next"))).thenReturn(element);

        assertThat(Selectors.resolveClickable(ElementSelector.id("next"), wait)).isSameAs(element);
        verify(wait).waitForClickable(By.cssSelector("#next"));
    }
}
