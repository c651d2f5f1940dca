package webqa.player;

import webqa.model.BlueprintElement;
import webqa.model.ParameterSet;
import webqa.model.Run;
import webqa.model.Step;
import webqa.model.StepAction;
import webqa.model.VisualStatus;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link StepExecutor} and its action handlers.
 *
 * <p>The driver and {@link WaitStrategy} are mocked; no real browser is needed.
 */
public class StepExecutorTest {

    /** Combined interface so Mockito can create a mock satisfying all Selenium needs. */
    private interface FullDriver extends WebDriver, JavascriptExecutor, TakesScreenshot {}

    @Mock FullDriver driver;
    @Mock WaitStrategy wait;
    @Mock VisualRegression visualRegression;
    @Mock WebElement usernameInput;
    @Mock WebElement passwordInput;
    @Mock WebElement loginButton;
    @Mock WebElement inventoryList;

    private AutoCloseable mocks;
    private StepExecutor executor;
    private Run run;
    private StepContext ctx;

    private static final List<BlueprintElement> BLUEPRINT = List.of(
            new BlueprintElement("Username_Input").withTag("input").withId("user-name").withPlaceholder("Username"),
            new BlueprintElement("Password_Input").withTag("input").withDataTest("password"),
            new BlueprintElement("Login_Button").withTag("input").withId("login-button"));

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        executor = new StepExecutor(new LocatorResolver(), visualRegression);
        run = new Run("run-1", "TC_LOGIN", "standard_user", false, "runs/TC_LOGIN/standard_user-x");
        ParameterSet dataset = new ParameterSet("standard_user",
                Map.of("username", "standard_user", "password", "secret_sauce"));
        ctx = new StepContext(driver, wait, BLUEPRINT, dataset, run);

        when(wait.waitForVisible(By.id("user-name"), "Username_Input")).thenReturn(usernameInput);
        when(wait.waitForVisible(By.cssSelector("[data-test=\"password\"]"), "Password_Input")).thenReturn(passwordInput);
        when(wait.waitForVisible(By.id("login-button"), "Login_Button")).thenReturn(loginButton);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    // ── ENTER_TEXT ────────────────────────────────────────────────────────

    @Test(description = "ENTER_TEXT clears the field and types the dataset value")
    public void enterText_typesDatasetValue() {
        StepOutcome outcome = executor.execute(
                new Step(1, StepAction.ENTER_TEXT, "Username_Input").withDataKey("username"), ctx);

        verify(usernameInput).clear();
        verify(usernameInput).sendKeys("standard_user");
        assertThat(outcome.visualStatus()).isEqualTo(VisualStatus.NOT_APPLICABLE);
    }

    @Test(description = "a data_key missing from the dataset types an empty string")
    public void enterText_missingKey_typesEmptyString() {
        executor.execute(new Step(2, StepAction.ENTER_TEXT, "Password_Input").withDataKey("pin"), ctx);

        verify(passwordInput).sendKeys("");
    }

    // ── CLICK ─────────────────────────────────────────────────────────────

    @Test
    public void click_withoutVerifications_clicksTarget() {
        executor.execute(new Step(3, StepAction.CLICK, "Login_Button"), ctx);

        verify(loginButton).click();
        verify(wait).waitForPageLoad();
    }

    @Test(description = "a slow page after a plain click is tolerated")
    public void click_pageLoadTimeoutWithoutVerifications_passes() {
        doThrow(new NavigationTimeoutException("slow", null)).when(wait).waitForPageLoad();

        StepOutcome outcome = executor.execute(new Step(3, StepAction.CLICK, "Login_Button"), ctx);

        assertThat(outcome.stepNumber()).isEqualTo(3);
    }

    @Test(description = "login click passes when the inventory list becomes visible")
    public void click_verificationVisible_passes() {
        when(wait.waitForVisible(By.cssSelector(".inventory_list"), "Inventory_List")).thenReturn(inventoryList);

        executor.execute(new Step(3, StepAction.CLICK, "Login_Button").verifying("Inventory_List"), ctx);

        verify(loginButton).click();
        verify(wait).waitForVisible(By.cssSelector(".inventory_list"), "Inventory_List");
    }

    @Test(description = "login click fails when the expected element never appears")
    public void click_verificationNotVisible_fails() {
        when(wait.waitForVisible(By.cssSelector(".inventory_list"), "Inventory_List"))
                .thenThrow(new ElementNotVisibleException("Element 'Inventory_List' not visible after 1s", null));

        assertThatThrownBy(() -> executor.execute(
                new Step(3, StepAction.CLICK, "Login_Button").verifying("Inventory_List"), ctx))
                .isInstanceOf(StepFailureException.class)
                .hasMessageContaining("Verification failed after clicking 'Login_Button'")
                .hasMessageContaining("Inventory_List");
    }

    // ── VERIFY_ELEMENT_VISIBLE ────────────────────────────────────────────

    @Test
    public void verifyVisible_passesForVisibleElement() {
        when(wait.waitForVisible(By.cssSelector(".title"), "Products_Title")).thenReturn(inventoryList);

        StepOutcome outcome = executor.execute(new Step(4, StepAction.VERIFY_ELEMENT_VISIBLE, "Products_Title"), ctx);

        assertThat(outcome.action()).isEqualTo(StepAction.VERIFY_ELEMENT_VISIBLE);
    }

    @Test
    public void verifyVisible_unknownElement_throwsLocatorNotFound() {
        assertThatThrownBy(() -> executor.execute(
                new Step(4, StepAction.VERIFY_ELEMENT_VISIBLE, "Checkout_Complete_Banner"), ctx))
                .isInstanceOf(LocatorNotFoundException.class);
        verify(wait, never()).waitForVisible(any(), eq("Checkout_Complete_Banner"));
    }

    // ── VISUAL_VALIDATION ─────────────────────────────────────────────────

    @Test
    public void visualValidation_baselineCreated_returnedInOutcome() {
        when(visualRegression.check(driver, run, "Inventory_Page")).thenReturn(
                new VisualRegression.VisualCheckResult(VisualStatus.BASELINE_CREATED, 0.0, 0.01, "k", null));

        StepOutcome outcome = executor.execute(new Step(5, StepAction.VISUAL_VALIDATION, "Inventory_Page"), ctx);

        assertThat(outcome.visualStatus()).isEqualTo(VisualStatus.BASELINE_CREATED);
        assertThat(run.getVisualStatus()).isEqualTo(VisualStatus.NOT_APPLICABLE);
    }

    @Test
    public void visualValidation_mismatch_throwsWithResult() {
        when(visualRegression.check(driver, run, "Inventory_Page")).thenReturn(
                new VisualRegression.VisualCheckResult(VisualStatus.FAIL, 0.25, 0.01, "k", "runs/x/visual_failure.png"));

        assertThatThrownBy(() -> executor.execute(new Step(5, StepAction.VISUAL_VALIDATION, "Inventory_Page"), ctx))
                .isInstanceOf(VisualMismatchException.class)
                .hasMessageContaining("Inventory_Page")
                .hasMessageContaining("25.00%")
                .satisfies(e -> assertThat(((VisualMismatchException) e).getResult().artifactKey())
                        .isEqualTo("runs/x/visual_failure.png"));
        assertThat(run.getVisualStatus()).isEqualTo(VisualStatus.NOT_APPLICABLE);
        assertThat(run.getArtifacts()).isEmpty();
    }

    // ── Dispatch ──────────────────────────────────────────────────────────

    @Test
    public void missingAction_fails() {
        assertThatThrownBy(() -> executor.execute(new Step(6, null, "Login_Button"), ctx))
                .isInstanceOf(StepFailureException.class)
                .hasMessageContaining("no action");
    }

    @Test
    public void blankTarget_fails() {
        assertThatThrownBy(() -> executor.execute(new Step(7, StepAction.CLICK, " "), ctx))
                .isInstanceOf(StepFailureException.class)
                .hasMessageContaining("target_element");
    }

    @Test
    public void customHandlerTable_isUsed() {
        ActionHandler handler = mock(ActionHandler.class);
        Step step = new Step(8, StepAction.CLICK, "Login_Button");
        StepExecutor custom = new StepExecutor(new LocatorResolver(), Map.of(StepAction.CLICK, handler));
        when(handler.handle(eq(step), eq(ctx), any())).thenReturn(StepOutcome.passed(step));

        assertThat(custom.execute(step, ctx).stepNumber()).isEqualTo(8);
        assertThatThrownBy(() -> custom.execute(new Step(9, StepAction.ENTER_TEXT, "Username_Input"), ctx))
                .isInstanceOf(StepFailureException.class)
                .hasMessageContaining("No handler");
    }
}
