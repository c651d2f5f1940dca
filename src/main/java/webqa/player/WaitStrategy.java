package webqa.player;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Centralises all explicit wait logic for step execution. Implicit waits are
 * never set: every wait goes through this class so timeouts are bounded and
 * logged uniformly.
 */
public class WaitStrategy {

    private static final Logger log = LoggerFactory.getLogger(WaitStrategy.class);

    private final WebDriverWait wait;
    private final Duration timeout;

    /**
     * @param driver  active WebDriver session
     * @param timeout maximum time to wait for any condition
     */
    public WaitStrategy(WebDriver driver, Duration timeout) {
        this.timeout = timeout;
        this.wait = new WebDriverWait(driver, timeout);
    }

    public Duration getTimeout() { return timeout; }

    /**
     * Waits until the element is both present in the DOM and visible on screen.
     *
     * @param locator     Selenium {@link By} locator
     * @param logicalName name used in failure messages
     * @return the visible {@link WebElement}
     * @throws ElementNotVisibleException if the element is not visible within the timeout
     */
    public WebElement waitForVisible(By locator, String logicalName) {
        log.debug("Waiting up to {}ms for '{}' VISIBLE: {}", timeout.toMillis(), logicalName, locator);
        try {
            return wait.until(ExpectedConditions.visibilityOfElementLocated(locator));
        } catch (RuntimeException e) {
            throw new ElementNotVisibleException(String.format(
                    "Element '%s' not visible after %ds (%s)", logicalName, timeout.toSeconds(), locator), e);
        }
    }

    /**
     * Waits until the browser reports {@code document.readyState == 'complete'}.
     *
     * @throws NavigationTimeoutException if the page does not finish loading within the timeout
     */
    public void waitForPageLoad() {
        log.debug("Waiting up to {}ms for page load (document.readyState == complete)", timeout.toMillis());
        try {
            wait.until(d -> {
                Object state = ((JavascriptExecutor) d)
                        .executeScript("return document.readyState");
                return "complete".equals(state);
            });
        } catch (RuntimeException e) {
            throw new NavigationTimeoutException(
                    "Page did not finish loading within " + timeout.toSeconds() + "s", e);
        }
    }
}
