package webqa.player;

import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.firefox.HasFullPageScreenshot;

/** Screenshot capture shared by visual checks and failure artifacts. */
final class Screenshots {

    private Screenshots() { }

    /**
     * Captures the page as PNG bytes, using the full-page variant where the
     * driver offers one (Firefox) and the viewport otherwise.
     *
     * @throws StepFailureException if the driver cannot take screenshots
     */
    static byte[] capturePng(WebDriver driver) {
        if (driver instanceof HasFullPageScreenshot) {
            return ((HasFullPageScreenshot) driver).getFullPageScreenshotAs(OutputType.BYTES);
        }
        if (driver instanceof TakesScreenshot) {
            return ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
        }
        throw new StepFailureException("Driver " + driver.getClass().getSimpleName()
                + " does not support screenshots");
    }
}
