package webqa.player;

import org.openqa.selenium.WebDriver;

/** Opens a fresh browser session for one run. */
public interface BrowserSessionFactory {

    /**
     * @param headed {@code true} to show the browser window (live view)
     * @return a new session; the caller quits it
     */
    WebDriver open(boolean headed);
}
