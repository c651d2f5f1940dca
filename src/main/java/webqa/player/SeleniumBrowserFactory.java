package webqa.player;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Creates local Selenium sessions. Selenium Manager (built into Selenium
 * 4.11+) downloads the matching browser driver, so no driver binaries need to
 * be installed.
 */
public class SeleniumBrowserFactory implements BrowserSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserFactory.class);

    private static final String WINDOW_SIZE = "--window-size=1920,1080";

    private final String browser;
    private final Duration pageLoadTimeout;

    /**
     * @param browser            {@code chrome}, {@code firefox} or {@code edge}
     * @param pageLoadTimeoutSec maximum time {@code driver.get} may block
     */
    public SeleniumBrowserFactory(String browser, int pageLoadTimeoutSec) {
        this.browser         = browser == null ? "chrome" : browser.toLowerCase(Locale.ROOT).trim();
        this.pageLoadTimeout = Duration.ofSeconds(pageLoadTimeoutSec);
    }

    @Override
    public WebDriver open(boolean headed) {
        log.info("Starting {} session ({})", browser, headed ? "headed" : "headless");
        WebDriver driver = switch (browser) {
            case "firefox" -> {
                FirefoxOptions opts = new FirefoxOptions();
                if (!headed) opts.addArguments("-headless");
                opts.addArguments("-width=1920", "-height=1080");
                yield new FirefoxDriver(opts);
            }
            case "edge" -> {
                EdgeOptions opts = new EdgeOptions();
                if (!headed) opts.addArguments("--headless=new");
                opts.addArguments(WINDOW_SIZE);
                yield new EdgeDriver(opts);
            }
            default -> {
                ChromeOptions opts = new ChromeOptions();
                if (!headed) opts.addArguments("--headless=new");
                opts.addArguments(WINDOW_SIZE, "--no-sandbox", "--disable-dev-shm-usage");
                yield new ChromeDriver(opts);
            }
        };
        driver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
        return driver;
    }
}
