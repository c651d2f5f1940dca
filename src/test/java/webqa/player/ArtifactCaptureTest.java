package webqa.player;

import webqa.model.Artifact;
import webqa.model.Run;
import webqa.model.Step;
import webqa.model.StepAction;
import webqa.storage.FileSystemObjectStore;
import webqa.storage.ObjectStore;

import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.logging.LogEntries;
import org.openqa.selenium.logging.LogEntry;
import org.openqa.selenium.logging.LogType;
import org.openqa.selenium.logging.Logs;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ArtifactCapture}.
 *
 * <p>Uses a mocked driver and a temporary file-system object store.
 */
public class ArtifactCaptureTest {

    private interface ScreenshottingDriver extends WebDriver, TakesScreenshot {}

    private static final String PREFIX = "runs/TC_LOGIN/standard_user-20260101T000000_000Z";
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    private Path storeRoot;
    private FileSystemObjectStore store;
    private ScreenshottingDriver driver;
    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @BeforeMethod
    public void setUp() throws IOException {
        storeRoot = Files.createTempDirectory("webqa-artifacts-");
        store = new FileSystemObjectStore(storeRoot);
        driver = mock(ScreenshottingDriver.class, RETURNS_DEEP_STUBS);
        when(driver.getScreenshotAs(OutputType.BYTES)).thenReturn(PNG);
        when(driver.getPageSource()).thenReturn("<html><body>Epic sadface</body></html>");
        when(driver.getCurrentUrl()).thenReturn("https://www.saucedemo.com/");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(storeRoot)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    private static Run newRun() {
        return new Run("run-7", "TC_LOGIN", "standard_user", false, PREFIX);
    }

    private static Map<String, String> unzip(byte[] zip) throws IOException {
        Map<String, String> entries = new HashMap<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        return entries;
    }

    // ── Tests ─────────────────────────────────────────────────────────────

    @Test(description = "failure capture uploads the screenshot and a trace bundle under the run prefix")
    public void capture_uploadsScreenshotAndTrace() throws IOException {
        Logs logs = mock(Logs.class);
        when(driver.manage().logs()).thenReturn(logs);
        when(logs.get(LogType.BROWSER)).thenReturn(new LogEntries(List.of(
                new LogEntry(Level.SEVERE, 1_767_225_600_000L, "Uncaught TypeError"))));
        Run run = newRun();
        Step step = new Step(3, StepAction.CLICK, "Login_Button");

        new ArtifactCapture(store, true, clock).capture(driver, run, step, "Element 'Inventory_List' not visible");

        assertThat(store.get(PREFIX + "/failure.png")).hasValueSatisfying(b -> assertThat(b).isEqualTo(PNG));
        Map<String, String> trace = unzip(store.get(PREFIX + "/trace.zip").orElseThrow());
        assertThat(trace).containsKeys("page-source.html", "console.log", "context.txt");
        assertThat(trace.get("page-source.html")).contains("Epic sadface");
        assertThat(trace.get("console.log")).contains("SEVERE").contains("Uncaught TypeError");
        assertThat(trace.get("context.txt"))
                .contains("TC_LOGIN")
                .contains("3 CLICK 'Login_Button'")
                .contains("Element 'Inventory_List' not visible")
                .contains("https://www.saucedemo.com/");
        assertThat(run.getArtifacts()).extracting(Artifact::kind)
                .containsExactly(Artifact.Kind.FAILURE_SCREENSHOT, Artifact.Kind.TRACE);
    }

    @Test(description = "a second capture for the same run uploads nothing")
    public void capture_isIdempotentPerRun() throws IOException {
        ObjectStore counting = mock(ObjectStore.class);
        ArtifactCapture capture = new ArtifactCapture(counting, true, clock);
        Run run = newRun();

        capture.capture(driver, run, null, "first");
        capture.capture(driver, run, null, "second");

        verify(counting, times(2)).put(anyString(), any(byte[].class), anyString());
    }

    @Test
    public void capture_tracingDisabled_uploadsScreenshotOnly() throws IOException {
        Run run = newRun();

        new ArtifactCapture(store, false, clock).capture(driver, run, null, "Navigation timed out");

        assertThat(store.get(PREFIX + "/failure.png")).isPresent();
        assertThat(store.get(PREFIX + "/trace.zip")).isEmpty();
    }

    @Test(description = "a failing screenshot does not prevent the trace upload")
    public void capture_screenshotFailure_isSwallowed() throws IOException {
        when(driver.getScreenshotAs(OutputType.BYTES)).thenThrow(new WebDriverException("session crashed"));
        Run run = newRun();

        assertThatCode(() -> new ArtifactCapture(store, true, clock).capture(driver, run, null, "boom"))
                .doesNotThrowAnyException();

        assertThat(store.get(PREFIX + "/failure.png")).isEmpty();
        assertThat(store.get(PREFIX + "/trace.zip")).isPresent();
        assertThat(run.hasArtifact(Artifact.Kind.FAILURE_SCREENSHOT)).isFalse();
    }

    @Test
    public void capture_storeFailure_isSwallowed() throws IOException {
        ObjectStore broken = mock(ObjectStore.class);
        doThrow(new IOException("read-only file system")).when(broken).put(anyString(), any(byte[].class), anyString());
        Run run = newRun();

        assertThatCode(() -> new ArtifactCapture(broken, true, clock).capture(driver, run, null, "boom"))
                .doesNotThrowAnyException();
        assertThat(run.getArtifacts()).isEmpty();
    }

    @Test
    public void capture_withoutSession_doesNothing() {
        Run run = newRun();

        assertThatCode(() -> new ArtifactCapture(store, true, clock).capture(null, run, null, "no browser"))
                .doesNotThrowAnyException();
        assertThat(run.getArtifacts()).isEmpty();
    }
}
