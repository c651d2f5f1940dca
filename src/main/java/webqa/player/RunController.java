package webqa.player;

import webqa.WorkerConfig;
import webqa.model.ParameterSet;
import webqa.model.Run;
import webqa.model.RunStatus;
import webqa.model.Step;
import webqa.model.TestCaseJob;
import webqa.reporting.RunReporter;
import webqa.storage.ObjectKeys;

import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Executes a {@link TestCaseJob}: one independent {@link Run} per parameter
 * set, each in its own browser session.
 *
 * <p>Per run:
 * <ol>
 *   <li>Report the run as started (creating its record if needed).</li>
 *   <li>Open a browser, navigate to {@code target_url} and wait for load.</li>
 *   <li>Execute steps in order; the first failure ends the run as FAIL and
 *       triggers artifact capture.</li>
 *   <li>Quit the browser, settle the run and report the final status.</li>
 * </ol>
 * Navigation and each step run through a {@link BoundedStepRunner}, so no
 * single step can hold the worker longer than {@code player.step.timeout.sec}.
 * Step results come back to this thread and only this thread mutates the
 * {@link Run}.
 *
 * <p>The browser is headed when the worker runs in live-view mode; live
 * progress updates are sent only for jobs flagged {@code is_live_view}.
 */
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final WorkerConfig config;
    private final BrowserSessionFactory browsers;
    private final StepExecutor stepExecutor;
    private final ArtifactCapture artifactCapture;
    private final RunReporter reporter;
    private final Clock clock;

    public RunController(WorkerConfig config,
                         BrowserSessionFactory browsers,
                         StepExecutor stepExecutor,
                         ArtifactCapture artifactCapture,
                         RunReporter reporter,
                         Clock clock) {
        this.config          = config;
        this.browsers        = browsers;
        this.stepExecutor    = stepExecutor;
        this.artifactCapture = artifactCapture;
        this.reporter        = reporter;
        this.clock           = clock;
    }

    /** Runs a job that did not come off the queue, e.g. a job file from the CLI. */
    public List<Run> execute(TestCaseJob job) {
        return execute(job, "local-" + UUID.randomUUID());
    }

    /**
     * Runs every parameter set of {@code job}. Never throws for test failures;
     * the outcome of each set is in the returned runs.
     *
     * @param deliveryId identifies this delivery of the job; redeliveries of the
     *                   same message share it, separate submissions do not
     * @return one settled run per parameter set, in order
     */
    public List<Run> execute(TestCaseJob job, String deliveryId) {
        boolean headed = config.isLiveViewMode();
        List<ParameterSet> sets = job.effectiveParameters();
        log.info("RunController: test case '{}' with {} parameter set(s), {} step(s), delivery {}{}{}",
                job.getTestCaseId(), sets.size(), job.getSteps().size(), deliveryId,
                headed ? " [headed]" : "", job.isLiveView() ? " [live updates]" : "");

        List<Run> runs = new ArrayList<>();
        for (int i = 0; i < sets.size(); i++) {
            // A supplied run_id belongs to the first set; the rest get fresh records.
            String runId = i == 0 ? job.getRunId() : null;
            runs.add(executeDataset(job, sets.get(i), runId, deliveryId, headed));
        }
        return runs;
    }

    private Run executeDataset(TestCaseJob job, ParameterSet dataset, String runId, String deliveryId,
                               boolean headed) {
        Run run = new Run(runId, job.getTestCaseId(), dataset.getDatasetName(), job.isLiveView(),
                ObjectKeys.runPrefix(job.getTestCaseId(), dataset.getDatasetName(), clock));
        reporter.runStarted(run, job, dataset, deliveryId);
        log.info("RunController: starting {}", run);

        WebDriver driver = null;
        Step current = null;
        String threadName = "step-runner-" + ObjectKeys.runIdentity(job.getTestCaseId(), dataset.getDatasetName());
        try (BoundedStepRunner runner = new BoundedStepRunner(config.getStepTimeout(), threadName)) {
            driver = browsers.open(headed);
            WaitStrategy wait = new WaitStrategy(driver, Duration.ofSeconds(config.getExplicitWaitSec()));
            navigate(runner, driver, wait, job.getTargetUrl());

            StepContext ctx = new StepContext(driver, wait, job.getUiBlueprint(), dataset, run);
            for (Step step : job.getSteps()) {
                current = step;
                reporter.stepStatus(run, step, RunStatus.RUNNING, null);
                StepOutcome outcome = runner.submit(() -> stepExecutor.execute(step, ctx),
                        "step " + step.getStepNumber() + " (" + step.getAction() + ")");
                run.recordVisualStatus(outcome.visualStatus());
                reporter.stepStatus(run, step, RunStatus.PASS, null);
                current = null;
                if (headed) {
                    pause(config.getLiveViewStepDelayMs());
                }
            }
        } catch (VisualMismatchException e) {
            run.recordVisualCheck(e.getResult().status(), e.getResult().artifactKey());
            onFailure(run, driver, current, e.getMessage());
        } catch (StepTimeoutException e) {
            // The abandoned task may still hold the browser; leave it alone.
            onFailure(run, e.isTaskStillRunning() ? null : driver, current, e.getMessage());
        } catch (StepFailureException e) {
            onFailure(run, driver, current, e.getMessage());
        } catch (WebDriverException e) {
            onFailure(run, driver, current, "Browser error: " + firstLine(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("RunController: unexpected error in {}", run, e);
            onFailure(run, driver, current, "Unexpected error: " + e);
        } finally {
            quit(driver);
            run.complete();
            log.info("RunController: finished {}{}", run,
                    run.getFailureReason() == null ? "" : " - " + run.getFailureReason());
            reporter.runFinished(run);
        }
        return run;
    }

    private void navigate(BoundedStepRunner runner, WebDriver driver, WaitStrategy wait, String url) {
        log.info("RunController: navigating to {}", url);
        runner.submit(() -> {
            try {
                driver.get(url);
            } catch (TimeoutException e) {
                throw new NavigationTimeoutException("Navigation to " + url + " timed out after "
                        + config.getPageLoadTimeoutSec() + "s", e);
            }
            wait.waitForPageLoad();
            return null;
        }, "navigation to " + url);
    }

    private void onFailure(Run run, WebDriver driver, Step step, String reason) {
        if (!run.fail(reason)) return;
        log.error("RunController: {} failed{}: {}", run,
                step == null ? " before the first step" : " at step " + step.getStepNumber(), reason);
        if (step != null) {
            reporter.stepStatus(run, step, RunStatus.FAIL, reason);
        }
        artifactCapture.capture(driver, run, step, reason);
    }

    private static void quit(WebDriver driver) {
        if (driver == null) return;
        try {
            driver.quit();
        } catch (Exception e) {
            log.warn("RunController: error quitting browser session: {}", e.getMessage());
        }
    }

    private static void pause(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String firstLine(String message) {
        if (message == null) return "(no message)";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
