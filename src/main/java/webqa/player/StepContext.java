package webqa.player;

import webqa.model.BlueprintElement;
import webqa.model.ParameterSet;
import webqa.model.Run;

import org.openqa.selenium.WebDriver;

import java.util.List;

/**
 * Everything a step needs besides the step itself: the live browser session,
 * its wait helper, the blueprint and dataset of the job, and the run it
 * belongs to. Steps read the run; only the controller thread changes it.
 */
public record StepContext(WebDriver driver,
                          WaitStrategy waits,
                          List<BlueprintElement> blueprint,
                          ParameterSet dataset,
                          Run run) {
}
