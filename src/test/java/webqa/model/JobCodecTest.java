package webqa.model;

import org.testng.annotations.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobCodec}: schema validation and binding of job messages.
 */
public class JobCodecTest {

    private static final String LOGIN_JOB = """
            {
              "test_case_id": "TC_LOGIN",
              "objective": "Standard user can log in",
              "target_url": "https://www.saucedemo.com/",
              "is_live_view": true,
              "run_id": 17,
              "ui_blueprint": [
                {"logical_name": "Username_Input", "tag": "input", "id": "user-name", "placeholder": "Username"},
                {"logical_name": "Login_Button", "tag": "input", "data_test": "login-button"}
              ],
              "parameters": [
                {"dataset_name": "standard_user", "data": {"username": "standard_user", "attempts": 3, "remember": true}}
              ],
              "steps": [
                {"step_number": 1, "action": "ENTER_TEXT", "target_element": "Username_Input", "data_key": "username"},
                {"step_number": 2, "action": "CLICK", "target_element": "Login_Button",
                 "verifications": {"target_element": "Inventory_List"}},
                {"step_number": 3, "action": "VISUAL_VALIDATION", "target_element": "Inventory_Page"}
              ],
              "dispatched_by": "scheduler"
            }
            """;

    @Test
    public void decode_bindsFullJob() throws MalformedJobException {
        TestCaseJob job = JobCodec.decode(LOGIN_JOB);

        assertThat(job.getTestCaseId()).isEqualTo("TC_LOGIN");
        assertThat(job.getTargetUrl()).isEqualTo("https://www.saucedemo.com/");
        assertThat(job.isLiveView()).isTrue();
        assertThat(job.getRunId()).isEqualTo("17");
        assertThat(job.getUiBlueprint()).extracting(BlueprintElement::getLogicalName)
                .containsExactly("Username_Input", "Login_Button");
        assertThat(job.getUiBlueprint().get(1).getDataTest()).isEqualTo("login-button");
        assertThat(job.getSteps()).extracting(Step::getAction)
                .containsExactly(StepAction.ENTER_TEXT, StepAction.CLICK, StepAction.VISUAL_VALIDATION);
    }

    @Test(description = "scalar dataset values are bound as strings")
    public void decode_coercesScalarDataToStrings() throws MalformedJobException {
        ParameterSet set = JobCodec.decode(LOGIN_JOB).getParameters().get(0);

        assertThat(set.getDatasetName()).isEqualTo("standard_user");
        assertThat(set.valueFor("attempts")).isEqualTo("3");
        assertThat(set.valueFor("remember")).isEqualTo("true");
        assertThat(set.valueFor("missing")).isEmpty();
    }

    @Test(description = "a single verification object is accepted as a one-element list")
    public void decode_singleVerificationObject() throws MalformedJobException {
        Step click = JobCodec.decode(LOGIN_JOB).getSteps().get(1);

        assertThat(click.hasVerifications()).isTrue();
        assertThat(click.getVerifications()).hasSize(1);
        Verification v = click.getVerifications().get(0);
        assertThat(v.getTargetElement()).isEqualTo("Inventory_List");
        assertThat(v.isElementVisible()).isTrue();
    }

    @Test
    public void decode_noParameters_usesDefaultSet() throws MalformedJobException {
        TestCaseJob job = JobCodec.decode("""
                {"test_case_id": "TC_HOME", "target_url": "https://example.com", "steps": []}
                """);

        assertThat(job.getParameters()).isEmpty();
        assertThat(job.effectiveParameters()).extracting(ParameterSet::getDatasetName).containsExactly("default");
        assertThat(job.getRunId()).isNull();
        assertThat(job.isLiveView()).isFalse();
    }

    // ── Malformed messages ────────────────────────────────────────────────

    @Test
    public void decode_blank_isMalformed() {
        assertThatThrownBy(() -> JobCodec.decode("  "))
                .isInstanceOf(MalformedJobException.class)
                .hasMessageContaining("Empty");
    }

    @Test
    public void decode_invalidJson_isMalformed() {
        assertThatThrownBy(() -> JobCodec.decode("{\"test_case_id\": "))
                .isInstanceOf(MalformedJobException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    public void decode_jsonArray_isMalformed() {
        assertThatThrownBy(() -> JobCodec.decode("[1, 2]"))
                .isInstanceOf(MalformedJobException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    public void decode_missingRequiredField_isMalformed() {
        assertThatThrownBy(() -> JobCodec.decode("""
                {"test_case_id": "TC_X", "steps": []}
                """))
                .isInstanceOf(MalformedJobException.class)
                .hasMessageContaining("target_url");
    }

    @Test
    public void decode_unknownAction_isMalformed() {
        assertThatThrownBy(() -> JobCodec.decode("""
                {"test_case_id": "TC_X", "target_url": "https://example.com",
                 "steps": [{"action": "DRAG_AND_DROP", "target_element": "Card"}]}
                """))
                .isInstanceOf(MalformedJobException.class);
    }

    @Test
    public void encode_usesWireNames() throws IOException, MalformedJobException {
        String json = JobCodec.encode(JobCodec.decode(LOGIN_JOB));

        assertThat(json).contains("\"test_case_id\":\"TC_LOGIN\"")
                .contains("\"is_live_view\":true")
                .contains("\"target_element\":\"Inventory_List\"");
        assertThat(JobCodec.decode(json).getSteps()).hasSize(3);
    }
}
