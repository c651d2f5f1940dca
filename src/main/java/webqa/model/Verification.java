package webqa.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Post-action assertion attached to a {@code CLICK} step: once navigation
 * settles, {@code targetElement} must be visible.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Verification {

    public static final String TYPE_ELEMENT_VISIBLE = "VERIFY_ELEMENT_VISIBLE";

    @JsonProperty("type")
    private String type = TYPE_ELEMENT_VISIBLE;

    @JsonProperty("target_element")
    private String targetElement;

    public Verification() {}

    public Verification(String targetElement) {
        this.targetElement = targetElement;
    }

    public String getType()          { return type; }
    public String getTargetElement() { return targetElement; }

    public void setType(String type)                   { this.type = type; }
    public void setTargetElement(String targetElement) { this.targetElement = targetElement; }

    /** Blank or missing type means visibility, the only supported check. */
    @JsonIgnore
    public boolean isElementVisible() {
        return type == null || type.isBlank() || TYPE_ELEMENT_VISIBLE.equalsIgnoreCase(type.trim());
    }

    @Override
    public String toString() {
        return String.format("Verification{%s on '%s'}", type, targetElement);
    }
}
