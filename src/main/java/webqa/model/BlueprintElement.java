package webqa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An interactive page element discovered by the crawler.
 *
 * <p>Steps address elements only through {@link #getLogicalName()}; the
 * remaining attributes feed {@code LocatorResolver}, which turns them into a
 * concrete selector.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlueprintElement {

    @JsonProperty("logical_name")
    private String logicalName;

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("text")
    private String text;

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("placeholder")
    private String placeholder;

    @JsonProperty("aria_label")
    private String ariaLabel;

    @JsonProperty("role")
    private String role;

    @JsonProperty("data_test")
    private String dataTest;

    public BlueprintElement() {}

    public BlueprintElement(String logicalName) {
        this.logicalName = logicalName;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String getLogicalName() { return logicalName; }
    public String getTag()         { return tag; }
    public String getText()        { return text; }
    public String getId()          { return id; }
    public String getName()        { return name; }
    public String getPlaceholder() { return placeholder; }
    public String getAriaLabel()   { return ariaLabel; }
    public String getRole()        { return role; }
    public String getDataTest()    { return dataTest; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setLogicalName(String v) { this.logicalName = v; }
    public void setTag(String v)         { this.tag = v; }
    public void setText(String v)        { this.text = v; }
    public void setId(String v)          { this.id = v; }
    public void setName(String v)        { this.name = v; }
    public void setPlaceholder(String v) { this.placeholder = v; }
    public void setAriaLabel(String v)   { this.ariaLabel = v; }
    public void setRole(String v)        { this.role = v; }
    public void setDataTest(String v)    { this.dataTest = v; }

    // ── Fluent builders (tests, fixtures) ────────────────────────────────

    public BlueprintElement withTag(String v)         { this.tag = v; return this; }
    public BlueprintElement withText(String v)        { this.text = v; return this; }
    public BlueprintElement withId(String v)          { this.id = v; return this; }
    public BlueprintElement withName(String v)        { this.name = v; return this; }
    public BlueprintElement withPlaceholder(String v) { this.placeholder = v; return this; }
    public BlueprintElement withDataTest(String v)    { this.dataTest = v; return this; }

    @Override
    public String toString() {
        return String.format("BlueprintElement{'%s' tag=%s id=%s data_test=%s}",
                logicalName, tag, id, dataTest);
    }
}
