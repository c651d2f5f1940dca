package webqa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named dataset. Each parameter set of a job produces its own run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParameterSet {

    public static final String DEFAULT_NAME = "default";

    @JsonProperty("dataset_name")
    private String datasetName = DEFAULT_NAME;

    @JsonProperty("data")
    private Map<String, String> data = new LinkedHashMap<>();

    public ParameterSet() {}

    public ParameterSet(String datasetName, Map<String, String> data) {
        this.datasetName = datasetName;
        setData(data);
    }

    /** The implicit dataset used when a job declares no parameters. */
    public static ParameterSet defaultSet() {
        return new ParameterSet(DEFAULT_NAME, Map.of());
    }

    public String getDatasetName() {
        return datasetName == null || datasetName.isBlank() ? DEFAULT_NAME : datasetName;
    }

    public Map<String, String> getData() {
        return data == null ? Map.of() : Collections.unmodifiableMap(data);
    }

    public void setDatasetName(String name) { this.datasetName = name; }

    public void setData(Map<String, String> data) {
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
    }

    /** Returns the value for {@code key}, or an empty string when absent. */
    public String valueFor(String key) {
        if (key == null || data == null) return "";
        String value = data.get(key);
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return String.format("ParameterSet{'%s', keys=%s}", getDatasetName(), getData().keySet());
    }
}
