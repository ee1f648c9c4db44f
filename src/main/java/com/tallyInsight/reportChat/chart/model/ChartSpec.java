package com.tallyInsight.reportChat.chart.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Vega-Lite v5 document. Encoding channels are kept as plain maps since their shape varies per mark.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChartSpec {

    public static final String SCHEMA_URL = "https://vega.github.io/schema/vega-lite/v5.json";

    @Builder.Default
    @JsonProperty("$schema")
    private String schema = SCHEMA_URL;

    @JsonProperty("description")
    private String description;

    /**
     * Mark name or mark definition map
     */
    @JsonProperty("mark")
    private Object mark;

    @JsonProperty("encoding")
    private Map<String, Object> encoding;

    @JsonProperty("transform")
    private List<Map<String, Object>> transform;

    @JsonProperty("layer")
    private List<Map<String, Object>> layer;

    @JsonProperty("view")
    private Map<String, Object> view;

    @JsonProperty("data")
    private DataSet data;

    @JsonIgnore
    private ChartType chartType;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DataSet {
        @JsonProperty("values")
        private List<Map<String, Object>> values;
    }

    /**
     * Fields referenced by tooltip channels, top level and layers.
     */
    @JsonIgnore
    public List<String> getTooltipFields() {
        Set<String> fields = new LinkedHashSet<>();
        collectTooltipFields(encoding, fields);
        if (layer != null) {
            for (Map<String, Object> view : layer) {
                Object layerEncoding = view.get("encoding");
                if (layerEncoding instanceof Map<?, ?> map) {
                    collectTooltipFields(map, fields);
                }
            }
        }
        return new ArrayList<>(fields);
    }

    /**
     * @return true when the top level or any layer binds the color channel
     */
    @JsonIgnore
    public boolean hasColorEncoding() {
        if (encoding != null && encoding.get("color") != null) {
            return true;
        }
        if (layer == null) {
            return false;
        }
        return layer.stream()
                .map(view -> view.get("encoding"))
                .anyMatch(layerEncoding -> layerEncoding instanceof Map<?, ?> map && map.get("color") != null);
    }

    private static void collectTooltipFields(Map<?, ?> encoding, Set<String> fields) {
        if (encoding == null) {
            return;
        }
        Object tooltip = encoding.get("tooltip");
        if (tooltip instanceof List<?> list) {
            for (Object channel : list) {
                if (channel instanceof Map<?, ?> map && map.get("field") != null) {
                    fields.add(map.get("field").toString());
                }
            }
        } else if (tooltip instanceof Map<?, ?> map && map.get("field") != null) {
            fields.add(map.get("field").toString());
        }
    }
}
