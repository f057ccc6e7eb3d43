package com.bizpulse.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A known noise signature. An anomaly matches when every condition holds against its data
 * snapshot; a pattern without conditions never matches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FalsePositivePattern {

    private String name;

    @Builder.Default
    private Map<String, Condition> conditions = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Condition {
        private Double min;          // inclusive
        private Double max;          // inclusive
        private String equalsValue;  // exact text match, compared against String.valueOf(value)

        public boolean test(Object value) {
            if (value == null) return false;
            if (equalsValue != null && !equalsValue.equals(String.valueOf(value))) {
                return false;
            }
            if (min != null || max != null) {
                if (!(value instanceof Number number)) return false;
                double v = number.doubleValue();
                if (Double.isNaN(v)) return false;
                if (min != null && v < min) return false;
                if (max != null && v > max) return false;
            }
            return true;
        }
    }

    public boolean matches(Map<String, Object> data) {
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }
        for (Map.Entry<String, Condition> entry : conditions.entrySet()) {
            if (!entry.getValue().test(data.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
