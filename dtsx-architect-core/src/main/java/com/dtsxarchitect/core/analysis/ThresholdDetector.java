package com.dtsxarchitect.core.analysis;

import com.dtsxarchitect.core.model.Threshold;
import com.dtsxarchitect.core.model.Variable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Infers business thresholds from variable names.
 *
 * <p>The first name fragment found (case-insensitive, in declaration order of
 * {@link #CATEGORIES}) decides the category.
 */
public class ThresholdDetector {

    static final Map<String, String> CATEGORIES = new LinkedHashMap<>();

    static {
        CATEGORIES.put("threshold", "General");
        CATEGORIES.put("limit", "General");
        CATEGORIES.put("max", "Performance");
        CATEGORIES.put("min", "Performance");
        CATEGORIES.put("score", "Fraud");
        CATEGORIES.put("window", "Time");
        CATEGORIES.put("batch", "Performance");
        CATEGORIES.put("fraud", "Fraud");
        CATEGORIES.put("compliance", "Compliance");
    }

    public List<Threshold> detect(List<Variable> variables) {
        return variables.stream()
            .flatMap(variable -> categoryOf(variable.name())
                .map(category -> new Threshold(
                    variable.name(),
                    variable.value(),
                    variable.dataType(),
                    "Variable from namespace " + variable.namespace(),
                    category,
                    null))
                .stream())
            .toList();
    }

    /**
     * Returns the threshold category a variable name falls into.
     *
     * @param variableName variable name
     * @return category, or empty when the name is not threshold-like
     */
    public static Optional<String> categoryOf(String variableName) {
        String lower = variableName.toLowerCase(Locale.ROOT);
        return CATEGORIES.entrySet().stream()
            .filter(entry -> lower.contains(entry.getKey()))
            .map(Map.Entry::getValue)
            .findFirst();
    }
}
