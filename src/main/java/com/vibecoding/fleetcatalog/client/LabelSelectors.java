package com.vibecoding.fleetcatalog.client;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * LabelSelector -> "k=v,k in (a,b)" 형식 문자열
 */
public final class LabelSelectors {

    private LabelSelectors() {
    }

    /**
     * @return 조건이 없으면 null
     */
    public static String selectorToString(LabelSelector selector) {
        if (selector == null) {
            return null;
        }

        List<String> parts = new ArrayList<>();
        if (selector.getMatchLabels() != null) {
            selector.getMatchLabels().forEach((key, value) -> parts.add(key + "=" + value));
        }
        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement requirement : selector.getMatchExpressions()) {
                String expression = toExpression(requirement);
                if (expression != null) {
                    parts.add(expression);
                }
            }
        }
        return parts.isEmpty() ? null : String.join(",", parts);
    }

    private static String toExpression(LabelSelectorRequirement requirement) {
        String key = requirement.getKey();
        if (key == null || requirement.getOperator() == null) {
            return null;
        }
        List<String> values = requirement.getValues() != null ? requirement.getValues() : Collections.emptyList();

        switch (requirement.getOperator()) {
            case "In":
                return key + " in (" + String.join(",", values) + ")";
            case "NotIn":
                return key + " notin (" + String.join(",", values) + ")";
            case "Exists":
                return key;
            case "DoesNotExist":
                return "!" + key;
            default:
                return null;
        }
    }
}
