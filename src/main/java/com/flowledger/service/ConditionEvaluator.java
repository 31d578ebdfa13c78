package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowledger.model.step.ConditionOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates one condition against a JSON payload.
 *
 * Supported operators:
 *   eq / neq           → structural equality; numbers compare numerically (1 == 1.0),
 *                        strings case-sensitively
 *   gt / gte / lt / lte → numeric comparison; numeric strings are parsed, any other
 *                        operand (text, boolean, null, object, array) counts as 0
 *   contains           → case-insensitive substring test on the text form of both sides
 *   exists             → value present, not null, not ""
 *
 * Absent values (path does not resolve) make every operator false except neq,
 * which is true because nothing differs from any comparison value.
 *
 * Evaluation is total: an operator applied to a shape it cannot handle returns
 * false. Nothing thrown here reaches the execution engine.
 */
@Component
@Slf4j
public class ConditionEvaluator {

    /**
     * Resolves {@code fieldPath} in the payload and applies the operator.
     */
    public boolean evaluate(JsonNode payload, String fieldPath, ConditionOperator operator, JsonNode comparisonValue) {
        return evaluate(PayloadPaths.resolve(payload, fieldPath), operator, comparisonValue);
    }

    /**
     * Applies the operator to an already-resolved value. {@code contextValue}
     * and {@code comparisonValue} are null when absent.
     */
    public boolean evaluate(JsonNode contextValue, ConditionOperator operator, JsonNode comparisonValue) {
        if (operator == null) {
            return false;
        }
        try {
            return switch (operator) {
                case EQ -> contextValue != null && comparisonValue != null
                        && jsonEquals(contextValue, comparisonValue);
                case NEQ -> comparisonValue != null
                        && (contextValue == null || !jsonEquals(contextValue, comparisonValue));
                case GT, GTE, LT, LTE -> compareNumeric(contextValue, comparisonValue, operator);
                case CONTAINS -> contains(contextValue, comparisonValue);
                case EXISTS -> exists(contextValue);
            };
        } catch (RuntimeException e) {
            // Fail-safe: a condition that cannot be evaluated does not match
            log.debug("Condition evaluation failed for operator {}: {}", operator.value(), e.getMessage());
            return false;
        }
    }

    private boolean jsonEquals(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        if (a.isObject() && b.isObject()) {
            if (a.size() != b.size()) return false;
            Iterator<Map.Entry<String, JsonNode>> fields = a.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode other = b.get(field.getKey());
                if (other == null || !jsonEquals(field.getValue(), other)) return false;
            }
            return true;
        }
        if (a.isArray() && b.isArray()) {
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!jsonEquals(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    private boolean compareNumeric(JsonNode actual, JsonNode expected, ConditionOperator operator) {
        if (actual == null || expected == null) {
            return false;
        }
        int cmp = toNumber(actual).compareTo(toNumber(expected));
        return switch (operator) {
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            default -> false;
        };
    }

    // Lossy on purpose: non-numeric operands become 0, so "abc" gt "xyz" is 0 > 0
    private BigDecimal toNumber(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return BigDecimal.ZERO;
            }
        }
        return BigDecimal.ZERO;
    }

    private boolean contains(JsonNode actual, JsonNode expected) {
        if (actual == null || expected == null) {
            return false;
        }
        return textOf(actual).toLowerCase(Locale.ROOT)
                .contains(textOf(expected).toLowerCase(Locale.ROOT));
    }

    private boolean exists(JsonNode actual) {
        if (actual == null || actual.isNull()) {
            return false;
        }
        return !(actual.isTextual() && actual.asText().isEmpty());
    }

    private String textOf(JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }
}
