package com.docflow.workflow.condition;

import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.model.Condition;
import com.docflow.workflow.model.LogicalOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;

/**
 * Evaluates typed field comparisons against a document.
 *
 * <p>Group semantics: every AND-tagged condition is folded into
 * {@code allMet} (starts true), every OR-tagged condition into
 * {@code anyMet} (starts false). If any OR condition holds the group is
 * true, otherwise the group is {@code allMet}. A single satisfied OR
 * condition therefore overrides failed AND conditions. This matches how
 * existing definitions were authored; do not change it without confirming
 * with the definition owners.
 *
 * <p>Evaluation never throws. A missing field reads as the empty string;
 * non-numeric input to a numeric operator, or any other failure, yields
 * false.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    /** Evaluate one condition against a raw field value (null reads as ""). */
    public boolean evaluate(Condition condition, Object fieldValue) {
        try {
            return compare(condition, fieldValue == null ? "" : fieldValue.toString());
        } catch (RuntimeException e) {
            log.warn("Condition {} could not be evaluated against '{}': {}",
                    condition, fieldValue, e.getMessage());
            return false;
        }
    }

    /** Evaluate a condition group; an empty group passes. */
    public boolean evaluateGroup(Collection<Condition> conditions, DocumentSnapshot document) {
        if (conditions == null || conditions.isEmpty()) return true;
        if (document == null) return false;

        boolean allMet = true;
        boolean anyMet = false;
        for (Condition condition : conditions) {
            boolean met = evaluate(condition, document.field(condition.getField()));
            if (condition.getLogicalOperator() == LogicalOperator.OR) {
                anyMet = anyMet || met;
            } else {
                allMet = allMet && met;
            }
        }
        return anyMet || allMet;
    }

    // ------------------------------------------------------------------
    // Comparison
    // ------------------------------------------------------------------

    private static boolean compare(Condition condition, String field) {
        String value = condition.getValue() == null ? "" : condition.getValue();
        return switch (condition.getOperator()) {
            case EQUALS                -> field.equals(value);
            case NOT_EQUALS            -> !field.equals(value);
            case CONTAINS              -> field.contains(value);
            case NOT_CONTAINS          -> !field.contains(value);
            case STARTS_WITH           -> field.startsWith(value);
            case ENDS_WITH             -> field.endsWith(value);
            case GREATER_THAN          -> numeric(field, value) > 0;
            case GREATER_THAN_OR_EQUAL -> numeric(field, value) >= 0;
            case LESS_THAN             -> numeric(field, value) < 0;
            case LESS_THAN_OR_EQUAL    -> numeric(field, value) <= 0;
            case IN                    -> inList(field, value);
            case NOT_IN                -> !inList(field, value);
            case IS_EMPTY              -> field.isBlank();
            case IS_NOT_EMPTY          -> !field.isBlank();
        };
    }

    /** compareTo of the two values as numbers; throws NumberFormatException on non-numeric input. */
    private static int numeric(String field, String value) {
        return new BigDecimal(field.trim()).compareTo(new BigDecimal(value.trim()));
    }

    /** Comma-separated list membership, entries trimmed. */
    private static boolean inList(String field, String csv) {
        return Arrays.stream(csv.split(",")).map(String::trim).anyMatch(field::equals);
    }
}
