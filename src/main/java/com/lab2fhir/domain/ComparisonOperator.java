package com.lab2fhir.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualifier of an operator-numeric result such as "&lt;0.1".
 */
public enum ComparisonOperator {
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    @JsonCreator
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol == null) {
            return null;
        }
        String trimmed = symbol.trim();
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unsupported comparison operator: " + symbol);
    }
}
