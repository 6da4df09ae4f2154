package com.example.calcmcp.service;

import com.example.calcmcp.model.CalculationErrorKind;
import com.example.calcmcp.model.Operation;

/**
 * Thrown when an operation has no representable {@code int} result.
 * Nothing is recorded in the history when this is raised.
 */
public class CalculationException extends ArithmeticException {

    private final CalculationErrorKind kind;
    private final Operation operation;

    public CalculationException(CalculationErrorKind kind, Operation operation, int left, int right) {
        super(describe(kind, operation, left, right));
        this.kind = kind;
        this.operation = operation;
    }

    public CalculationErrorKind getKind() {
        return kind;
    }

    public Operation getOperation() {
        return operation;
    }

    private static String describe(CalculationErrorKind kind, Operation operation, int left, int right) {
        String expr = left + " " + operation.symbol() + " " + right;
        return switch (kind) {
            case DIVISION_BY_ZERO -> "Division by zero: " + expr;
            case ARITHMETIC_OVERFLOW -> "Integer overflow: " + expr;
        };
    }
}
