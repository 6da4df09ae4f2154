package com.example.calcmcp.service;

import com.example.calcmcp.history.History;
import com.example.calcmcp.model.CalculationErrorKind;
import com.example.calcmcp.model.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.IntBinaryOperator;

public class SimpleCalculator implements Calculator {

    private static final Logger log = LoggerFactory.getLogger(SimpleCalculator.class);

    private volatile History history;

    public SimpleCalculator(History history) {
        this.history = Objects.requireNonNull(history, "history");
    }

    @Override
    public int add(int a, int b) {
        return apply(Operation.ADD, a, b, Math::addExact);
    }

    @Override
    public int subtract(int a, int b) {
        return apply(Operation.SUBTRACT, a, b, Math::subtractExact);
    }

    @Override
    public int multiply(int a, int b) {
        return apply(Operation.MULTIPLY, a, b, Math::multiplyExact);
    }

    @Override
    public int divide(int a, int b) {
        if (b == 0) {
            throw new CalculationException(CalculationErrorKind.DIVISION_BY_ZERO, Operation.DIVIDE, a, b);
        }
        // MIN_VALUE / -1 is the only quotient that leaves the int range
        if (a == Integer.MIN_VALUE && b == -1) {
            throw new CalculationException(CalculationErrorKind.ARITHMETIC_OVERFLOW, Operation.DIVIDE, a, b);
        }
        return apply(Operation.DIVIDE, a, b, (x, y) -> x / y);
    }

    @Override
    public void setHistory(History history) {
        Objects.requireNonNull(history, "history");
        if (history != this.history) {
            log.info("Calculator history rebound");
        }
        this.history = history;
    }

    @Override
    public History getHistory() {
        return history;
    }

    private int apply(Operation op, int a, int b, IntBinaryOperator fn) {
        int result;
        try {
            result = fn.applyAsInt(a, b);
        } catch (ArithmeticException e) {
            CalculationException overflow =
                    new CalculationException(CalculationErrorKind.ARITHMETIC_OVERFLOW, op, a, b);
            overflow.initCause(e);
            throw overflow;
        }
        String record = op.format(a, b, result);
        // single read: a concurrent rebind lands the record in exactly one history
        History target = history;
        target.addEntry(record);
        log.debug("recorded: {}", record);
        return result;
    }
}
