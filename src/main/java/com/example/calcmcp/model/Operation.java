package com.example.calcmcp.model;

public enum Operation {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    Operation(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Renders {@code "<a> <symbol> <b> = <result>"}. */
    public String format(int left, int right, int result) {
        return left + " " + symbol + " " + right + " = " + result;
    }
}
