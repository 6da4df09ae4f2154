package com.example.calcmcp.model;

public record CalculationResult(
        Operation operation,
        int left,
        int right,
        int result,
        String record,
        String historyName
) {}
