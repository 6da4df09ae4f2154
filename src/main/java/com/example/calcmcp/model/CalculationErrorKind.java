package com.example.calcmcp.model;

public enum CalculationErrorKind {
    DIVISION_BY_ZERO,
    ARITHMETIC_OVERFLOW
}
