package com.example.calcmcp.service;

import com.example.calcmcp.history.History;

/**
 * Integer calculator that appends a record of every successful operation to
 * its bound {@link History}.
 */
public interface Calculator {

    int add(int a, int b);

    int subtract(int a, int b);

    int multiply(int a, int b);

    /** Integer division truncating toward zero. */
    int divide(int a, int b);

    /** Routes records of all later operations to {@code history}. */
    void setHistory(History history);

    History getHistory();
}
