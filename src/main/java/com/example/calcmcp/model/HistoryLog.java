package com.example.calcmcp.model;

import java.time.LocalDateTime;

public record HistoryLog(
        String name,
        int size,
        int capacity,
        LocalDateTime createdAt,
        boolean active
) {}
