package com.example.calcmcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code calculator.history.*} settings.
 *
 * @param defaultName history the calculator is bound to at startup
 * @param maxEntries  per-history capacity, {@code 0} for unbounded
 */
@ConfigurationProperties("calculator.history")
public record HistoryProperties(
        @DefaultValue("default") String defaultName,
        @DefaultValue("0") int maxEntries
) {}
