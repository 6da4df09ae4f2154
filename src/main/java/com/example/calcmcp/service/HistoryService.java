package com.example.calcmcp.service;

import com.example.calcmcp.config.HistoryProperties;
import com.example.calcmcp.history.History;
import com.example.calcmcp.history.InMemoryHistory;
import com.example.calcmcp.model.HistoryLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named histories. The history the calculator is bound to at
 * construction is registered under the configured default name.
 */
@Service
public class HistoryService {

    private static final Logger log = LoggerFactory.getLogger(HistoryService.class);

    private record Named(String name, History history, int capacity, LocalDateTime createdAt) {}

    private final Map<String, Named> store = new ConcurrentHashMap<>();
    private final Calculator calculator;
    private final int maxEntries;

    public HistoryService(Calculator calculator, HistoryProperties properties) {
        this.calculator = calculator;
        this.maxEntries = properties.maxEntries();
        History initial = calculator.getHistory();
        int capacity = initial instanceof InMemoryHistory m ? m.capacity() : maxEntries;
        String name = normalize(properties.defaultName());
        store.put(name, new Named(name, initial, capacity, LocalDateTime.now()));
    }

    public History current() {
        return calculator.getHistory();
    }

    /** Name the bound history is registered under, if it came from this registry. */
    public Optional<String> currentName() {
        History bound = calculator.getHistory();
        return store.values().stream()
                .filter(n -> n.history() == bound)
                .map(Named::name)
                .findFirst();
    }

    public Optional<History> findByName(String name) {
        return Optional.ofNullable(store.get(normalize(name))).map(Named::history);
    }

    /** Binds the calculator to the named history, creating an empty one on first use. */
    public HistoryLog switchTo(String name) {
        String key = normalize(name);
        Named target = store.computeIfAbsent(key, k -> {
            log.info("Creating history '{}' (maxEntries={})", k, maxEntries);
            return new Named(k, new InMemoryHistory(maxEntries), maxEntries, LocalDateTime.now());
        });
        calculator.setHistory(target.history());
        log.info("Calculator now records into history '{}'", key);
        return describe(target, true);
    }

    public List<HistoryLog> findAll() {
        History bound = calculator.getHistory();
        return store.values().stream()
                .sorted(Comparator.comparing(Named::name))
                .map(n -> describe(n, n.history() == bound))
                .toList();
    }

    /** Like {@link #findByName} but rejects unknown names. */
    public History require(String name) {
        return findByName(name)
                .orElseThrow(() -> new IllegalArgumentException("History not found: " + name.trim()));
    }

    private static HistoryLog describe(Named n, boolean active) {
        return new HistoryLog(n.name(), n.history().size(), n.capacity(), n.createdAt(), active);
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("History name must not be blank");
        }
        return name.trim();
    }
}
