/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshstats.api.model.StatsSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default reporter consumer: writes each report as one JSON log line.
 */
public class LoggingStatsSink implements Consumer<Map<String, StatsSnapshot>> {
    private static final Logger logger = Logger.getLogger(LoggingStatsSink.class.getName());

    private final ObjectMapper objectMapper;

    public LoggingStatsSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void accept(Map<String, StatsSnapshot> snapshots) {
        if (!logger.isLoggable(Level.INFO)) {
            return;
        }
        try {
            logger.info("stats " + objectMapper.writeValueAsString(toPlainMap(snapshots)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize stats report", e);
        }
    }

    /**
     * Plain nested map of {@code componentId -> snapshot map}, as served over HTTP.
     */
    public static Map<String, Object> toPlainMap(Map<String, StatsSnapshot> snapshots) {
        Map<String, Object> plain = new LinkedHashMap<>();
        snapshots.forEach((id, snapshot) -> plain.put(id, snapshot.toMap()));
        return plain;
    }
}
