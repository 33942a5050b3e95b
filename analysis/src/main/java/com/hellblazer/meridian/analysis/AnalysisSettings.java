/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Meridian.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.meridian.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.meridian.analysis.assembly.AssemblyConfig;
import com.hellblazer.meridian.analysis.dbscan.ClusteringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Engine defaults, loaded from JSON.
 * <p>
 * Recognized keys: {@code separation_time} (seconds, or an ISO-8601 duration such as {@code "PT30M"}),
 * {@code separation_distance} (a number, or {@code null} / {@code "unlimited"}), {@code minimum_trajectory_length},
 * {@code cleanup_interval}, {@code search_box_half_span} (array of numbers), {@code minimum_cluster_size},
 * {@code depth} and {@code sampling_mode} ({@code "by_distance"} or {@code "by_time"}). Missing keys keep their
 * defaults.
 *
 * @author hal.hildebrand
 */
public record AnalysisSettings(Duration separationTime, double separationDistance, int minimumTrajectoryLength,
                               int cleanupInterval, List<Double> searchBoxHalfSpan, int minimumClusterSize, int depth,
                               SamplingMode samplingMode) {

    public static final String DEFAULT_RESOURCE = "/meridian-analysis.json";

    private static final Logger       log          = LoggerFactory.getLogger(AnalysisSettings.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public AnalysisSettings {
        Objects.requireNonNull(separationTime, "Separation time cannot be null");
        Objects.requireNonNull(samplingMode, "Sampling mode cannot be null");
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1: " + depth);
        }
        searchBoxHalfSpan = Collections.unmodifiableList(new ArrayList<>(searchBoxHalfSpan));
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(Duration.ofMinutes(30), Double.POSITIVE_INFINITY, 2, 10_000, List.of(), 10, 4,
                                    SamplingMode.BY_DISTANCE);
    }

    /**
     * Load settings from the {@value #DEFAULT_RESOURCE} classpath resource, or the defaults when there is none
     */
    public static AnalysisSettings load() {
        try (var is = AnalysisSettings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return defaults();
            }
            return load(is, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new SettingsException("Unable to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static AnalysisSettings load(InputStream is) {
        return load(is, "stream");
    }

    public static AnalysisSettings load(Path path) {
        try (var is = Files.newInputStream(path)) {
            return load(is, path.toString());
        } catch (IOException e) {
            throw new SettingsException("Unable to read " + path, e);
        }
    }

    private static AnalysisSettings load(InputStream is, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(is);
        } catch (IOException e) {
            throw new SettingsException("Malformed analysis settings in " + source, e);
        }
        if (root == null || !root.isObject()) {
            throw new SettingsException("Analysis settings in " + source + " must be a JSON object");
        }
        try {
            var settings = parse(root);
            settings.assemblyConfig();
            settings.clusteringConfig();
            log.info("Loaded analysis settings from {}: {}", source, settings);
            return settings;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new SettingsException("Invalid analysis settings in " + source + ": " + e.getMessage(), e);
        }
    }

    private static int intOr(JsonNode root, String key, int fallback) {
        var node = root.get(key);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IllegalArgumentException(key + " must be an integer: " + node);
        }
        return node.asInt();
    }

    private static AnalysisSettings parse(JsonNode root) {
        var defaults = defaults();
        var mode = parseSamplingMode(root.get("sampling_mode"), defaults.samplingMode());
        return new AnalysisSettings(parseSeparationTime(root.get("separation_time"), defaults.separationTime()),
                                    parseSeparationDistance(root.get("separation_distance"),
                                                            defaults.separationDistance()),
                                    intOr(root, "minimum_trajectory_length", defaults.minimumTrajectoryLength()),
                                    intOr(root, "cleanup_interval", defaults.cleanupInterval()),
                                    parseHalfSpan(root.get("search_box_half_span")),
                                    intOr(root, "minimum_cluster_size", defaults.minimumClusterSize()),
                                    intOr(root, "depth", defaults.depth()), mode);
    }

    private static List<Double> parseHalfSpan(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("search_box_half_span must be an array of numbers");
        }
        var span = new ArrayList<Double>();
        for (var element : node) {
            if (!element.isNumber()) {
                throw new IllegalArgumentException("search_box_half_span must be an array of numbers: " + node);
            }
            span.add(element.asDouble());
        }
        return span;
    }

    private static SamplingMode parseSamplingMode(JsonNode node, SamplingMode fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        return SamplingMode.valueOf(node.asText().toUpperCase(Locale.ROOT));
    }

    private static double parseSeparationDistance(JsonNode node, double fallback) {
        if (node == null) {
            return fallback;
        }
        if (node.isNull() || "unlimited".equalsIgnoreCase(node.asText())) {
            return Double.POSITIVE_INFINITY;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException("separation_distance must be a number: " + node);
        }
        return node.asDouble();
    }

    private static Duration parseSeparationTime(JsonNode node, Duration fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return Duration.ofNanos(Math.round(node.asDouble() * 1e9));
        }
        return Duration.parse(node.asText());
    }

    /**
     * A fresh assembly configuration holding these settings
     */
    public AssemblyConfig assemblyConfig() {
        return new AssemblyConfig().withSeparationTime(separationTime)
                                   .withSeparationDistance(separationDistance)
                                   .withMinimumTrajectoryLength(minimumTrajectoryLength)
                                   .withCleanupInterval(cleanupInterval);
    }

    /**
     * A fresh clustering configuration holding these settings. The half-span is left unset when the settings have
     * none.
     */
    public ClusteringConfig clusteringConfig() {
        var config = new ClusteringConfig().withMinimumClusterSize(minimumClusterSize);
        if (!searchBoxHalfSpan.isEmpty()) {
            config.withHalfSpan(searchBoxHalfSpan.stream().mapToDouble(Double::doubleValue).toArray());
        }
        return config;
    }
}
