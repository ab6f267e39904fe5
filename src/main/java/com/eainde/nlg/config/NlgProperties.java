package com.eainde.nlg.config;

import com.eainde.nlg.planner.PlannerStrategies;
import com.eainde.nlg.realize.surface.SurfaceFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under the {@code nlg} prefix.
 */
@Data
@ConfigurationProperties(prefix = "nlg")
public class NlgProperties {

    /** Seed of every run. When unset a random seed is drawn once at startup. */
    private Long seed;

    /** Date the data snapshot is considered current at. When unset, today. */
    private LocalDate referenceDate;

    private SurfaceFormat surfaceFormat = SurfaceFormat.BODY;

    /** Dataset name to resource location, e.g. {@code cphi: classpath:data/cphi.json}. */
    private Map<String, String> datasets = new LinkedHashMap<>();

    private Planner planner = new Planner();

    private Bulk bulk = new Bulk();

    @Data
    public static class Planner {
        private String variant = PlannerStrategies.FULL;
        private int maxParagraphs = 3;
        private int maxSatellites = 5;
        private int minSatellites = 2;
        private double newParagraphAbsoluteThreshold = 0.5;
        private double satelliteRelativeThreshold = 0.5;
        private double satelliteAbsoluteThreshold = 0.2;
        private double nucleusWeight = 1.0;
        private double laterParagraphFactor = 0.3;
        private int overviewTopicCount = 2;
    }

    @Data
    public static class Bulk {
        private int threads = 4;
        private String outputDirectory = "out";
    }
}
