package com.estimationplatform.estimation.config;

import com.estimationplatform.common.calibration.CalibrationSheetIngestor;
import com.estimationplatform.common.calibration.HeaderCandidates;
import com.estimationplatform.common.estimation.ComplexityTable;
import com.estimationplatform.common.estimation.ComplexityTable.TierHours;
import com.estimationplatform.common.estimation.EstimationCalculator;
import com.estimationplatform.common.estimation.EstimationEngine;
import com.estimationplatform.common.estimation.EstimationParameters;
import com.estimationplatform.common.matching.ContainsMatchStrategy;
import com.estimationplatform.common.matching.ExactMatchStrategy;
import com.estimationplatform.common.matching.FuzzyFeatureMatcher;
import com.estimationplatform.common.matching.TokenOverlapMatchStrategy;
import com.estimationplatform.common.model.ComplexityTier;
import com.estimationplatform.common.model.Phase;
import com.estimationplatform.common.planning.ResourcePlanner;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the pure engine from {@code estimation.*} properties.
 *
 * <p>Every table is validated while its bean is built; a bad ratio or a missing tier
 * raises {@link com.estimationplatform.common.exception.EstimationConfigurationException}
 * and the context fails to start.
 */
@Configuration
public class EstimationConfig {

    @Value("${estimation.buffer-multiplier:1.15}")
    private double bufferMultiplier;

    @Value("${estimation.range.low-ratio:0.85}")
    private double lowBoundRatio;

    @Value("${estimation.range.high-ratio:1.35}")
    private double highBoundRatio;

    @Value("${estimation.matching.token-overlap-threshold:0.60}")
    private double tokenOverlapThreshold;

    @Value("${estimation.complexity.low.base-hours:28}")
    private double lowBase;
    @Value("${estimation.complexity.low.floor-hours:16}")
    private double lowFloor;
    @Value("${estimation.complexity.medium.base-hours:72}")
    private double mediumBase;
    @Value("${estimation.complexity.medium.floor-hours:40}")
    private double mediumFloor;
    @Value("${estimation.complexity.high.base-hours:140}")
    private double highBase;
    @Value("${estimation.complexity.high.floor-hours:80}")
    private double highFloor;
    @Value("${estimation.complexity.very-high.base-hours:240}")
    private double veryHighBase;
    @Value("${estimation.complexity.very-high.floor-hours:140}")
    private double veryHighFloor;

    @Value("${estimation.phase-ratios.frontend:0.40}")
    private double frontendRatio;
    @Value("${estimation.phase-ratios.backend:0.35}")
    private double backendRatio;
    @Value("${estimation.phase-ratios.qa:0.15}")
    private double qaRatio;
    @Value("${estimation.phase-ratios.pm-ba:0.10}")
    private double pmBaRatio;

    @Value("${estimation.calibration.label-columns:name,module name,feature,module}")
    private String labelColumns;

    @Value("${estimation.calibration.hours-columns:total hours,total,hours}")
    private String hoursColumns;

    @Value("${estimation.calibration.component-columns:web mobile,backend,wireframe,visual design}")
    private String componentColumns;

    @Bean
    public ComplexityTable complexityTable() {
        Map<ComplexityTier, TierHours> table = new EnumMap<>(ComplexityTier.class);
        table.put(ComplexityTier.LOW,       new TierHours(lowBase, lowFloor));
        table.put(ComplexityTier.MEDIUM,    new TierHours(mediumBase, mediumFloor));
        table.put(ComplexityTier.HIGH,      new TierHours(highBase, highFloor));
        table.put(ComplexityTier.VERY_HIGH, new TierHours(veryHighBase, veryHighFloor));
        return new ComplexityTable(table);
    }

    @Bean
    public EstimationParameters estimationParameters() {
        return new EstimationParameters(bufferMultiplier, lowBoundRatio, highBoundRatio);
    }

    @Bean
    public FuzzyFeatureMatcher fuzzyFeatureMatcher() {
        return new FuzzyFeatureMatcher(List.of(
            new ExactMatchStrategy(),
            new ContainsMatchStrategy(),
            new TokenOverlapMatchStrategy(tokenOverlapThreshold)));
    }

    @Bean
    public EstimationCalculator estimationCalculator(ComplexityTable complexityTable,
                                                     FuzzyFeatureMatcher fuzzyFeatureMatcher,
                                                     EstimationParameters estimationParameters) {
        return new EstimationCalculator(complexityTable, fuzzyFeatureMatcher, estimationParameters);
    }

    @Bean
    public ResourcePlanner resourcePlanner() {
        Map<Phase, Double> ratios = new EnumMap<>(Phase.class);
        ratios.put(Phase.FRONTEND, frontendRatio);
        ratios.put(Phase.BACKEND,  backendRatio);
        ratios.put(Phase.QA,       qaRatio);
        ratios.put(Phase.PM_BA,    pmBaRatio);
        return new ResourcePlanner(ratios);
    }

    @Bean
    public EstimationEngine estimationEngine(EstimationCalculator estimationCalculator,
                                             ResourcePlanner resourcePlanner) {
        return new EstimationEngine(estimationCalculator, resourcePlanner);
    }

    @Bean
    public CalibrationSheetIngestor calibrationSheetIngestor() {
        return new CalibrationSheetIngestor(new HeaderCandidates(
            split(labelColumns), split(hoursColumns), split(componentColumns)));
    }

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }

    /** Primary, since {@link CsvMapper} is also an {@code ObjectMapper}. */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    private static List<String> split(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
