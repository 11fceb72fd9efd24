package com.estimationplatform.estimation.service;

import com.estimationplatform.common.calibration.CalibrationSnapshot;
import com.estimationplatform.common.calibration.FeatureNameNormalizer;
import com.estimationplatform.common.estimation.EstimationCommand;
import com.estimationplatform.common.estimation.EstimationEngine;
import com.estimationplatform.common.exception.EstimationValidationException;
import com.estimationplatform.common.matching.FuzzyFeatureMatcher;
import com.estimationplatform.common.model.ComplexityTier;
import com.estimationplatform.common.model.FeatureInput;
import com.estimationplatform.common.model.MatchResult;
import com.estimationplatform.common.trace.TraceContextUtil;
import com.estimationplatform.estimation.calibration.CalibrationSnapshotHolder;
import com.estimationplatform.estimation.dto.CalibrationDiagnosticsDTO;
import com.estimationplatform.estimation.dto.CalibrationLookupDTO;
import com.estimationplatform.estimation.dto.CalibrationRecordDTO;
import com.estimationplatform.estimation.dto.EstimateRequestDTO;
import com.estimationplatform.estimation.dto.EstimateResponseDTO;
import com.estimationplatform.estimation.dto.FeatureRequestDTO;
import com.estimationplatform.estimation.logger.EstimationFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Reactive façade over the pure {@link EstimationEngine}.
 *
 * <p>Each request reads the calibration snapshot once, so a reload that lands mid-request
 * cannot mix two stores into one estimate. The engine is CPU-bound and microsecond-scale,
 * so it runs inline on the calling thread.
 */
@Service
public class EstimationService {

    private static final Logger log = LoggerFactory.getLogger(EstimationService.class);

    private final EstimationEngine engine;
    private final FuzzyFeatureMatcher matcher;
    private final CalibrationSnapshotHolder snapshotHolder;
    private final EstimationFlowLogger flowLogger;

    public EstimationService(EstimationEngine engine,
                             FuzzyFeatureMatcher matcher,
                             CalibrationSnapshotHolder snapshotHolder,
                             EstimationFlowLogger flowLogger) {
        this.engine         = engine;
        this.matcher        = matcher;
        this.snapshotHolder = snapshotHolder;
        this.flowLogger     = flowLogger;
    }

    public Mono<EstimateResponseDTO> estimate(EstimateRequestDTO request, String traceId) {
        Mono<EstimateResponseDTO> pipeline = Mono.fromCallable(() -> toCommand(request))
            .doOnEach(flowLogger.stage(EstimationFlowLogger.FEATURES_VALIDATED))
            .map(command -> engine.estimate(command, snapshotHolder.current().store()))
            .doOnEach(flowLogger.stage(EstimationFlowLogger.ESTIMATE_COMPUTED))
            .map(outcome -> {
                log.info("Estimate computed. features={} totalHours={} confidence={} traceId={}",
                         outcome.estimate().features().size(), outcome.estimate().totalHours(),
                         outcome.estimate().confidence(), traceId);
                return EstimateResponseDTO.from(traceId, outcome);
            })
            .doOnEach(flowLogger.stage(EstimationFlowLogger.RESPONSE_READY))
            .doOnError(EstimationValidationException.class, e ->
                log.warn("Estimation request rejected. field={} reason={} traceId={}",
                         e.getField(), e.getMessage(), traceId));
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    public CalibrationLookupDTO lookup(String featureName) {
        MatchResult match = matcher.match(featureName, snapshotHolder.current().store());
        return CalibrationLookupDTO.from(featureName, FeatureNameNormalizer.normalize(featureName), match);
    }

    public List<CalibrationRecordDTO> summary() {
        return snapshotHolder.current().store().historicalSummary().stream()
            .map(CalibrationRecordDTO::from)
            .toList();
    }

    public CalibrationDiagnosticsDTO diagnostics() {
        return CalibrationDiagnosticsDTO.from(snapshotHolder.folder().toString(), snapshotHolder.current());
    }

    public Mono<CalibrationDiagnosticsDTO> reload() {
        return snapshotHolder.reloadAsync()
            .map(this::toDiagnostics);
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    private CalibrationDiagnosticsDTO toDiagnostics(CalibrationSnapshot snapshot) {
        return CalibrationDiagnosticsDTO.from(snapshotHolder.folder().toString(), snapshot);
    }

    static EstimationCommand toCommand(EstimateRequestDTO request) {
        if (request == null || request.features() == null) {
            throw new EstimationValidationException("features", "feature list is required");
        }
        List<FeatureInput> features = new ArrayList<>(request.features().size());
        for (int i = 0; i < request.features().size(); i++) {
            String field = "features[" + i + "]";
            FeatureRequestDTO dto = request.features().get(i);
            if (dto == null) {
                throw new EstimationValidationException(field, "feature is required");
            }
            ComplexityTier tier = ComplexityTier.parse(dto.complexityTier(), field + ".complexityTier");
            features.add(new FeatureInput(dto.name(), tier, dto.category()));
        }
        return new EstimationCommand(features, request.scopeFactor(), request.timelineWeeks());
    }
}
