package com.estimationplatform.estimation.logger;

import com.estimationplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for one estimation request. Pure side effects; never alters the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}  : request body decoded</li>
 *   <li>{@link #FEATURES_VALIDATED}: feature list converted to engine input</li>
 *   <li>{@link #ESTIMATE_COMPUTED} : matcher, calculator, scorer and planner finished</li>
 *   <li>{@link #RESPONSE_READY}    : response payload assembled</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(EstimationFlowLogger.ESTIMATE_COMPUTED))
 * </pre>
 */
@Component
public class EstimationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(EstimationFlowLogger.class);

    public static final String REQUEST_RECEIVED   = "REQUEST_RECEIVED";
    public static final String FEATURES_VALIDATED = "FEATURES_VALIDATED";
    public static final String ESTIMATE_COMPUTED  = "ESTIMATE_COMPUTED";
    public static final String RESPONSE_READY     = "RESPONSE_READY";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only,
     * reading the trace id from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[EstimationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** Logs a stage when the trace id is already at hand. */
    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[EstimationFlow] stage={} traceId={}", stageName, traceId)
        );
    }
}
