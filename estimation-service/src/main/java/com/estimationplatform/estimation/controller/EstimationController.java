package com.estimationplatform.estimation.controller;

import com.estimationplatform.common.trace.TraceContextUtil;
import com.estimationplatform.estimation.dto.EstimateRequestDTO;
import com.estimationplatform.estimation.dto.EstimateResponseDTO;
import com.estimationplatform.estimation.logger.EstimationFlowLogger;
import com.estimationplatform.estimation.service.EstimationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/estimation")
public class EstimationController {

    private final EstimationService estimationService;
    private final EstimationFlowLogger flowLogger;

    public EstimationController(EstimationService estimationService, EstimationFlowLogger flowLogger) {
        this.estimationService = estimationService;
        this.flowLogger        = flowLogger;
    }

    @PostMapping
    public Mono<ResponseEntity<EstimateResponseDTO>> estimate(
            @RequestBody EstimateRequestDTO request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        flowLogger.logWithTraceId(EstimationFlowLogger.REQUEST_RECEIVED, traceId);
        return estimationService.estimate(request, traceId)
            .map(body -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(body));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
