package com.estimationplatform.estimation.controller;

import com.estimationplatform.estimation.dto.CalibrationDiagnosticsDTO;
import com.estimationplatform.estimation.dto.CalibrationLookupDTO;
import com.estimationplatform.estimation.dto.CalibrationRecordDTO;
import com.estimationplatform.estimation.service.EstimationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/calibration")
public class CalibrationController {

    private static final Logger log = LoggerFactory.getLogger(CalibrationController.class);

    private final EstimationService estimationService;

    public CalibrationController(EstimationService estimationService) {
        this.estimationService = estimationService;
    }

    @PostMapping("/reload")
    public Mono<ResponseEntity<CalibrationDiagnosticsDTO>> reload() {
        log.info("Calibration reload requested");
        return estimationService.reload()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Calibration reload failed", e));
    }

    @GetMapping("/diagnostics")
    public ResponseEntity<CalibrationDiagnosticsDTO> diagnostics() {
        return ResponseEntity.ok(estimationService.diagnostics());
    }

    @GetMapping("/summary")
    public ResponseEntity<List<CalibrationRecordDTO>> summary() {
        return ResponseEntity.ok(estimationService.summary());
    }

    @GetMapping("/lookup")
    public ResponseEntity<CalibrationLookupDTO> lookup(@RequestParam String feature) {
        log.info("Calibration lookup received. feature={}", feature);
        return ResponseEntity.ok(estimationService.lookup(feature));
    }
}
