package com.estimationplatform.common.exception;

/**
 * Raised while wiring the engine when a static table is unusable
 * (phase ratios not summing to 1.0, a complexity tier without hours).
 * Thrown during bean construction so the process never starts half-configured.
 */
public class EstimationConfigurationException extends RuntimeException {
    private final String setting;

    public EstimationConfigurationException(String setting, String message) {
        super("[" + setting + "] " + message);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
