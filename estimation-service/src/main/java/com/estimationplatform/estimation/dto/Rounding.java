package com.estimationplatform.estimation.dto;

/** Display rounding for response payloads; the engine itself never rounds except final hours. */
final class Rounding {

    private Rounding() {}

    static double oneDecimal(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    static double threeDecimals(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
