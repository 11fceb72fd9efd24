package com.estimationplatform.common.model;

/**
 * Which tier of the fuzzy matcher resolved a feature name.
 * Declared in priority order; {@link #NONE} means no calibration record was found.
 */
public enum MatchKind {
    EXACT,
    CONTAINS,
    TOKEN_OVERLAP,
    NONE
}
