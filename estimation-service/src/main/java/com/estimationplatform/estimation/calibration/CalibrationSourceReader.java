package com.estimationplatform.estimation.calibration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns one calibration file into header-plus-rows tables.
 *
 * <p>Implementations skip what they cannot read at sheet level and report it in the
 * {@link SourceReadResult}; an {@link IOException} means the file as a whole could not be
 * opened.
 */
public interface CalibrationSourceReader {

    /** True when this reader handles the file (decided by extension). */
    boolean supports(Path file);

    SourceReadResult read(Path file) throws IOException;
}
