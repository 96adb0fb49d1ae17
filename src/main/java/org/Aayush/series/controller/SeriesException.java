package org.Aayush.series.controller;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Failure of one series call: describe, select, fetch or a metafile read.
 *
 * <p>A failure never poisons the controller. A failed describe leaves it idle with an empty
 * visible slot, and a failed select or fetch leaves the last description usable. Callers
 * branch on {@link #reasonCode()} (one of the {@code REASON_*} constants on
 * {@link SeriesController}); the message repeats the code as a {@code [CODE]} prefix so it
 * survives plain log output. Failures raised by the reader itself arrive as
 * {@code FS_READER_FAILURE} with the reader's exception as the cause.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SeriesException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded series failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public SeriesException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded series failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public SeriesException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
