package org.Aayush.slicecache.slice;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a persisted parameter record cannot be read at all.
 */
@Getter
@Accessors(fluent = true)
public final class SliceRecordException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded record failure.
     */
    public SliceRecordException(String reasonCode, String message) {
        super("[" + reasonCode + "] " + message);
        this.reasonCode = reasonCode;
    }

    /**
     * Creates a reason-coded record failure with a cause.
     */
    public SliceRecordException(String reasonCode, String message, Throwable cause) {
        super("[" + reasonCode + "] " + message, cause);
        this.reasonCode = reasonCode;
    }
}
