package io.zipstream.writer;

import lombok.Getter;

import java.io.IOException;

/**
 * Failure of a {@link ZipArchiveWriter} operation.
 * <p>
 * After an {@link Kind#IO_ERROR} the bytes already handed to the sink form a truncated archive
 * and should be discarded.
 */
@Getter
public class ZipArchiveException extends IOException {

    public enum Kind {
        /** The sink rejected a write. */
        IO_ERROR,
        /** A name length, size, offset or entry count does not fit its fixed-width field. */
        SIZE_LIMIT_EXCEEDED,
        /** The writer is busy with another operation or already closed. */
        INVALID_STATE
    }

    private final Kind kind;

    public ZipArchiveException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ZipArchiveException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    static ZipArchiveException sizeLimit(String message) {
        return new ZipArchiveException(Kind.SIZE_LIMIT_EXCEEDED, message);
    }

    static ZipArchiveException invalidState(String message) {
        return new ZipArchiveException(Kind.INVALID_STATE, message);
    }
}
