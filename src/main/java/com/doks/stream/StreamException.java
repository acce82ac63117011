package com.doks.stream;

import java.io.IOException;

public class StreamException extends RuntimeException {
    public StreamException(Throwable cause) {
        super(cause == null ? "stream failed" : cause.getMessage(), cause);
    }

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public IOException asIOException(String context) {
        Throwable cause = getCause() == null ? this : getCause();
        return new IOException(context + ": " + cause.getMessage(), cause);
    }
}
