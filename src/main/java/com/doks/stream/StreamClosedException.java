package com.doks.stream;

public class StreamClosedException extends Exception {
    public StreamClosedException() {
        super("stream closed by its consumer");
    }
}
