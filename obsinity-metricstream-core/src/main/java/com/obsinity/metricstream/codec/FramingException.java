package com.obsinity.metricstream.codec;

/** Raised when a length-delimited stream cannot be split into whole frames. */
public class FramingException extends MetricStreamException {

    private final int offset;

    public FramingException(String message, int offset) {
        super(message + " (offset=" + offset + ")");
        this.offset = offset;
    }

    public FramingException(String message, int offset, Throwable cause) {
        super(message + " (offset=" + offset + ")", cause);
        this.offset = offset;
    }

    /** Byte offset of the frame that could not be read. */
    public int getOffset() {
        return offset;
    }
}
