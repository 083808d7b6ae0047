package com.obsinity.metricstream.codec;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits and joins varint32 length-delimited streams, the framing Firehose uses for
 * CloudWatch Metric Stream OTLP payloads.
 *
 * <p>Each frame is a base-128 varint holding the payload length followed by exactly that many
 * bytes. A buffer is only accepted when its frames consume it completely.
 */
public final class FrameCodec {

    private static final int MAX_PREFIX_BYTES = 5;

    private FrameCodec() {}

    public static List<ByteString> decodeStream(byte[] buffer) {
        if (buffer == null || buffer.length == 0) {
            return List.of();
        }
        CodedInputStream input = CodedInputStream.newInstance(buffer);
        List<ByteString> frames = new ArrayList<>();
        while (true) {
            int frameStart = input.getTotalBytesRead();
            if (frameStart == buffer.length) {
                return frames;
            }
            long declared;
            try {
                declared = input.readRawVarint64();
            } catch (IOException ex) {
                throw new FramingException("Truncated or malformed length prefix", frameStart, ex);
            }
            int prefixBytes = input.getTotalBytesRead() - frameStart;
            if (prefixBytes > MAX_PREFIX_BYTES || declared < 0 || declared > Integer.MAX_VALUE) {
                throw new FramingException(
                        "Length prefix is not a varint32 (" + prefixBytes + " bytes, value "
                                + Long.toUnsignedString(declared) + ")",
                        frameStart);
            }
            int length = (int) declared;
            int remaining = buffer.length - input.getTotalBytesRead();
            if (length > remaining) {
                throw new FramingException(
                        "Declared frame length " + length + " exceeds remaining " + remaining + " bytes", frameStart);
            }
            try {
                frames.add(ByteString.copyFrom(input.readRawBytes(length)));
            } catch (IOException ex) {
                throw new FramingException("Frame body ended unexpectedly", frameStart, ex);
            }
        }
    }

    public static byte[] encodeStream(List<ByteString> messages) {
        int size = 0;
        for (ByteString message : messages) {
            size += CodedOutputStream.computeUInt32SizeNoTag(message.size()) + message.size();
        }
        byte[] out = new byte[size];
        CodedOutputStream output = CodedOutputStream.newInstance(out);
        try {
            for (ByteString message : messages) {
                output.writeUInt32NoTag(message.size());
                output.writeRawBytes(message);
            }
            output.flush();
            output.checkNoSpaceLeft();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write length-delimited stream", ex);
        }
        return out;
    }
}
