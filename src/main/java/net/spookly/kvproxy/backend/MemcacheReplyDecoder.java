package net.spookly.kvproxy.backend;

import java.nio.charset.StandardCharsets;
import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.util.ByteProcessor;

/**
 * Decodes memcached text protocol replies for single-key {@code get} and {@code set}.
 * <p>
 * A value reply is emitted only once its header, data block and trailing {@code END} line
 * are all buffered.
 */
final class MemcacheReplyDecoder extends ByteToMessageDecoder {
    static final int MAX_LINE_LENGTH = 1024;
    static final int MAX_VALUE_LENGTH = 64 * 1024 * 1024;
    private static final String END_LINE = "END\r\n";

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int lineEnd = findLineEnd(in);
        if (lineEnd < 0) {
            if (in.readableBytes() > MAX_LINE_LENGTH) {
                throw new TooLongFrameException("reply line exceeds " + MAX_LINE_LENGTH + " bytes");
            }
            return;
        }
        int start = in.readerIndex();
        int lineLength = lineEnd - start;
        String line = in.toString(start, lineLength, StandardCharsets.UTF_8);
        if (line.startsWith("VALUE ")) {
            decodeValue(in, line, lineLength, out);
            return;
        }
        in.skipBytes(lineLength + 2);
        out.add(decodeStatus(line));
    }

    private void decodeValue(ByteBuf in, String line, int lineLength, List<Object> out) {
        String[] parts = line.split(" ");
        if (parts.length < 4) {
            throw new CorruptedFrameException("malformed value header: " + line);
        }
        int flags;
        int length;
        try {
            flags = (int) Long.parseLong(parts[2]);
            length = Integer.parseInt(parts[3]);
        } catch (NumberFormatException e) {
            throw new CorruptedFrameException("malformed value header: " + line, e);
        }
        if (length < 0 || length > MAX_VALUE_LENGTH) {
            throw new TooLongFrameException("value length out of range: " + length);
        }
        long needed = (long) lineLength + 2 + length + 2 + END_LINE.length();
        if (in.readableBytes() < needed) {
            return;
        }
        in.skipBytes(lineLength + 2);
        byte[] data = new byte[length];
        in.readBytes(data);
        if (in.readByte() != '\r' || in.readByte() != '\n') {
            throw new CorruptedFrameException("value block not terminated by CRLF");
        }
        String trailer = in.readCharSequence(END_LINE.length(), StandardCharsets.US_ASCII).toString();
        if (!END_LINE.equals(trailer)) {
            throw new CorruptedFrameException("value reply not followed by END");
        }
        out.add(MemcacheReply.value(flags, data));
    }

    private static MemcacheReply decodeStatus(String line) {
        switch (line) {
            case "END":
                return MemcacheReply.miss();
            case "STORED":
                return MemcacheReply.stored();
            case "NOT_STORED":
            case "EXISTS":
            case "NOT_FOUND":
                return MemcacheReply.notStored();
            case "ERROR":
                return MemcacheReply.error(line);
            default:
                if (line.startsWith("CLIENT_ERROR") || line.startsWith("SERVER_ERROR")) {
                    return MemcacheReply.error(line);
                }
                throw new CorruptedFrameException("unexpected reply: " + line);
        }
    }

    /**
     * Index of the CR that ends the first line, or -1 when no full line is buffered.
     */
    private static int findLineEnd(ByteBuf in) {
        int limit = Math.min(in.readableBytes(), MAX_LINE_LENGTH + 2);
        int lf = in.forEachByte(in.readerIndex(), limit, ByteProcessor.FIND_LF);
        if (lf < 0) {
            return -1;
        }
        if (lf == in.readerIndex() || in.getByte(lf - 1) != '\r') {
            throw new CorruptedFrameException("reply line not terminated by CRLF");
        }
        return lf - 1;
    }
}
