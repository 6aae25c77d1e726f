package net.spookly.kvproxy.backend;

import java.nio.charset.StandardCharsets;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Writes {@link MemcacheCommand}s in the memcached text protocol.
 */
final class MemcacheCommandEncoder extends MessageToByteEncoder<MemcacheCommand> {
    private static final byte[] CRLF = {'\r', '\n'};

    @Override
    protected void encode(ChannelHandlerContext ctx, MemcacheCommand command, ByteBuf out) {
        switch (command.type()) {
            case GET:
                out.writeCharSequence("get " + command.key(), StandardCharsets.UTF_8);
                out.writeBytes(CRLF);
                break;
            case SET:
                byte[] value = command.value();
                out.writeCharSequence("set " + command.key() + " 0 0 " + value.length, StandardCharsets.UTF_8);
                out.writeBytes(CRLF);
                out.writeBytes(value);
                out.writeBytes(CRLF);
                break;
            default:
                throw new IllegalArgumentException("unsupported command: " + command.type());
        }
    }
}
