package gateway.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.EncoderException;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Encodes broker commands into RESP. A command is a {@code List} of {@code String} or {@code byte[]}
 * arguments and goes out as an array of bulk strings; {@code byte[]} and {@code ByteBuf} are written as is.
 */
public class NettyRespEncoder extends MessageToByteEncoder<Object> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);

    @Override
    protected void encode(ChannelHandlerContext ctx, Object msg, ByteBuf out) throws Exception {
        if (msg instanceof List) {
            List<?> args = (List<?>) msg;
            writeHeader(out, '*', args.size());
            for (Object arg : args) {
                byte[] bytes;
                if (arg instanceof byte[]) {
                    bytes = (byte[]) arg;
                } else if (arg instanceof String) {
                    bytes = ((String) arg).getBytes(StandardCharsets.UTF_8);
                } else {
                    throw new EncoderException("Unsupported RESP argument type: " + (arg == null ? "null" : arg.getClass().getName()));
                }
                writeHeader(out, '$', bytes.length);
                out.writeBytes(bytes);
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof ByteBuf) {
            out.writeBytes((ByteBuf) msg);
        } else if (msg instanceof byte[]) {
            out.writeBytes((byte[]) msg);
        } else {
            throw new EncoderException("Unsupported RESP message type: " + msg.getClass().getName());
        }
    }

    private static void writeHeader(ByteBuf out, char type, int length) {
        out.writeByte(type);
        out.writeBytes(Integer.toString(length).getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }
}
