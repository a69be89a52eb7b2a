package gateway.protocol.netty;

import gateway.utils.Log;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Netty decoder for RESP replies coming back from the broker.
 * <p>
 * Emits {@code String} for simple strings, {@link RespError} for errors, {@code Long} for integers,
 * {@code byte[]} for bulk strings, {@link #NIL} for a null bulk string or array, and {@code List<Object>}
 * for arrays (elements of the same types, {@code null} for a null bulk). Nested arrays are not part of
 * the pub/sub replies and close the channel.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    public static final Object NIL = new Object() {
        @Override
        public String toString() {
            return "(nil)";
        }
    };

    private enum State {
        READ_TYPE,
        READ_LINE,
        READ_BULK_LENGTH,
        READ_BULK_CONTENT
    }

    private State state = State.READ_TYPE;
    private char lineType;

    // Multi-bulk parsing state
    private int multiBulkLength = 0;
    private List<Object> currentArray = null;

    // Bulk string parsing state
    private int currentBulkLength = 0;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        while (true) {
            if (state == State.READ_TYPE) {
                if (!in.isReadable()) return;

                byte type = in.readByte();
                if (type == '$') {
                    state = State.READ_BULK_LENGTH;
                } else if (type == '*' || type == '+' || type == '-' || type == ':') {
                    if (type == '*' && currentArray != null) {
                        fail(ctx, in, "nested arrays are not supported");
                        return;
                    }
                    lineType = (char) type;
                    state = State.READ_LINE;
                } else {
                    fail(ctx, in, "unexpected type byte '" + (char) type + "'");
                    return;
                }
            }

            if (state == State.READ_LINE) {
                int eol = findEndOfLine(in);
                if (eol == -1) return; // Wait for more data

                String line = readLine(in, eol);

                if (lineType == '*') {
                    int count;
                    try {
                        count = Integer.parseInt(line);
                    } catch (NumberFormatException e) {
                        fail(ctx, in, "bad array length '" + line + "'");
                        return;
                    }
                    if (count < 0) {
                        emit(NIL, out);
                    } else if (count == 0) {
                        emit(Collections.emptyList(), out);
                    } else {
                        multiBulkLength = count;
                        currentArray = new ArrayList<>(count);
                        state = State.READ_TYPE;
                    }
                } else if (lineType == '+') {
                    emit(line, out);
                } else if (lineType == '-') {
                    emit(new RespError(line), out);
                } else {
                    try {
                        emit(Long.parseLong(line), out);
                    } catch (NumberFormatException e) {
                        fail(ctx, in, "bad integer '" + line + "'");
                        return;
                    }
                }
            }

            if (state == State.READ_BULK_LENGTH) {
                int eol = findEndOfLine(in);
                if (eol == -1) return;

                String line = readLine(in, eol);
                try {
                    currentBulkLength = Integer.parseInt(line);
                } catch (NumberFormatException e) {
                    fail(ctx, in, "bad bulk length '" + line + "'");
                    return;
                }
                if (currentBulkLength < 0) {
                    emit(null, out);
                } else {
                    state = State.READ_BULK_CONTENT;
                }
            }

            if (state == State.READ_BULK_CONTENT) {
                if (in.readableBytes() < currentBulkLength + 2) return; // Need content + CRLF

                byte[] content = new byte[currentBulkLength];
                in.readBytes(content);
                in.skipBytes(2);
                emit(content, out);
            }
        }
    }

    private void emit(Object value, List<Object> out) {
        state = State.READ_TYPE;
        if (currentArray == null) {
            out.add(value == null ? NIL : value);
            return;
        }
        currentArray.add(value);
        if (currentArray.size() == multiBulkLength) {
            out.add(currentArray);
            currentArray = null;
            multiBulkLength = 0;
        }
    }

    private void fail(ChannelHandlerContext ctx, ByteBuf in, String reason) {
        Log.error("Malformed RESP from broker: " + reason);
        in.skipBytes(in.readableBytes());
        ctx.close();
    }

    private static String readLine(ByteBuf in, int eol) {
        String line = in.toString(in.readerIndex(), eol - in.readerIndex(), StandardCharsets.UTF_8);
        in.readerIndex(eol + 2);
        return line;
    }

    private static int findEndOfLine(ByteBuf in) {
        int n = in.writerIndex() - 1;
        for (int i = in.readerIndex(); i < n; i++) {
            if (in.getByte(i) == '\r' && in.getByte(i + 1) == '\n') {
                return i;
            }
        }
        return -1;
    }
}
