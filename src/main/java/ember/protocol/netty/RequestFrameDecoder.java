package ember.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Cuts the inbound byte stream into one request frame per client message.
 *
 * <p>A frame is emitted as the raw request text, so the command codec sees exactly what the
 * client sent. Declared element counts and bulk lengths are used only to find where a frame
 * ends. Fragmented frames are held back until complete and pipelined frames are split.
 * A header that cannot be framed is emitted on its own line instead of closing the channel.
 */
public class RequestFrameDecoder extends ByteToMessageDecoder {

    private static final int INCOMPLETE = -1;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        while (in.isReadable()) {
            int frameEnd = scanFrame(in);
            if (frameEnd == INCOMPLETE) return; // Wait for more data

            int length = frameEnd - in.readerIndex();
            out.add(in.toString(in.readerIndex(), length, StandardCharsets.UTF_8));
            in.readerIndex(frameEnd);
        }
    }

    /**
     * Returns the index just past the first complete frame, or {@link #INCOMPLETE}.
     * Nothing is consumed here.
     */
    private int scanFrame(ByteBuf in) {
        int idx = in.readerIndex();
        int eol = findEndOfLine(in, idx);
        if (eol == INCOMPLETE) return INCOMPLETE;

        String header = in.toString(idx, eol - idx, StandardCharsets.UTF_8);
        int afterHeader = eol + 2;
        if (header.isEmpty() || header.charAt(0) != '*') {
            return afterHeader;
        }

        int count;
        try {
            count = Integer.parseInt(header.substring(1).trim());
        } catch (NumberFormatException e) {
            return afterHeader;
        }

        idx = afterHeader;
        for (int i = 0; i < count; i++) {
            eol = findEndOfLine(in, idx);
            if (eol == INCOMPLETE) return INCOMPLETE;

            String line = in.toString(idx, eol - idx, StandardCharsets.UTF_8);
            idx = eol + 2;
            if (line.isEmpty() || line.charAt(0) != '$') {
                continue; // Bare token, counts as one element
            }

            int bulkLength;
            try {
                bulkLength = Integer.parseInt(line.substring(1).trim());
            } catch (NumberFormatException e) {
                return idx;
            }
            if (bulkLength < 0) continue; // Null bulk has no payload

            long payloadEnd = (long) idx + bulkLength + 2;
            if (payloadEnd > in.writerIndex()) return INCOMPLETE;
            idx = (int) payloadEnd;
        }
        return idx;
    }

    private int findEndOfLine(ByteBuf in, int from) {
        int n = in.writerIndex();
        for (int i = from; i < n - 1; i++) {
            if (in.getByte(i) == '\r' && in.getByte(i + 1) == '\n') {
                return i;
            }
        }
        return INCOMPLETE;
    }
}
