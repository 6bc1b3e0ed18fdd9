package ember.protocol.netty;

import ember.protocol.Resp;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RequestFrameDecoderTest {

    private static void write(EmbeddedChannel channel, String data) {
        channel.writeInbound(Unpooled.wrappedBuffer(data.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testFragmentedCommand() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestFrameDecoder());

        write(channel, "*3\r\n$3\r\nSE");
        assertNull(channel.readInbound());

        write(channel, "T\r\n$3\r\nkey\r\n$3\r");
        assertNull(channel.readInbound());

        write(channel, "\nval\r\n");
        assertEquals("*3\r\n$3\r\nSET\r\n$3\r\nkey\r\n$3\r\nval\r\n", channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    public void testPipelinedCommands() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestFrameDecoder());
        String first = Resp.request("SET", "a", "1");
        String second = Resp.request("GET", "a");

        write(channel, first + second);

        assertEquals(first, channel.readInbound());
        assertEquals(second, channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    public void testPayloadContainingCrlf() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestFrameDecoder());
        String frame = "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$4\r\na\r\nb\r\n";

        write(channel, frame.substring(0, frame.length() - 3));
        assertNull(channel.readInbound());
        write(channel, frame.substring(frame.length() - 3));
        assertEquals(frame, channel.readInbound());
    }

    @Test
    public void testMultiByteCharacters() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestFrameDecoder());
        String frame = Resp.request("SET", "k", "héllo");

        write(channel, frame);
        assertEquals(frame, channel.readInbound());
    }

    @Test
    public void testInlineLineIsEmittedOnItsOwn() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestFrameDecoder());

        write(channel, "PING\r\n");
        assertEquals("PING\r\n", channel.readInbound());
        assertTrue(channel.isActive());
    }

    @Test
    public void testBadCountIsEmittedOnItsOwn() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestFrameDecoder());

        write(channel, "*x\r\n" + Resp.request("GET", "k"));
        assertEquals("*x\r\n", channel.readInbound());
        assertEquals(Resp.request("GET", "k"), channel.readInbound());
    }

    @Test
    public void testIncompleteHeaderWaits() {
        EmbeddedChannel channel = new EmbeddedChannel(new RequestFrameDecoder());

        write(channel, "*2");
        assertNull(channel.readInbound());
        write(channel, "\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertEquals("*2\r\n$3\r\nGET\r\n$1\r\nk\r\n", channel.readInbound());
    }
}
