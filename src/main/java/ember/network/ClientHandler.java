package ember.network;

import ember.protocol.Resp;
import ember.server.CommandEngine;
import ember.utils.Log;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

/**
 * One per connection. Hands each decoded request frame to the engine and writes the reply
 * back before the next frame on this channel is read.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private static final Log log = Log.named("server");

    private final CommandEngine engine;

    public ClientHandler(CommandEngine engine) {
        this.engine = engine;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Client connected: " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Client disconnected: " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof String)) {
            ReferenceCountUtil.release(msg);
            return;
        }

        String reply;
        try {
            reply = engine.handle((String) msg);
        } catch (RuntimeException e) {
            log.error("Unhandled error for " + ctx.channel().remoteAddress(), e);
            reply = Resp.error("ERR");
        }
        ctx.writeAndFlush(reply);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Connection error from " + ctx.channel().remoteAddress() + ": " + cause.getMessage());
        ctx.close();
    }
}
