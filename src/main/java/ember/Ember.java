package ember;

import ember.db.Keyspace;
import ember.network.ClientHandler;
import ember.persistence.DurabilityManager;
import ember.protocol.netty.ReplyEncoder;
import ember.protocol.netty.RequestFrameDecoder;
import ember.server.CommandEngine;
import ember.utils.Log;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

public class Ember {
    private static final Log log = Log.named("server");

    public static void main(String[] args) throws Exception {
        Config config = Config.load(args.length > 0 ? args[0] : "ember.yaml");

        CommandEngine engine = new CommandEngine(new Keyspace());
        DurabilityManager durability = new DurabilityManager(config, engine);
        durability.start();

        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new RequestFrameDecoder());
                     ch.pipeline().addLast(new ReplyEncoder());
                     ch.pipeline().addLast(new ClientHandler(engine));
                 }
             });

            ChannelFuture f = b.bind(config.host, config.port).sync();
            log.info("Ready on " + config.host + ":" + config.port + " (persistence: " + durability.getMode() + ")");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down...");
                durability.close();
                bossGroup.shutdownGracefully();
                workerGroup.shutdownGracefully();
            }, "ember-shutdown"));

            f.channel().closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }
}
