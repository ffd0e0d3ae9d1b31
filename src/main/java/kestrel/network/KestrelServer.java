package kestrel.network;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import kestrel.Config;
import kestrel.commands.CommandRegistry;
import kestrel.protocol.netty.ReadChunkDecoder;
import kestrel.protocol.netty.ReplyEncoder;
import kestrel.protocol.netty.RespFrameDecoder;
import kestrel.utils.Log;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the listening socket and every accepted connection.
 * <p>
 * Each connection is bound to one event-loop thread for its whole life, so requests from
 * one client are handled strictly in order while clients proceed independently. Shutdown
 * stops accepting, closes every open connection (interrupting reads that are in flight)
 * and waits for the event loops to finish before returning.
 */
public class KestrelServer {
    private final Config config;
    private final CommandRegistry registry;
    private final ReplyEncoder replyEncoder = new ReplyEncoder();

    private final ChannelGroup connections = new DefaultChannelGroup("kestrel-clients", GlobalEventExecutor.INSTANCE);
    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private final AtomicBoolean running = new AtomicBoolean(false);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public KestrelServer(Config config, CommandRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    /**
     * Binds the configured port and starts accepting. Returns once the socket is listening.
     */
    public void start() throws InterruptedException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        boolean bound = false;
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .option(ChannelOption.SO_BACKLOG, config.backlog)
             .option(ChannelOption.SO_REUSEADDR, true)
             .handler(new AcceptErrorLogger())
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(config.readBufferSize))
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     connections.add(ch);
                     if (config.isStreamFraming()) {
                         ch.pipeline().addLast(new RespFrameDecoder());
                     } else {
                         ch.pipeline().addLast(new ReadChunkDecoder());
                     }
                     ch.pipeline().addLast(replyEncoder);
                     ch.pipeline().addLast(new ClientHandler(registry, activeConnections));
                 }
             });

            serverChannel = b.bind(config.port).sync().channel();
            bound = true;
        } finally {
            if (!bound) {
                running.set(false);
                releaseEventLoops();
            }
        }
        Log.info("Ready on port " + getPort() + " (framing: " + config.framing + ")");
    }

    public int getPort() {
        if (serverChannel == null) return -1;
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    /** Blocks until the listening socket is closed. */
    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;

        Log.info("Shutting down: no longer accepting connections");
        serverChannel.close().syncUninterruptibly();

        int open = connections.size();
        if (open > 0) {
            Log.info("Closing " + open + " open connection(s)");
        }
        connections.close().awaitUninterruptibly();

        releaseEventLoops();
        Log.info("Server stopped");
    }

    private void releaseEventLoops() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    // A failed accept is logged; the listening socket stays open.
    private static class AcceptErrorLogger extends ChannelInboundHandlerAdapter {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            Log.error("Failed to accept client connection: " + cause.getMessage());
            ctx.fireExceptionCaught(cause);
        }
    }
}
