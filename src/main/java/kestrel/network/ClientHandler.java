package kestrel.network;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import kestrel.commands.CommandException;
import kestrel.commands.CommandRegistry;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;
import kestrel.utils.Log;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the read-dispatch-reply cycle for one connection. Command usage errors are answered
 * with an error reply; anything else that goes wrong while handling a request closes this
 * connection and leaves every other connection alone.
 */
public class ClientHandler extends SimpleChannelInboundHandler<Request> {
    private final CommandRegistry registry;
    private final AtomicInteger activeConnections;

    public ClientHandler(CommandRegistry registry, AtomicInteger activeConnections) {
        this.registry = registry;
        this.activeConnections = activeConnections;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        activeConnections.incrementAndGet();
        Log.info("Client connected: " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        activeConnections.decrementAndGet();
        Log.info("Client disconnected: " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Request request) {
        if (Log.isDebugEnabled()) {
            Log.debug(ctx.channel().remoteAddress() + " > " + request);
        }

        Reply reply;
        try {
            reply = registry.dispatch(request);
        } catch (CommandException e) {
            reply = Reply.error(e.getMessage());
        }

        ctx.writeAndFlush(reply).addListener((ChannelFutureListener) (ChannelFuture f) -> {
            if (!f.isSuccess()) {
                Log.error("Error sending response to " + f.channel().remoteAddress() + ": " + f.cause());
                f.channel().close();
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            Throwable root = cause.getCause() != null ? cause.getCause() : cause;
            Log.warn("Error processing command from " + ctx.channel().remoteAddress() + ": " + root.getMessage());
        } else if (cause instanceof IOException) {
            Log.warn("Error reading from client " + ctx.channel().remoteAddress() + ": " + cause.getMessage());
        } else {
            Log.error("Error processing command from " + ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
