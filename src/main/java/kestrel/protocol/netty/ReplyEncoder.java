package kestrel.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import kestrel.protocol.Reply;

/**
 * Writes {@link Reply} values as RESP frames.
 */
@ChannelHandler.Sharable
public class ReplyEncoder extends MessageToByteEncoder<Reply> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Reply reply, ByteBuf out) throws Exception {
        out.writeBytes(reply.toResp());
    }
}
