package kestrel.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import kestrel.protocol.Request;
import kestrel.protocol.Resp;
import kestrel.utils.Log;

import java.util.List;

/**
 * Treats every chunk delivered by a socket read as exactly one request frame.
 * Partial frames are rejected and anything after the first frame in the chunk is dropped,
 * so clients must send one request and wait for its reply. {@link RespFrameDecoder} lifts
 * that restriction.
 */
public class ReadChunkDecoder extends MessageToMessageDecoder<ByteBuf> {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf chunk, List<Object> out) throws Exception {
        if (!chunk.isReadable()) return;

        Request request = Resp.decode(chunk);
        if (chunk.isReadable()) {
            Log.debug("Discarding " + chunk.readableBytes() + " trailing bytes from " + ctx.channel().remoteAddress());
            chunk.skipBytes(chunk.readableBytes());
        }
        out.add(request);
    }
}
