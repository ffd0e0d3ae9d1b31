package kestrel.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import kestrel.protocol.Request;
import kestrel.protocol.Resp;

import java.util.List;

/**
 * Incremental framer: buffers bytes across reads until a whole request is available and
 * emits every complete request in the buffer, so split and pipelined requests both work.
 */
public class RespFrameDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        while (in.isReadable()) {
            Request request = Resp.tryDecode(in);
            if (request == null) return; // Wait for more data
            out.add(request);
        }
    }
}
