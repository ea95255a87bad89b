package com.questrail.dtnclient.client;

import com.questrail.dtnclient.protocol.codec.MessageCodec;
import com.questrail.dtnclient.protocol.model.DtnMessage;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * NettyDaemonStub
 * =============================================================================
 * Test-only stand-in for dtnd's application agent on a loopback TCP port.
 *
 * <p>Each accepted connection receives one length-prefixed request, which is
 * decoded and handed to the responder. The responder's reply is written back
 * with the same framing, after which the connection is closed. A responder
 * returning {@code null} closes the connection without replying.</p>
 *
 * <p>{@link #replyWithRawBody(byte[])} bypasses the codec to serve arbitrary
 * reply bodies.</p>
 */
final class NettyDaemonStub implements AutoCloseable
{
    private static final int MAX_FRAME = 16 * 1024 * 1024;

    private final MessageCodec codec;
    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final List<DtnMessage> received = new CopyOnWriteArrayList<>();
    private final Channel serverChannel;

    private volatile Function<DtnMessage, DtnMessage> responder = request -> null;
    private volatile byte[] rawReply;

    NettyDaemonStub(MessageCodec codec) throws InterruptedException
    {
        this.codec = Objects.requireNonNull(codec, "codec");

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LengthFieldBasedFrameDecoder(MAX_FRAME, 0, 8, 0, 8));
                        p.addLast(new LengthFieldPrepender(8));
                        p.addLast(new RequestHandler());
                    }
                });

        this.serverChannel = bootstrap
                .bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))
                .sync()
                .channel();
    }

    InetSocketAddress address()
    {
        return (InetSocketAddress) serverChannel.localAddress();
    }

    void respondWith(Function<DtnMessage, DtnMessage> responder)
    {
        this.responder = Objects.requireNonNull(responder, "responder");
        this.rawReply = null;
    }

    void replyWithRawBody(byte[] body)
    {
        this.rawReply = Objects.requireNonNull(body, "body").clone();
    }

    List<DtnMessage> received()
    {
        return List.copyOf(received);
    }

    @Override
    public void close() throws InterruptedException
    {
        serverChannel.close().sync();
        group.shutdownGracefully().sync();
    }

    private final class RequestHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            DtnMessage request = codec.decode(ByteBufUtil.getBytes(frame));
            received.add(request);

            byte[] body = rawReply;
            if (body == null) {
                DtnMessage reply = responder.apply(request);
                if (reply == null) {
                    ctx.close();
                    return;
                }
                body = codec.encode(reply);
            }
            ctx.writeAndFlush(Unpooled.wrappedBuffer(body)).addListener(ChannelFutureListener.CLOSE);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            ctx.close();
        }
    }
}
