package com.questrail.empire.protocol.gge.transport.netty;

import com.questrail.empire.protocol.gge.transport.GgeTransport;
import com.questrail.empire.protocol.gge.transport.GgeTransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * NettyTcpTransport
 * =============================================================================
 * Raw-stream {@link GgeTransport} over a plain Netty TCP client.
 *
 * <h2>Framing</h2>
 * The stream has no framing of its own. Every message is terminated by a single
 * NUL byte in both directions:
 * <ul>
 *   <li>Outbound: {@code message + '\0'}.</li>
 *   <li>Inbound: {@link DelimiterBasedFrameDecoder} splits on NUL and keeps a
 *       trailing partial message until the rest arrives.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * {@code onOpen} fires when the channel becomes active. {@code onClose} reports
 * {@code 1006} when an error preceded the close and {@code 1000} otherwise.
 */
public final class NettyTcpTransport implements GgeTransport
{
    static final int NORMAL_CLOSE = 1000;
    static final int ABNORMAL_CLOSE = 1006;
    static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private static final byte NUL = 0;

    private final TcpAddress address;
    private final EventLoopGroup group;
    private final ListenerRelay relay = new ListenerRelay();

    private volatile Channel channel;

    public NettyTcpTransport(TcpAddress address, EventLoopGroup group)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.group = Objects.requireNonNull(group, "group");
    }

    @Override
    public void setListener(GgeTransportListener listener)
    {
        relay.setListener(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void open()
    {
        relay.requireListener();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        initPipeline(ch.pipeline(), relay);
                    }
                });

        ChannelFuture f = bootstrap.connect(address.host(), address.port());
        channel = f.channel();
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                relay.error(future.cause());
                relay.closed(ABNORMAL_CLOSE, String.valueOf(future.cause()));
            }
        });
    }

    static void initPipeline(ChannelPipeline p, ListenerRelay relay)
    {
        p.addLast(new DelimiterBasedFrameDecoder(MAX_FRAME_LENGTH, true, Unpooled.wrappedBuffer(new byte[] {NUL})));
        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
        p.addLast(new StreamEventHandler(relay));
    }

    @Override
    public void send(String message)
    {
        Objects.requireNonNull(message, "message");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return;
        }
        ch.writeAndFlush(message + '\0');
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public String toString()
    {
        return "NettyTcpTransport[" + address + "]";
    }

    /**
     * Receives NUL-split messages and channel lifecycle.
     */
    static final class StreamEventHandler extends SimpleChannelInboundHandler<String>
    {
        private final ListenerRelay relay;

        StreamEventHandler(ListenerRelay relay)
        {
            this.relay = relay;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            relay.opened();
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String message)
        {
            // Back-to-back NULs yield empty frames; they carry nothing.
            if (!message.isEmpty()) {
                relay.data(message);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            relay.closed(relay.errored() ? ABNORMAL_CLOSE : NORMAL_CLOSE, "");
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            relay.error(cause);
            ctx.close();
        }
    }
}
