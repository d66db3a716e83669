package com.questrail.empire.protocol.gge.transport.netty;

import com.questrail.empire.protocol.gge.transport.GgeTransport;
import com.questrail.empire.protocol.gge.transport.GgeTransportListener;

import io.netty.bootstrap.Bootstrap;
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
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * NettyWebSocketTransport
 * =============================================================================
 * Message-framed {@link GgeTransport} over a Netty WebSocket client.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>: every inbound text
 * frame becomes one {@link GgeTransportListener#onData(String)}, every
 * {@link #send(String)} becomes one text frame. It never decodes protocol frames.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   [SslHandler] -> HttpClientCodec -> HttpObjectAggregator
 *     -> WebSocketClientProtocolHandler -> WebSocketFrameAggregator -> WebSocketEventHandler
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@code onOpen} fires once the WebSocket upgrade completed, not when TCP
 *       connects.</li>
 *   <li>{@code onClose} reports the code and reason of the server's close frame,
 *       or {@code 1006} when the channel went away without one.</li>
 * </ul>
 *
 * <p>The {@link EventLoopGroup} is shared and owned by the composition root.</p>
 */
public final class NettyWebSocketTransport implements GgeTransport
{
    static final int ABNORMAL_CLOSE = 1006;
    static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private final URI uri;
    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final ListenerRelay relay = new ListenerRelay();

    private volatile Channel channel;

    /**
     * @param uri        {@code ws://} or {@code wss://} endpoint
     * @param group      shared event loop group
     * @param sslContext client TLS context for {@code wss}, {@code null} for {@code ws}
     */
    public NettyWebSocketTransport(URI uri, EventLoopGroup group, SslContext sslContext)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.group = Objects.requireNonNull(group, "group");
        this.sslContext = sslContext;
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

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), MAX_FRAME_LENGTH);
        String host = uri.getHost();
        int port = port(uri);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        // Close frames are passed on so their code and reason can be reported.
                        p.addLast(new WebSocketClientProtocolHandler(handshaker, false));
                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_LENGTH));
                        p.addLast(new WebSocketEventHandler(relay));
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port);
        channel = f.channel();
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                relay.error(future.cause());
                relay.closed(ABNORMAL_CLOSE, String.valueOf(future.cause()));
            }
        });
    }

    @Override
    public void send(String message)
    {
        Objects.requireNonNull(message, "message");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return;
        }
        ch.writeAndFlush(new TextWebSocketFrame(message));
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    static int port(URI uri)
    {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    @Override
    public String toString()
    {
        return "NettyWebSocketTransport[" + uri + "]";
    }

    /**
     * WebSocketEventHandler
     * -------------------------------------------------------------------------
     * Last handler in the pipeline. Receives complete (aggregated) frames and the
     * handshake completion event.
     */
    static final class WebSocketEventHandler extends SimpleChannelInboundHandler<WebSocketFrame>
    {
        private final ListenerRelay relay;

        private int closeCode = ABNORMAL_CLOSE;
        private String closeReason = "";

        WebSocketEventHandler(ListenerRelay relay)
        {
            this.relay = relay;
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                relay.opened();
            }
            else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                relay.error(new IllegalStateException("WebSocket handshake timed out"));
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
        {
            if (frame instanceof TextWebSocketFrame) {
                relay.data(((TextWebSocketFrame) frame).text());
            }
            else if (frame instanceof BinaryWebSocketFrame) {
                relay.data(frame.content().toString(StandardCharsets.UTF_8));
            }
            else if (frame instanceof CloseWebSocketFrame) {
                CloseWebSocketFrame close = (CloseWebSocketFrame) frame;
                if (close.statusCode() != -1) {
                    closeCode = close.statusCode();
                }
                closeReason = close.reasonText();
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            relay.closed(closeCode, closeReason);
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
