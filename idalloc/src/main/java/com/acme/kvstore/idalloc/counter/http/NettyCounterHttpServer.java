package com.acme.kvstore.idalloc.counter.http;

import com.acme.kvstore.idalloc.counter.CounterKey;
import com.acme.kvstore.idalloc.counter.CounterStore;
import com.acme.kvstore.idalloc.counter.CounterStoreException;
import com.acme.kvstore.idalloc.util.IdAllocDefaults;
import com.acme.kvstore.idalloc.util.IdAllocStatusCodes;
import com.acme.kvstore.idalloc.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves {@code POST /v1/counters/{key}/increment} on top of a
 * {@link CounterStore}, turning any process-local store into a remote one.
 *
 * <p>Request body: {@code {"delta": 10}}. Response: {@code {"key": "...", "value": 42}}.
 */
public final class NettyCounterHttpServer implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(NettyCounterHttpServer.class.getName());
    private static final int MAX_CONTENT_LENGTH = IdAllocDefaults.MAX_CONTENT_LENGTH;
    private static final String TEXT_PLAIN = "text/plain";

    private final int port;
    private final CounterStore store;
    private final AtomicLong increments = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public NettyCounterHttpServer(CounterStore store) {
        this(IdAllocDefaults.DEFAULT_COUNTER_HTTP_PORT, store);
    }

    /**
     * @param port  listen port, 0 for an ephemeral port (see {@link #boundPort()})
     * @param store store receiving the increments
     */
    public NettyCounterHttpServer(int port, CounterStore store) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.port = port;
        this.store = Objects.requireNonNull(store, "store");
    }

    public synchronized void start() throws Exception {
        if (serverChannel != null) {
            return;
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, IdAllocDefaults.DEFAULT_SO_BACKLOG)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        ch.pipeline().addLast(new CounterHttpHandler());
                    }
                });

            serverChannel = bootstrap.bind(port).sync().channel();
            LOG.info(() -> "Counter HTTP server started on port " + boundPort());
        } catch (Exception e) {
            stop();
            throw e;
        }
    }

    public synchronized void stop() {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }

        EventLoopGroup workers = workerGroup;
        workerGroup = null;
        if (workers != null) {
            workers.shutdownGracefully().syncUninterruptibly();
        }

        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully().syncUninterruptibly();
        }

        LOG.info(() -> "Counter HTTP server stopped"
            + " increments=" + increments.get()
            + " failures=" + failures.get());
    }

    /** Port the server is listening on, or -1 when not started. */
    public int boundPort() {
        Channel ch = serverChannel;
        if (ch == null) {
            return -1;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    public long incrementCount() {
        return increments.get();
    }

    @Override
    public void close() {
        stop();
    }

    private final class CounterHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
            if (!req.decoderResult().isSuccess()) {
                writeText(ctx, req, HttpResponseStatus.BAD_REQUEST, "bad request");
                return;
            }
            CounterKey key = CounterEndpoints.keyFromIncrementPath(req.uri());
            if (key == null) {
                writeText(ctx, req, HttpResponseStatus.valueOf(IdAllocStatusCodes.NOT_FOUND), "unknown counter path");
                return;
            }
            if (req.method() != HttpMethod.POST) {
                writeText(ctx, req, HttpResponseStatus.valueOf(IdAllocStatusCodes.METHOD_NOT_ALLOWED), "method not allowed");
                return;
            }
            if (!key.isValid()) {
                writeText(ctx, req, HttpResponseStatus.BAD_REQUEST, "empty counter key");
                return;
            }

            long delta;
            try {
                JsonNode body = JsonCodec.readTree(ByteBufUtil.getBytes(req.content()));
                JsonNode deltaNode = body == null ? null : body.get(CounterEndpoints.FIELD_DELTA);
                if (deltaNode == null || !deltaNode.canConvertToLong() || !deltaNode.isIntegralNumber()) {
                    writeText(ctx, req, HttpResponseStatus.BAD_REQUEST, "integral 'delta' required");
                    return;
                }
                delta = deltaNode.asLong();
            } catch (IOException e) {
                writeText(ctx, req, HttpResponseStatus.BAD_REQUEST, "malformed json");
                return;
            }

            try {
                long value = store.increment(key, delta);
                increments.incrementAndGet();
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put(CounterEndpoints.FIELD_KEY, key.name());
                payload.put(CounterEndpoints.FIELD_VALUE, value);
                byte[] out = JsonCodec.writeString(payload).getBytes(StandardCharsets.UTF_8);
                writeResponse(ctx, req, HttpResponseStatus.valueOf(IdAllocStatusCodes.OK), Unpooled.wrappedBuffer(out),
                    CounterEndpoints.CONTENT_TYPE_JSON);
            } catch (CounterStoreException cse) {
                failures.incrementAndGet();
                writeText(ctx, req, statusFor(cse.statusCode()), cse.getMessage());
            } catch (Throwable t) {
                failures.incrementAndGet();
                LOG.log(Level.WARNING, "counter increment failure key=" + key, t);
                writeText(ctx, req, HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.SEVERE, "HTTP pipeline failure", cause);
            ctx.close();
        }
    }

    private static HttpResponseStatus statusFor(int statusCode) {
        if (statusCode >= IdAllocStatusCodes.BAD_REQUEST && statusCode <= 599) {
            return HttpResponseStatus.valueOf(statusCode);
        }
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }

    private static void writeText(ChannelHandlerContext ctx,
                                  FullHttpRequest req,
                                  HttpResponseStatus status,
                                  String message) {
        byte[] bytes = (message == null ? status.reasonPhrase() : message).getBytes(StandardCharsets.UTF_8);
        writeResponse(ctx, req, status, Unpooled.wrappedBuffer(bytes), TEXT_PLAIN);
    }

    private static void writeResponse(ChannelHandlerContext ctx,
                                      FullHttpRequest req,
                                      HttpResponseStatus status,
                                      ByteBuf body,
                                      String contentType) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, body);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
