package com.acme.kvstore.idalloc.counter.http;

import com.acme.kvstore.idalloc.counter.CounterKey;
import com.acme.kvstore.idalloc.counter.CounterStore;
import com.acme.kvstore.idalloc.counter.CounterStoreException;
import com.acme.kvstore.idalloc.util.IdAllocDefaults;
import com.acme.kvstore.idalloc.util.IdAllocStatusCodes;
import com.acme.kvstore.idalloc.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.pool.ChannelPoolHandler;
import io.netty.channel.pool.SimpleChannelPool;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.FutureListener;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link CounterStore} backed by a remote counter node speaking the
 * {@link NettyCounterHttpServer} protocol over pooled keep-alive connections.
 *
 * <p>{@link #increment} blocks on {@link #incrementAsync}; the response timeout
 * bounds how long a caller (usually an allocator's reservation worker) can be
 * stuck on an unresponsive node.
 */
public final class HttpCounterStore implements CounterStore {
    private static final int RESPONSE_LIMIT = IdAllocDefaults.MAX_CONTENT_LENGTH;

    private final URI baseUri;
    private final String host;
    private final int port;
    private final boolean https;
    private final EventLoopGroup ioGroup;
    private final SimpleChannelPool pool;
    private final SslContext sslContext;
    private final Semaphore inFlight;
    private final int responseTimeoutMillis;

    public HttpCounterStore(URI baseUri) {
        this(baseUri, IdAllocDefaults.DEFAULT_MAX_INFLIGHT, IdAllocDefaults.DEFAULT_RESPONSE_TIMEOUT_MS,
            IdAllocDefaults.DEFAULT_CLIENT_IO_THREADS);
    }

    public HttpCounterStore(URI baseUri, int maxInFlight, int responseTimeoutMillis) {
        this(baseUri, maxInFlight, responseTimeoutMillis, IdAllocDefaults.DEFAULT_CLIENT_IO_THREADS);
    }

    /**
     * @param baseUri               scheme, host and port of the counter node; any path is ignored
     * @param maxInFlight           concurrent requests before new ones fail fast with 429
     * @param responseTimeoutMillis per-request response timeout
     * @param ioThreads             event loop threads, 0 or less for a CPU-based default
     */
    public HttpCounterStore(URI baseUri, int maxInFlight, int responseTimeoutMillis, int ioThreads) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.host = Objects.requireNonNull(baseUri.getHost(), "baseUri host required");
        this.https = isHttps(baseUri);
        this.port = resolvePort(baseUri);
        this.inFlight = new Semaphore(Math.max(1, maxInFlight));
        this.responseTimeoutMillis = Math.max(1, responseTimeoutMillis);

        try {
            this.sslContext = https ? SslContextBuilder.forClient().build() : null;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build TLS context", e);
        }

        int threads = ioThreads > 0 ? ioThreads : Math.max(2, Runtime.getRuntime().availableProcessors());
        this.ioGroup = new NioEventLoopGroup(threads);
        Bootstrap bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, IdAllocDefaults.DEFAULT_CONNECT_TIMEOUT_MS)
            .remoteAddress(host, port);
        this.pool = new SimpleChannelPool(bootstrap, new CounterChannelPoolHandler());
    }

    @Override
    public long increment(CounterKey key, long delta) {
        CompletableFuture<Long> future = incrementAsync(key, delta);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new CounterStoreException(IdAllocStatusCodes.SERVICE_UNAVAILABLE,
                "interrupted while incrementing " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CounterStoreException cse) {
                throw cse;
            }
            if (cause instanceof TimeoutException) {
                throw new CounterStoreException(IdAllocStatusCodes.GATEWAY_TIMEOUT,
                    "counter node timed out incrementing " + key, cause);
            }
            throw new CounterStoreException(IdAllocStatusCodes.BAD_GATEWAY,
                "counter node request failed for " + key + ": " + cause, cause);
        }
    }

    /**
     * Sends one increment request. The future completes with the new counter
     * value, or exceptionally with a {@link CounterStoreException} for
     * non-200 replies, a {@link TimeoutException}, or the transport failure.
     */
    public CompletableFuture<Long> incrementAsync(CounterKey key, long delta) {
        Objects.requireNonNull(key, "key");
        CompletableFuture<Long> result = new CompletableFuture<>();
        if (!key.isValid()) {
            result.completeExceptionally(
                new CounterStoreException(IdAllocStatusCodes.BAD_REQUEST, "invalid counter key"));
            return result;
        }
        byte[] body;
        try {
            body = JsonCodec.writeString(Map.of(CounterEndpoints.FIELD_DELTA, delta))
                .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            result.completeExceptionally(e);
            return result;
        }
        if (!inFlight.tryAcquire()) {
            result.completeExceptionally(
                new CounterStoreException(IdAllocStatusCodes.TOO_MANY_REQUESTS, "too many in-flight increments"));
            return result;
        }
        AtomicReference<ScheduledFuture<?>> timeoutFutureRef = new AtomicReference<>();
        result.whenComplete((ignored, error) -> {
            ScheduledFuture<?> timeoutFuture = timeoutFutureRef.getAndSet(null);
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
            inFlight.release();
        });

        String path = CounterEndpoints.incrementPath(key);
        pool.acquire().addListener((FutureListener<Channel>) acquireFuture -> {
            if (!acquireFuture.isSuccess()) {
                result.completeExceptionally(acquireFuture.cause());
                return;
            }

            Channel ch = acquireFuture.getNow();
            ch.pipeline().addLast("increment-response", new IncrementResponseHandler(result, pool, ch, key));

            ScheduledFuture<?> timeoutFuture = ch.eventLoop().schedule(() -> {
                if (result.completeExceptionally(new TimeoutException("counter response timeout"))) {
                    ch.close();
                }
            }, responseTimeoutMillis, TimeUnit.MILLISECONDS);
            timeoutFutureRef.set(timeoutFuture);
            if (result.isDone() && timeoutFutureRef.compareAndSet(timeoutFuture, null)) {
                timeoutFuture.cancel(false);
            }

            FullHttpRequest req = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.POST,
                path,
                Unpooled.wrappedBuffer(body)
            );
            req.headers().set(HttpHeaderNames.HOST, hostHeader());
            req.headers().set(HttpHeaderNames.CONNECTION, "keep-alive");
            req.headers().set(HttpHeaderNames.CONTENT_TYPE, CounterEndpoints.CONTENT_TYPE_JSON);
            req.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
            req.headers().set(HttpHeaderNames.USER_AGENT, "idalloc-counter-client/1");
            ch.writeAndFlush(req).addListener((ChannelFutureListener) writeFuture -> {
                if (!writeFuture.isSuccess()) {
                    ReferenceCountUtil.safeRelease(req);
                    result.completeExceptionally(writeFuture.cause());
                    writeFuture.channel().close();
                }
            });
        });

        return result;
    }

    public URI baseUri() {
        return baseUri;
    }

    public int availableInFlightPermits() {
        return inFlight.availablePermits();
    }

    @Override
    public void close() {
        pool.close();
        ioGroup.shutdownGracefully().syncUninterruptibly();
    }

    private final class CounterChannelPoolHandler implements ChannelPoolHandler {
        @Override
        public void channelCreated(Channel ch) {
            ChannelPipeline p = ch.pipeline();
            if (https) {
                p.addLast(sslContext.newHandler(ch.alloc(), host, port));
            }
            p.addLast(new HttpClientCodec());
            p.addLast(new HttpObjectAggregator(RESPONSE_LIMIT));
        }

        @Override
        public void channelAcquired(Channel ch) {
            // no-op
        }

        @Override
        public void channelReleased(Channel ch) {
            if (ch.pipeline().get("increment-response") != null) {
                ch.pipeline().remove("increment-response");
            }
        }
    }

    private static final class IncrementResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<Long> result;
        private final SimpleChannelPool pool;
        private final Channel channel;
        private final CounterKey key;

        private IncrementResponseHandler(CompletableFuture<Long> result,
                                         SimpleChannelPool pool,
                                         Channel channel,
                                         CounterKey key) {
            this.result = result;
            this.pool = pool;
            this.channel = channel;
            this.key = key;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            try {
                completeFrom(msg.status().code(), ByteBufUtil.getBytes(msg.content()));
            } finally {
                pool.release(channel);
            }
        }

        private void completeFrom(int status, byte[] content) {
            if (status != IdAllocStatusCodes.OK) {
                String message = new String(content, StandardCharsets.UTF_8);
                result.completeExceptionally(new CounterStoreException(status,
                    "counter node rejected increment of " + key + ": " + status + " " + message));
                return;
            }
            try {
                JsonNode reply = JsonCodec.readTree(content);
                JsonNode value = reply == null ? null : reply.get(CounterEndpoints.FIELD_VALUE);
                if (value == null || !value.isIntegralNumber()) {
                    result.completeExceptionally(new CounterStoreException(IdAllocStatusCodes.BAD_GATEWAY,
                        "counter node reply without integral 'value' for " + key));
                    return;
                }
                result.complete(value.asLong());
            } catch (IOException e) {
                result.completeExceptionally(new CounterStoreException(IdAllocStatusCodes.BAD_GATEWAY,
                    "malformed counter node reply for " + key, e));
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!result.isDone()) {
                result.completeExceptionally(new IllegalStateException("counter node closed before response"));
            }
            ctx.fireChannelInactive();
        }
    }

    private String hostHeader() {
        if ((https && port == IdAllocDefaults.HTTPS_DEFAULT_PORT) || (!https && port == IdAllocDefaults.HTTP_DEFAULT_PORT)) {
            return host;
        }
        return host + ":" + port;
    }

    private static boolean isHttps(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    private static int resolvePort(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return isHttps(uri) ? IdAllocDefaults.HTTPS_DEFAULT_PORT : IdAllocDefaults.HTTP_DEFAULT_PORT;
    }
}
