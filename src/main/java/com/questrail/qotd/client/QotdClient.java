package com.questrail.qotd.client;

import com.questrail.qotd.codec.QuoteCodec;
import com.questrail.qotd.codec.QuoteDecodeException;
import com.questrail.qotd.host.HostDisposedException;
import com.questrail.qotd.host.InFlightTracker;
import com.questrail.qotd.host.QotdHost;
import com.questrail.qotd.internal.time.CancellationSignal;
import com.questrail.qotd.internal.time.MonotonicScheduler;
import com.questrail.qotd.internal.time.ScheduledExecutorScheduler;
import com.questrail.qotd.internal.time.SystemMonotonicClock;
import com.questrail.qotd.observability.QotdErrorEvent;
import com.questrail.qotd.observability.QotdObservabilitySink;
import com.questrail.qotd.observability.Slf4jQotdObservabilitySink;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFactory;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet6Address;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * QotdClient
 * =============================================================================
 * Requests quotes from an RFC 865 server over TCP or UDP.
 *
 * <h2>Request flow</h2>
 * <pre>
 *   requestQuote(timeout, token)
 *        → settings snapshot (mode, endpoint, codec)
 *            → connect and read until EOF         (STREAM)
 *              or send one datagram, await reply (DATAGRAM)
 *                → QuoteCodec.decode
 * </pre>
 *
 * <h2>Completion</h2>
 * The returned future completes with:
 * <ul>
 *   <li>the decoded quote,</li>
 *   <li>{@link InvalidQuoteException} for an empty or undecodable answer,</li>
 *   <li>{@link java.util.concurrent.CancellationException} when the timeout
 *       elapses, the caller's token is cancelled, the future itself is
 *       cancelled or the client is closed,</li>
 *   <li>the transport exception otherwise (connection refused, unreachable).</li>
 * </ul>
 * Cancellation always wins over a late answer.
 *
 * <h2>Threading</h2>
 * I/O and timers run on the client's own Netty event loop group. Requests may
 * be issued from any thread and may be outstanding concurrently. Completion
 * callbacks usually run on that group; {@link #close()} called from one of them
 * does not wait for outstanding requests or for the group to terminate.
 */
public final class QotdClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QotdClient.class);

    private static final Duration QUIESCE_TIMEOUT = Duration.ofSeconds(5);

    // Socket buffer headroom above the quote bound for protocol overhead.
    private static final int STREAM_OVERHEAD = 60;
    private static final int DATAGRAM_OVERHEAD = 8;

    // Request payload; servers discard datagram content.
    private static final byte[] DATAGRAM_REQUEST = { '\n' };

    private final QotdHost host;
    private final InFlightTracker inFlight = new InFlightTracker();
    private final EventLoopGroup group;
    private final MonotonicScheduler scheduler;
    private final Object lock = new Object();

    private volatile QotdClientConfig config;

    public QotdClient(QotdClientConfig config) {
        this(config, new Slf4jQotdObservabilitySink());
    }

    public QotdClient(QotdClientConfig config, QotdObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.host = new QotdHost("QotdClient", config.host(), sink);
        this.group = new NioEventLoopGroup(1);
        this.scheduler = new ScheduledExecutorScheduler(group, SystemMonotonicClock.INSTANCE);
    }

    /**
     * Replace the client settings. Requests already issued keep the snapshot
     * they started with.
     *
     * @throws HostDisposedException if the client is closed
     */
    public void applyConfiguration(QotdClientConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        synchronized (lock) {
            if (inFlight.isDraining()) {
                throw new HostDisposedException(host.name());
            }
            host.apply(newConfig.host());
            config = newConfig;
        }
    }

    public QotdClientConfig config() {
        return config;
    }

    public int inFlightCount() {
        return inFlight.count();
    }

    /**
     * Request a quote using the configured default timeout.
     */
    public CompletableFuture<String> requestQuote() {
        return requestQuote(Duration.ZERO, CancellationSignal.none());
    }

    public CompletableFuture<String> requestQuote(Duration timeout) {
        return requestQuote(timeout, CancellationSignal.none());
    }

    /**
     * Request a quote.
     *
     * @param timeout {@link Duration#ZERO} for the configured default, a negative
     *                value to wait indefinitely
     * @param token   cancels the request when cancelled
     * @throws HostDisposedException if the client is closed or closing
     */
    public CompletableFuture<String> requestQuote(Duration timeout, CancellationSignal token) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(token, "token");

        QotdClientConfig cfg;
        QuoteCodec codec;
        synchronized (lock) {
            if (!inFlight.tryEnter()) {
                throw new HostDisposedException(host.name());
            }
            cfg = config;
            codec = host.codec();
        }

        ClientRequest request = new ClientRequest();
        try {
            Duration effective = timeout.isZero() ? cfg.defaultTimeout() : timeout;
            if (!effective.isNegative()) {
                request.register(scheduler.scheduleAfter(effective, SystemMonotonicClock.INSTANCE, request::abort));
            }
            request.register(token.onCancel(request::abort));
            request.register(host.disposalSignal().onCancel(request::abort));
        } catch (RuntimeException e) {
            request.release();
            inFlight.exit();
            throw e;
        }

        request.result().whenComplete((quote, error) -> {
            try {
                request.release();
            } finally {
                inFlight.exit();
            }
        });

        if (!request.result().isDone()) {
            try {
                if (cfg.mode() == QotdClientMode.STREAM) {
                    requestOverStream(cfg, codec, request);
                } else {
                    requestOverDatagram(cfg, codec, request);
                }
            } catch (RuntimeException e) {
                request.fail(e);
            }
        }
        return request.result();
    }

    /**
     * Stop accepting requests, wait (up to 5 s) for outstanding ones, cancel the
     * rest and release the event loop. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (inFlight.isDraining()) {
                return;
            }
            inFlight.beginDraining();
        }
        boolean onEventLoop = onOwnEventLoop();
        if (!onEventLoop && !inFlight.awaitIdle(QUIESCE_TIMEOUT)) {
            log.debug("QotdClient closing with {} request(s) outstanding", inFlight.count());
        }
        host.dispose();
        Future<?> terminated = group.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        if (!onEventLoop) {
            terminated.awaitUninterruptibly();
        }
    }

    private boolean onOwnEventLoop() {
        for (EventExecutor executor : group) {
            if (executor.inEventLoop()) {
                return true;
            }
        }
        return false;
    }

    // -------------------------------------------------------------------------
    // Transports
    // -------------------------------------------------------------------------

    private void requestOverStream(QotdClientConfig cfg, QuoteCodec codec, ClientRequest request) {
        int quoteLength = cfg.host().maximumQuoteLength();

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.SO_RCVBUF, quoteLength + STREAM_OVERHEAD)
            .option(ChannelOption.SO_SNDBUF, STREAM_OVERHEAD)
            .handler(new StreamResponseHandler(codec, request, quoteLength));

        ChannelFuture connect = bootstrap.connect(cfg.endpoint());
        request.attach(connect.channel());
        connect.addListener(future -> {
            if (!future.isSuccess()) {
                request.fail(future.cause());
            }
        });
    }

    private void requestOverDatagram(QotdClientConfig cfg, QuoteCodec codec, ClientRequest request) {
        int quoteLength = cfg.host().maximumQuoteLength();
        InetSocketAddress target = cfg.endpoint();
        boolean ipv6 = target.getAddress() instanceof Inet6Address;
        InternetProtocolFamily family = ipv6 ? InternetProtocolFamily.IPv6 : InternetProtocolFamily.IPv4;

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channelFactory((ChannelFactory<NioDatagramChannel>) () -> new NioDatagramChannel(family))
            .option(ChannelOption.SO_RCVBUF, quoteLength + DATAGRAM_OVERHEAD)
            .option(ChannelOption.SO_SNDBUF, DATAGRAM_OVERHEAD)
            .handler(new DatagramResponseHandler(codec, request, target, quoteLength));

        ChannelFuture bind = bootstrap.bind(new InetSocketAddress(ipv6 ? "::" : "0.0.0.0", 0));
        request.attach(bind.channel());
        bind.addListener(bound -> {
            if (!bound.isSuccess()) {
                request.fail(bound.cause());
                return;
            }
            DatagramPacket packet = new DatagramPacket(Unpooled.wrappedBuffer(DATAGRAM_REQUEST), target);
            bind.channel().writeAndFlush(packet).addListener(sent -> {
                // Not fatal: the request still ends by reply, timeout or cancellation
                if (!sent.isSuccess() && !request.isCancelled()) {
                    host.reportError(QotdErrorEvent.Kind.TRANSPORT_FAILURE,
                        "Failed to send QOTD request to " + target, sent.cause());
                }
            });
        });
    }

    /**
     * Decode {@code length} bytes of {@code buffer} and complete the request.
     */
    private static void completeWith(QuoteCodec codec, ClientRequest request, byte[] buffer, int length) {
        if (length == 0) {
            request.fail(new InvalidQuoteException("Server sent an empty response"));
            return;
        }
        try {
            request.succeed(codec.decode(buffer, length));
        } catch (QuoteDecodeException e) {
            request.fail(new InvalidQuoteException("Server sent an invalid quote", e));
        }
    }

    /**
     * Collects the TCP response into a pooled buffer until the server closes the
     * connection or the buffer is full. The buffer is rented and returned on the
     * channel's event loop, so it is never touched after release. Its length is
     * the bound captured when the request was issued.
     */
    private final class StreamResponseHandler extends ChannelInboundHandlerAdapter {
        private final QuoteCodec codec;
        private final ClientRequest request;
        private final int quoteLength;

        private byte[] buffer;
        private int filled;
        private boolean done;

        StreamResponseHandler(QuoteCodec codec, ClientRequest request, int quoteLength) {
            this.codec = codec;
            this.request = request;
            this.quoteLength = quoteLength;
        }

        @Override
        public void handlerAdded(ChannelHandlerContext ctx) {
            buffer = host.rentBuffer(quoteLength);
        }

        @Override
        public void handlerRemoved(ChannelHandlerContext ctx) {
            if (buffer != null) {
                host.releaseBuffer(buffer);
                buffer = null;
            }
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            try {
                if (done) {
                    return;
                }
                ByteBuf data = (ByteBuf) msg;
                int n = Math.min(data.readableBytes(), buffer.length - filled);
                data.readBytes(buffer, filled, n);
                filled += n;
                if (filled == buffer.length) {
                    finish(ctx);
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            finish(ctx);
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            done = true;
            request.fail(cause);
            ctx.close();
        }

        private void finish(ChannelHandlerContext ctx) {
            if (done) {
                return;
            }
            done = true;
            completeWith(codec, request, buffer, filled);
            ctx.close();
        }
    }

    /**
     * Waits for the single reply datagram. Datagrams from any address other
     * than the target endpoint are ignored.
     */
    private final class DatagramResponseHandler extends SimpleChannelInboundHandler<DatagramPacket> {
        private final QuoteCodec codec;
        private final ClientRequest request;
        private final InetSocketAddress target;
        private final int quoteLength;

        DatagramResponseHandler(QuoteCodec codec, ClientRequest request, InetSocketAddress target, int quoteLength) {
            this.codec = codec;
            this.request = request;
            this.target = target;
            this.quoteLength = quoteLength;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
            if (!target.equals(packet.sender())) {
                log.debug("Ignoring datagram from unexpected sender {} (waiting for {})", packet.sender(), target);
                return;
            }

            byte[] buffer = host.rentBuffer(quoteLength);
            try {
                ByteBuf data = packet.content();
                int n = Math.min(data.readableBytes(), buffer.length);
                data.readBytes(buffer, 0, n);
                completeWith(codec, request, buffer, n);
            } finally {
                host.releaseBuffer(buffer);
            }
            ctx.close();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            request.fail(cause);
            ctx.close();
        }
    }
}
