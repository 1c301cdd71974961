package com.questrail.qotd.server;

import com.questrail.qotd.codec.EncodedQuote;
import com.questrail.qotd.host.HostDisposedException;
import com.questrail.qotd.host.InFlightTracker;
import com.questrail.qotd.host.QotdHost;
import com.questrail.qotd.observability.QotdErrorEvent;
import com.questrail.qotd.observability.QotdObservabilitySink;
import com.questrail.qotd.observability.QotdTransportEvent;
import com.questrail.qotd.observability.QotdTransportEvent.Protocol;
import com.questrail.qotd.observability.Slf4jQotdObservabilitySink;
import com.questrail.qotd.quotes.QuoteProvider;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFactory;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * QotdServer
 * =============================================================================
 * Serves quotes from a {@link QuoteProvider} according to RFC 865, over TCP,
 * UDP, or both.
 *
 * <h2>Per-request flow</h2>
 * <pre>
 *   accepted connection / received datagram
 *        → QuoteProvider.getQuote(remote address, disposal signal)
 *            → QuoteCodec.encode        (pooled buffer)
 *                → write
 *                    → buffer returned, connection closed (TCP)
 * </pre>
 *
 * <p>Netty keeps accepting connections and reading datagrams right after an
 * event is dispatched, so requests are handled concurrently and may complete
 * out of order. Within one request the steps above run strictly in sequence.
 * If the provider completes synchronously the answer is written inline;
 * otherwise the exchange resumes on the channel's event loop.</p>
 *
 * <h2>Failure isolation</h2>
 * Provider failures, encoding problems and write errors are reported to the
 * {@link QotdObservabilitySink} and affect only the request at hand; the
 * listeners keep running. Writes failing because a channel was closed by
 * shutdown or reconfiguration are expected and only logged at debug level.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} binds the listeners enabled by the configured mode.</li>
 *   <li>{@link #applyConfiguration(QotdServerConfig)} waits (up to 5 s) for
 *       in-flight requests, then closes and rebinds the listeners.</li>
 *   <li>{@link #close()} stops accepting, waits (up to 5 s) for in-flight
 *       requests, cancels the disposal signal and closes everything.</li>
 * </ul>
 * The quiescence waits are best-effort: a request slower than the bound
 * finishes on its own connection after the listeners have been swapped.
 * {@link #close()} called from one of the server's event loop threads (from a
 * provider, say) skips every blocking wait and lets shutdown finish
 * asynchronously.
 */
public final class QotdServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QotdServer.class);

    private static final Duration QUIESCE_TIMEOUT = Duration.ofSeconds(5);

    private final QuoteProvider quoteProvider;
    private final QotdHost host;
    private final InFlightTracker inFlight = new InFlightTracker();
    private final EventLoopGroup group;
    private final Object lock = new Object();

    private QotdServerConfig config;
    private volatile QotdServerState state = QotdServerState.IDLE;
    private volatile Channel streamChannel;
    private volatile Channel datagramChannel;

    public QotdServer(QuoteProvider quoteProvider, QotdServerConfig config) {
        this(quoteProvider, config, new Slf4jQotdObservabilitySink());
    }

    public QotdServer(QuoteProvider quoteProvider, QotdServerConfig config, QotdObservabilitySink sink) {
        this.quoteProvider = Objects.requireNonNull(quoteProvider, "quoteProvider");
        this.config = Objects.requireNonNull(config, "config");
        this.host = new QotdHost("QotdServer", config.host(), sink);
        this.group = new NioEventLoopGroup();
    }

    /**
     * Bind the listeners enabled by the current configuration.
     *
     * @throws IllegalStateException if the server was already started or closed
     * @throws UncheckedIOException  if a listener cannot be bound
     */
    public void start() {
        synchronized (lock) {
            if (state != QotdServerState.IDLE) {
                throw new IllegalStateException("QotdServer cannot start from state " + state);
            }
            try {
                listen(config);
            } catch (RuntimeException e) {
                closeListeners();
                throw e;
            }
            state = QotdServerState.LISTENING;
        }
    }

    /**
     * Replace the server settings. When listening, waits for in-flight requests
     * (best-effort, up to 5 s) and rebinds both listeners per the new mode and
     * ports; before {@link #start()} the snapshot is only recorded.
     *
     * @throws HostDisposedException if the server is closed
     * @throws UncheckedIOException if a listener cannot be bound
     */
    public void applyConfiguration(QotdServerConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        synchronized (lock) {
            if (state == QotdServerState.DRAINING || state == QotdServerState.DISPOSED) {
                throw new HostDisposedException(host.name());
            }
            host.apply(newConfig.host());
            config = newConfig;
            if (state == QotdServerState.LISTENING) {
                listen(newConfig);
            }
        }
    }

    /**
     * Stop accepting requests, drain, and release all transport resources.
     * Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (state == QotdServerState.DRAINING || state == QotdServerState.DISPOSED) {
                return;
            }
            state = QotdServerState.DRAINING;
            inFlight.beginDraining();
            stopReading(streamChannel);
            stopReading(datagramChannel);
        }

        boolean onEventLoop = onOwnEventLoop();
        if (onEventLoop) {
            log.debug("QotdServer closed from its own event loop, not waiting for {} request(s)", inFlight.count());
        } else if (!inFlight.awaitIdle(QUIESCE_TIMEOUT)) {
            log.warn("QotdServer closing with {} request(s) still in flight", inFlight.count());
        }
        host.dispose();

        synchronized (lock) {
            closeListeners();
            state = QotdServerState.DISPOSED;
        }
        Future<?> terminated = group.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        if (!onEventLoop) {
            terminated.awaitUninterruptibly();
        }
    }

    public QotdServerState state() {
        return state;
    }

    public QotdServerConfig config() {
        synchronized (lock) {
            return config;
        }
    }

    public QotdServerMode mode() {
        return config().mode();
    }

    /**
     * Local address of the TCP listener, or {@code null} if none is bound.
     */
    public InetSocketAddress streamAddress() {
        Channel ch = streamChannel;
        return ch != null ? (InetSocketAddress) ch.localAddress() : null;
    }

    /**
     * Local address of the UDP channel, or {@code null} if none is bound.
     */
    public InetSocketAddress datagramAddress() {
        Channel ch = datagramChannel;
        return ch != null ? (InetSocketAddress) ch.localAddress() : null;
    }

    public int inFlightCount() {
        return inFlight.count();
    }

    // -------------------------------------------------------------------------
    // Listener management (caller holds lock)
    // -------------------------------------------------------------------------

    private void listen(QotdServerConfig cfg) {
        awaitQuiescence();
        Channel oldDatagram = datagramChannel;
        datagramChannel = null;
        closeListener(oldDatagram, Protocol.DATAGRAM);
        if (cfg.mode().datagramEnabled()) {
            datagramChannel = bindDatagram(cfg);
        }

        awaitQuiescence();
        Channel oldStream = streamChannel;
        streamChannel = null;
        closeListener(oldStream, Protocol.STREAM);
        if (cfg.mode().streamEnabled()) {
            streamChannel = bindStream(cfg);
        }
    }

    private void awaitQuiescence() {
        if (!inFlight.awaitIdle(QUIESCE_TIMEOUT)) {
            log.debug("Reconfiguring with {} request(s) still in flight", inFlight.count());
        }
    }

    private Channel bindDatagram(QotdServerConfig cfg) {
        InternetProtocolFamily family = cfg.dualStack() ? InternetProtocolFamily.IPv6 : InternetProtocolFamily.IPv4;

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channelFactory((ChannelFactory<NioDatagramChannel>) () -> new NioDatagramChannel(family))
            .handler(new DatagramRequestHandler());

        return bind(bootstrap.bind(wildcard(cfg.dualStack(), cfg.datagramPort())), Protocol.DATAGRAM);
    }

    private Channel bindStream(QotdServerConfig cfg) {
        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(group)
            .channel(NioServerSocketChannel.class)
            .option(ChannelOption.SO_REUSEADDR, true)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline().addLast(new StreamRequestHandler());
                }
            });

        return bind(bootstrap.bind(wildcard(cfg.dualStack(), cfg.streamPort())), Protocol.STREAM);
    }

    private Channel bind(ChannelFuture future, Protocol protocol) {
        future.awaitUninterruptibly();
        if (!future.isSuccess()) {
            Throwable cause = future.cause();
            String message = "Failed to bind " + protocol + " listener";
            host.reportError(QotdErrorEvent.Kind.TRANSPORT_FAILURE, message, cause);
            if (cause instanceof IOException io) {
                throw new UncheckedIOException(message, io);
            }
            throw new IllegalStateException(message, cause);
        }

        Channel channel = future.channel();
        host.reportTransport(new QotdTransportEvent.ListenerBound(host.wallClock().now(), protocol, channel.localAddress()));
        return channel;
    }

    private void closeListeners() {
        Channel datagram = datagramChannel;
        datagramChannel = null;
        closeListener(datagram, Protocol.DATAGRAM);

        Channel stream = streamChannel;
        streamChannel = null;
        closeListener(stream, Protocol.STREAM);
    }

    private void closeListener(Channel channel, Protocol protocol) {
        if (channel == null) {
            return;
        }
        SocketAddress local = channel.localAddress();
        ChannelFuture closed = channel.close();
        if (!onOwnEventLoop()) {
            closed.awaitUninterruptibly();
        }
        host.reportTransport(new QotdTransportEvent.ListenerClosed(host.wallClock().now(), protocol, local));
    }

    private boolean onOwnEventLoop() {
        for (EventExecutor executor : group) {
            if (executor.inEventLoop()) {
                return true;
            }
        }
        return false;
    }

    private static void stopReading(Channel channel) {
        if (channel != null) {
            channel.config().setAutoRead(false);
        }
    }

    private static InetSocketAddress wildcard(boolean dualStack, int port) {
        return new InetSocketAddress(dualStack ? "::" : "0.0.0.0", port);
    }

    // -------------------------------------------------------------------------
    // Request handling
    // -------------------------------------------------------------------------

    private void accept(Channel channel, Protocol protocol, InetSocketAddress remote) {
        if (remote == null) {
            // Connection reset before it could be served.
            if (protocol == Protocol.STREAM) {
                channel.close();
            }
            return;
        }

        host.reportTransport(new QotdTransportEvent.RequestReceived(host.wallClock().now(), protocol, remote));

        if (!inFlight.tryEnter()) {
            if (protocol == Protocol.STREAM) {
                channel.close();
            }
            return;
        }

        PendingExchange exchange = new PendingExchange(protocol, channel, remote, host.codec(), host, inFlight);
        try {
            queryProvider(exchange);
        } catch (RuntimeException e) {
            host.reportError(QotdErrorEvent.Kind.UNEXPECTED, "Unexpected failure handling request from " + remote, e);
            exchange.finish();
        }
    }

    private void queryProvider(PendingExchange exchange) {
        CompletableFuture<String> quote;
        try {
            quote = quoteProvider
                .getQuote(exchange.remoteAddress().getAddress(), host.disposalSignal())
                .toCompletableFuture();
        } catch (RuntimeException e) {
            reportProviderFailure(exchange, e);
            exchange.finish();
            return;
        }

        if (quote.isDone()) {
            respond(exchange, quote);
            return;
        }

        quote.whenComplete((q, e) -> {
            try {
                exchange.channel().eventLoop().execute(() -> respond(exchange, quote));
            } catch (RejectedExecutionException rejected) {
                log.debug("Event loop shut down before the quote for {} arrived", exchange.remoteAddress());
                exchange.finish();
            }
        });
    }

    private void respond(PendingExchange exchange, CompletableFuture<String> quote) {
        try {
            String text;
            try {
                text = quote.join();
            } catch (CompletionException | CancellationException e) {
                reportProviderFailure(exchange, e instanceof CompletionException && e.getCause() != null ? e.getCause() : e);
                exchange.finish();
                return;
            }

            if (text == null) {
                exchange.finish();
                return;
            }

            Optional<EncodedQuote> encoded = exchange.codec().encode(text);
            if (encoded.isEmpty()) {
                exchange.finish();
                return;
            }
            exchange.attach(encoded.get());
            write(exchange);
        } catch (RuntimeException e) {
            host.reportError(QotdErrorEvent.Kind.UNEXPECTED,
                "Unexpected failure answering " + exchange.remoteAddress(), e);
            exchange.finish();
        }
    }

    private void write(PendingExchange exchange) {
        EncodedQuote encoded = exchange.encoded();
        Channel channel = exchange.channel();

        Object message = Unpooled.wrappedBuffer(encoded.buffer(), 0, encoded.length());
        if (exchange.protocol() == Protocol.DATAGRAM) {
            message = new DatagramPacket((ByteBuf) message, exchange.remoteAddress());
        }

        channel.writeAndFlush(message).addListener(future -> {
            try {
                if (future.isSuccess()) {
                    host.reportTransport(new QotdTransportEvent.ResponseSent(
                        host.wallClock().now(), exchange.protocol(), exchange.remoteAddress(), encoded.length()));
                } else {
                    reportTransportFailure(channel, "Failed to send quote to " + exchange.remoteAddress(), future.cause());
                }
            } finally {
                exchange.finish();
            }
        });
    }

    private void reportProviderFailure(PendingExchange exchange, Throwable cause) {
        host.reportError(QotdErrorEvent.Kind.PROVIDER_FAILURE,
            "Quote provider failed for " + exchange.remoteAddress(), cause);
    }

    private void reportTransportFailure(Channel channel, String message, Throwable cause) {
        if (isShutdownRace(channel, cause)) {
            log.debug("{} (channel closed by shutdown or reconfiguration)", message);
            return;
        }
        host.reportError(QotdErrorEvent.Kind.TRANSPORT_FAILURE, message, cause);
    }

    /**
     * A closed channel is expected while draining, and for channels that a
     * reconfiguration has already replaced.
     */
    private boolean isShutdownRace(Channel channel, Throwable cause) {
        if (!(cause instanceof ClosedChannelException)) {
            return false;
        }
        if (inFlight.isDraining()) {
            return true;
        }
        Channel listener = channel.parent() != null ? channel.parent() : channel;
        return listener != streamChannel && listener != datagramChannel;
    }

    /**
     * Handler for one accepted TCP connection. The quote is sent as soon as the
     * connection is active; anything the peer sends is discarded.
     */
    private final class StreamRequestHandler extends ChannelInboundHandlerAdapter {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            Channel channel = ctx.channel();
            accept(channel, Protocol.STREAM, (InetSocketAddress) channel.remoteAddress());
            ctx.fireChannelActive();
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            ReferenceCountUtil.release(msg);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            reportTransportFailure(ctx.channel(), "Connection error with " + ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }

    /**
     * Handler for the UDP channel. Every datagram, whatever its content, is a
     * request; the channel keeps reading while the answer is prepared.
     */
    private final class DatagramRequestHandler extends SimpleChannelInboundHandler<DatagramPacket> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
            accept(ctx.channel(), Protocol.DATAGRAM, packet.sender());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            // The datagram channel stays open: one bad exchange must not stop the listener.
            reportTransportFailure(ctx.channel(), "Datagram listener error", cause);
        }
    }
}
