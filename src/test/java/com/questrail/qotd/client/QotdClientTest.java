package com.questrail.qotd.client;

import com.questrail.qotd.host.HostDisposedException;
import com.questrail.qotd.host.QotdHostConfig;
import com.questrail.qotd.internal.time.CancellationSignal;
import com.questrail.qotd.observability.RecordingObservabilitySink;
import com.questrail.qotd.server.QotdServer;
import com.questrail.qotd.server.QotdServerConfig;
import com.questrail.qotd.server.QotdServerMode;
import com.questrail.qotd.test.TestQuoteProvider;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class QotdClientTest {

    private static final InetAddress LOOPBACK = InetAddress.getLoopbackAddress();

    private RecordingObservabilitySink sink;
    private QotdServer server;
    private QotdClient client;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.close();
        }
    }

    private QotdServer startServer(TestQuoteProvider provider, QotdServerMode mode) {
        server = new QotdServer(provider, QotdServerConfig.builder()
            .withMode(mode)
            .withPort(0)
            .withDualStack(false)
            .build(), sink);
        server.start();
        return server;
    }

    private static QotdClientConfig clientConfig(QotdClientMode mode, int port) {
        return QotdClientConfig.builder()
            .withMode(mode)
            .withEndpoint(LOOPBACK, port)
            .build();
    }

    private QotdClient client(QotdClientMode mode, int port) {
        client = new QotdClient(clientConfig(mode, port), sink);
        return client;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() < deadline, "condition not reached in time");
            Thread.sleep(5);
        }
    }

    /**
     * Accepts a single TCP connection on loopback and hands it to {@code handler}.
     */
    private static ServerSocket fakeStreamServer(SocketHandler handler) throws IOException {
        ServerSocket listener = new ServerSocket(0, 1, LOOPBACK);
        CompletableFuture.runAsync(() -> {
            try (Socket socket = listener.accept()) {
                handler.handle(socket);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        return listener;
    }

    @FunctionalInterface
    private interface SocketHandler {
        void handle(Socket socket) throws IOException;
    }

    @Test
    void streamRequestReturnsTheQuote() throws Exception {
        startServer(new TestQuoteProvider(), QotdServerMode.STREAM);
        client(QotdClientMode.STREAM, server.streamAddress().getPort());

        assertEquals(TestQuoteProvider.QUOTE, client.requestQuote().get(5, TimeUnit.SECONDS));
        assertEquals(0, client.inFlightCount());
    }

    @Test
    void datagramRequestWaitsForADelayedProvider() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofMillis(200)), QotdServerMode.DATAGRAM);
        client(QotdClientMode.DATAGRAM, server.datagramAddress().getPort());

        assertEquals(TestQuoteProvider.QUOTE, client.requestQuote().get(5, TimeUnit.SECONDS));
    }

    @Test
    void elapsedTimeoutCancelsTheRequest() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofSeconds(1)), QotdServerMode.STREAM);
        client(QotdClientMode.STREAM, server.streamAddress().getPort());

        long before = System.nanoTime();
        CompletableFuture<String> quote = client.requestQuote(Duration.ofMillis(1));

        assertThrows(CancellationException.class, () -> quote.get(5, TimeUnit.SECONDS));
        assertTrue(System.nanoTime() - before < TimeUnit.MILLISECONDS.toNanos(900));
        awaitCondition(() -> client.inFlightCount() == 0);
    }

    @Test
    void zeroTimeoutUsesTheConfiguredDefault() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofSeconds(1)), QotdServerMode.DATAGRAM);
        client = new QotdClient(QotdClientConfig.builder()
            .withMode(QotdClientMode.DATAGRAM)
            .withEndpoint(LOOPBACK, server.datagramAddress().getPort())
            .withDefaultTimeout(Duration.ofMillis(50))
            .build(), sink);

        CompletableFuture<String> quote = client.requestQuote(Duration.ZERO);

        assertThrows(CancellationException.class, () -> quote.get(5, TimeUnit.SECONDS));
    }

    @Test
    void timeoutBeyondTheTimerRangeStillWaitsForTheQuote() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofMillis(200)), QotdServerMode.DATAGRAM);
        client(QotdClientMode.DATAGRAM, server.datagramAddress().getPort());

        CompletableFuture<String> quote = client.requestQuote(Duration.ofDays(365L * 1000));

        assertEquals(TestQuoteProvider.QUOTE, quote.get(5, TimeUnit.SECONDS));
        awaitCondition(() -> client.inFlightCount() == 0);
    }

    @Test
    void cancelledTokenCancelsTheRequest() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofSeconds(1)), QotdServerMode.STREAM);
        client(QotdClientMode.STREAM, server.streamAddress().getPort());
        CancellationSignal token = new CancellationSignal();

        CompletableFuture<String> quote = client.requestQuote(Duration.ofSeconds(-1), token);
        token.cancel();

        assertThrows(CancellationException.class, () -> quote.get(5, TimeUnit.SECONDS));
        assertTrue(quote.isCancelled());
    }

    @Test
    void alreadyCancelledTokenCompletesImmediately() {
        client(QotdClientMode.STREAM, 17);
        CancellationSignal token = new CancellationSignal();
        token.cancel();

        CompletableFuture<String> quote = client.requestQuote(Duration.ZERO, token);

        assertTrue(quote.isDone());
        assertTrue(quote.isCancelled());
        assertEquals(0, client.inFlightCount());
    }

    @Test
    void cancellingTheFutureEndsTheRequest() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofSeconds(1)), QotdServerMode.STREAM);
        client(QotdClientMode.STREAM, server.streamAddress().getPort());

        CompletableFuture<String> quote = client.requestQuote(Duration.ofSeconds(-1));
        assertTrue(quote.cancel(true));

        awaitCondition(() -> client.inFlightCount() == 0);
    }

    @Test
    void refusedConnectionSurfacesTheTransportError() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0, 1, LOOPBACK)) {
            port = probe.getLocalPort();
        }
        client(QotdClientMode.STREAM, port);

        ExecutionException thrown = assertThrows(ExecutionException.class,
            () -> client.requestQuote().get(5, TimeUnit.SECONDS));
        assertInstanceOf(ConnectException.class, thrown.getCause());
    }

    @Test
    void emptyResponseIsInvalid() throws Exception {
        try (ServerSocket fake = fakeStreamServer(socket -> { })) {
            client(QotdClientMode.STREAM, fake.getLocalPort());

            ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> client.requestQuote().get(5, TimeUnit.SECONDS));
            assertInstanceOf(InvalidQuoteException.class, thrown.getCause());
        }
    }

    @Test
    void undecodableResponseIsInvalid() throws Exception {
        try (ServerSocket fake = fakeStreamServer(socket ->
                socket.getOutputStream().write(new byte[] { 'o', 'k', (byte) 0xFF }))) {
            client(QotdClientMode.STREAM, fake.getLocalPort());

            ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> client.requestQuote().get(5, TimeUnit.SECONDS));
            assertInstanceOf(InvalidQuoteException.class, thrown.getCause());
        }
    }

    @Test
    void streamResponseSplitAcrossWritesIsReassembled() throws Exception {
        try (ServerSocket fake = fakeStreamServer(socket -> {
            OutputStream out = socket.getOutputStream();
            out.write("Part one, ".getBytes(StandardCharsets.US_ASCII));
            out.flush();
            sleepQuietly(50);
            out.write("part two.".getBytes(StandardCharsets.US_ASCII));
        })) {
            client(QotdClientMode.STREAM, fake.getLocalPort());

            assertEquals("Part one, part two.", client.requestQuote().get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void streamResponseStopsWhenTheBufferIsFull() throws Exception {
        byte[] oversized = new byte[600];
        Arrays.fill(oversized, (byte) 'a');
        try (ServerSocket fake = fakeStreamServer(socket -> {
            socket.getOutputStream().write(oversized);
            // Keep the connection open until the client hangs up
            InputStream in = socket.getInputStream();
            while (in.read() != -1) {
                // drain
            }
        })) {
            client(QotdClientMode.STREAM, fake.getLocalPort());

            String quote = client.requestQuote().get(5, TimeUnit.SECONDS);
            assertEquals(QotdHostConfig.DEFAULT_MAXIMUM_QUOTE_LENGTH, quote.length());
        }
    }

    @Test
    void datagramFromAnotherSenderIsIgnored() throws Exception {
        try (DatagramSocket genuine = new DatagramSocket(0, LOOPBACK);
             DatagramSocket impostor = new DatagramSocket(0, LOOPBACK)) {
            genuine.setSoTimeout(5000);
            CompletableFuture<Void> fakeServer = CompletableFuture.runAsync(() -> {
                try {
                    DatagramPacket request = new DatagramPacket(new byte[16], 16);
                    genuine.receive(request);
                    byte[] fake = "Impostor".getBytes(StandardCharsets.US_ASCII);
                    impostor.send(new DatagramPacket(fake, fake.length, request.getSocketAddress()));
                    byte[] real = "Genuine".getBytes(StandardCharsets.US_ASCII);
                    genuine.send(new DatagramPacket(real, real.length, request.getSocketAddress()));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            client(QotdClientMode.DATAGRAM, genuine.getLocalPort());

            assertEquals("Genuine", client.requestQuote().get(5, TimeUnit.SECONDS));
            fakeServer.get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void newConfigurationAppliesOnlyToLaterRequests() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofMillis(300)), QotdServerMode.BOTH);
        client(QotdClientMode.STREAM, server.streamAddress().getPort());

        CompletableFuture<String> first = client.requestQuote();
        client.applyConfiguration(clientConfig(QotdClientMode.DATAGRAM, server.datagramAddress().getPort()));
        CompletableFuture<String> second = client.requestQuote();

        assertEquals(TestQuoteProvider.QUOTE, first.get(5, TimeUnit.SECONDS));
        assertEquals(TestQuoteProvider.QUOTE, second.get(5, TimeUnit.SECONDS));
        assertEquals(QotdClientMode.DATAGRAM, client.config().mode());
    }

    @Test
    void inFlightRequestKeepsTheLengthBoundItStartedWith() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofMillis(300)), QotdServerMode.DATAGRAM);
        int port = server.datagramAddress().getPort();
        client(QotdClientMode.DATAGRAM, port);

        CompletableFuture<String> quote = client.requestQuote();
        client.applyConfiguration(QotdClientConfig.builder()
            .withMode(QotdClientMode.DATAGRAM)
            .withEndpoint(LOOPBACK, port)
            .withHost(QotdHostConfig.builder().withMaximumQuoteLength(4).build())
            .build());

        assertEquals(TestQuoteProvider.QUOTE, quote.get(5, TimeUnit.SECONDS));
        assertEquals("Test", client.requestQuote().get(5, TimeUnit.SECONDS));
    }

    @Test
    void closeFromACompletionCallbackReturnsPromptly() throws Exception {
        startServer(new TestQuoteProvider(Duration.ofMillis(200)), QotdServerMode.DATAGRAM);
        client(QotdClientMode.DATAGRAM, server.datagramAddress().getPort());
        CompletableFuture<Void> closed = new CompletableFuture<>();

        client.requestQuote().whenComplete((quote, error) -> {
            try {
                client.close();
                closed.complete(null);
            } catch (RuntimeException e) {
                closed.completeExceptionally(e);
            }
        });

        closed.get(2, TimeUnit.SECONDS);
        assertThrows(HostDisposedException.class, () -> client.requestQuote());
    }

    @Test
    void closedClientRejectsRequests() {
        client(QotdClientMode.STREAM, 17);
        client.close();
        client.close();

        assertThrows(HostDisposedException.class, () -> client.requestQuote());
        assertThrows(HostDisposedException.class,
            () -> client.applyConfiguration(clientConfig(QotdClientMode.DATAGRAM, 17)));
    }

    @Test
    void closeCancelsRequestsThatOutliveTheDrain() throws Exception {
        try (ServerSocket fake = fakeStreamServer(socket -> {
            InputStream in = socket.getInputStream();
            while (in.read() != -1) {
                // never answer
            }
        })) {
            client(QotdClientMode.STREAM, fake.getLocalPort());
            CompletableFuture<String> quote = client.requestQuote(Duration.ofSeconds(-1));

            client.close();

            assertThrows(CancellationException.class, () -> quote.get(1, TimeUnit.SECONDS));
        }
    }

    @Test
    void configIsValidated() {
        assertThrows(IllegalArgumentException.class,
            () -> QotdClientConfig.builder().withDefaultTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> QotdClientConfig.builder().withEndpoint(InetSocketAddress.createUnresolved("qotd.example", 17)).build());

        QotdClientConfig defaults = QotdClientConfig.defaults();
        assertEquals(QotdClientMode.STREAM, defaults.mode());
        assertEquals(17, defaults.endpoint().getPort());
        assertEquals(Duration.ofSeconds(5), defaults.defaultTimeout());
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
