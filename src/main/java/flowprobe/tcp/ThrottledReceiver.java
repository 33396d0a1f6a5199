package flowprobe.tcp;

import flowprobe.common.TrialConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TCP receiver that emulates a slow consumer:
 *  - listens on the trial port with the requested SO_RCVBUF (listener and accepted socket)
 *  - accepts one connection
 *  - sleeps readDelayMillis, then reads at most readChunkBytes, until stopped
 *
 * Runs on its own thread. {@link #start(long)} returns once the listener is bound.
 * Accept timeout, reset and EOF all end the read loop normally; the byte count up to
 * that point is the measurement.
 */
public class ThrottledReceiver implements Runnable, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ThrottledReceiver.class);

    private final int port;
    private final TrialConfig config;
    private final long acceptTimeoutMillis;

    private final CompletableFuture<Integer> ready = new CompletableFuture<>();
    private final AtomicLong bytesRead = new AtomicLong();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private volatile boolean running = true;

    private volatile ServerSocketChannel serverChannel;
    private volatile SocketChannel channel;
    private volatile int effectiveReceiveBufferBytes;
    private volatile int boundPort = -1;
    private volatile String terminationReason = "";
    private Thread thread;

    public ThrottledReceiver(int port, TrialConfig config, long acceptTimeoutMillis) {
        this.port = port;
        this.config = config;
        this.acceptTimeoutMillis = acceptTimeoutMillis;
    }

    /**
     * Starts the receiver thread and waits until the listener is bound.
     *
     * @throws IOException if the port cannot be bound or the listener is not ready in time
     */
    public void start(long readyTimeoutMillis) throws IOException {
        if (thread != null) throw new IllegalStateException("receiver already started");
        thread = new Thread(this, "throttled-receiver-" + port);
        thread.setDaemon(true);
        thread.start();
        try {
            int listenerBuffer = ready.get(readyTimeoutMillis, TimeUnit.MILLISECONDS);
            logger.debug("Receiver listening on port {} (SO_RCVBUF requested={} effective={})",
                    boundPort, config.getReceiveBufferBytes(), listenerBuffer);
        } catch (ExecutionException e) {
            stop(readyTimeoutMillis);
            Throwable cause = e.getCause();
            if (cause instanceof IOException) throw (IOException) cause;
            throw new IOException("receiver failed to start on port " + port, cause);
        } catch (TimeoutException e) {
            stop(readyTimeoutMillis);
            throw new IOException("receiver not listening on port " + port + " after " + readyTimeoutMillis + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop(readyTimeoutMillis);
            throw new InterruptedIOException("interrupted while starting receiver");
        }
    }

    @Override
    public void run() {
        ServerSocketChannel ssc;
        try {
            ssc = ServerSocketChannel.open();
            serverChannel = ssc;
            ssc.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            if (config.getReceiveBufferBytes() > 0) {
                // the kernel may clamp or double this; whatever it grants is accepted
                ssc.setOption(StandardSocketOptions.SO_RCVBUF, config.getReceiveBufferBytes());
            }
            ssc.bind(new InetSocketAddress(port), 1);
            boundPort = ((InetSocketAddress) ssc.getLocalAddress()).getPort();
            effectiveReceiveBufferBytes = ssc.getOption(StandardSocketOptions.SO_RCVBUF);
        } catch (IOException | RuntimeException e) {
            closeChannels();
            ready.completeExceptionally(e);
            return;
        }
        ready.complete(effectiveReceiveBufferBytes);

        try {
            SocketChannel sc = awaitConnection(ssc);
            if (sc == null) {
                terminationReason = running ? "accept timeout" : "stopped";
                return;
            }
            channel = sc;
            if (config.getReceiveBufferBytes() > 0) {
                sc.setOption(StandardSocketOptions.SO_RCVBUF, config.getReceiveBufferBytes());
            }
            effectiveReceiveBufferBytes = sc.getOption(StandardSocketOptions.SO_RCVBUF);
            logger.debug("Receiver accepted {} (SO_RCVBUF effective={})", sc.getRemoteAddress(), effectiveReceiveBufferBytes);
            readLoop(sc);
        } catch (ClosedChannelException e) {
            terminationReason = "stopped";
        } catch (IOException e) {
            terminationReason = String.valueOf(e.getMessage());
            logger.debug("Receiver read loop ended: {}", e.toString());
        } catch (InterruptedException e) {
            terminationReason = "stopped";
            Thread.currentThread().interrupt();
        } finally {
            closeChannels();
        }
    }

    private SocketChannel awaitConnection(ServerSocketChannel ssc) throws IOException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(acceptTimeoutMillis);
        ssc.configureBlocking(false);
        try (Selector selector = Selector.open()) {
            ssc.register(selector, SelectionKey.OP_ACCEPT);
            while (running && System.nanoTime() < deadline) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                selector.select(Math.max(1, Math.min(200, remainingMs)));
                for (SelectionKey key : selector.selectedKeys()) {
                    if (key.isValid() && key.isAcceptable()) {
                        SocketChannel sc = ssc.accept();
                        if (sc != null) {
                            sc.configureBlocking(true);
                            return sc;
                        }
                    }
                }
                selector.selectedKeys().clear();
            }
        }
        return null;
    }

    private void readLoop(SocketChannel sc) throws IOException, InterruptedException {
        long delayNanos = (long) (config.getReadDelayMillis() * 1_000_000L);
        int chunk = config.getReadChunkBytes();
        if (chunk == 0) {
            // a receiver that never reads: hold the connection open until stopped
            while (running) TimeUnit.MILLISECONDS.sleep(50);
            terminationReason = "stopped";
            return;
        }
        ByteBuffer buf = ByteBuffer.allocate(chunk);
        while (running) {
            if (delayNanos > 0) TimeUnit.NANOSECONDS.sleep(delayNanos);
            buf.clear();
            int n = sc.read(buf);
            if (n < 0) {
                terminationReason = "eof";
                return;
            }
            bytesRead.addAndGet(n);
        }
        terminationReason = "stopped";
    }

    /**
     * Stops the read loop, closes the connection and listener, and waits at most
     * {@code joinTimeoutMillis} for the thread to exit. Safe to call more than once.
     */
    public void stop(long joinTimeoutMillis) {
        if (!stopped.compareAndSet(false, true)) return;
        running = false;
        closeChannels();
        Thread t = thread;
        if (t == null || t == Thread.currentThread()) return;
        t.interrupt();
        try {
            t.join(joinTimeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            logger.warn("Receiver thread {} did not exit within {}ms", t.getName(), joinTimeoutMillis);
        }
    }

    @Override
    public void close() {
        stop(2000);
    }

    private void closeChannels() {
        SocketChannel sc = channel;
        if (sc != null) {
            try { sc.close(); } catch (IOException e) { logger.debug("closing receiver connection: {}", e.toString()); }
        }
        ServerSocketChannel ssc = serverChannel;
        if (ssc != null) {
            try { ssc.close(); } catch (IOException e) { logger.debug("closing receiver listener: {}", e.toString()); }
        }
    }

    public long getBytesRead() { return bytesRead.get(); }

    /** SO_RCVBUF as granted by the OS; the accepted socket's value once connected. */
    public int getEffectiveReceiveBufferBytes() { return effectiveReceiveBufferBytes; }

    /** The bound port, useful when constructed with port 0. -1 before binding. */
    public int getLocalPort() { return boundPort; }

    public String getTerminationReason() { return terminationReason; }

    public boolean isStopped() { return stopped.get(); }
}
