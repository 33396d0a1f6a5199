package flowprobe.tcp;

import flowprobe.common.TrialConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SocketChannel;
import java.util.Arrays;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Blocking TCP client that:
 *  - connects to the receiver
 *  - writes fixed-size chunks paced to the target byte rate for the trial duration
 *  - times every write; a write slower than the block threshold counts as a block
 *
 * Pacing keeps a schedule of send deadlines. Each deadline is the previous scheduled
 * deadline plus the chunk interval, so a stalled write is followed by catch-up sends
 * instead of shifting the whole schedule later.
 *
 * A write that is still blocked when the trial ends is released by closing the channel
 * from a watchdog, so a receiver that stopped reading cannot hold the sender forever.
 */
public class RateLimitedSender {
    private static final Logger logger = LogManager.getLogger(RateLimitedSender.class);

    private final String host;
    private final int port;
    private final TrialConfig config;
    private final int chunkBytes;
    private final long blockThresholdNanos;

    private volatile boolean stopRequested;
    private volatile SocketChannel channel;

    public RateLimitedSender(String host, int port, TrialConfig config, int chunkBytes, long blockThresholdMillis) {
        if (chunkBytes <= 0) throw new IllegalArgumentException("chunkBytes must be > 0: " + chunkBytes);
        this.host = host;
        this.port = port;
        this.config = config;
        this.chunkBytes = chunkBytes;
        this.blockThresholdNanos = TimeUnit.MILLISECONDS.toNanos(blockThresholdMillis);
    }

    /**
     * Nanoseconds between scheduled writes; zero when the target rate is zero,
     * meaning writes are not paced.
     */
    public long targetIntervalNanos() {
        double rate = config.targetSendRateBytesPerSec();
        if (rate <= 0) return 0;
        return (long) (chunkBytes / rate * 1_000_000_000L);
    }

    public SendResult run() {
        SocketChannel ch;
        try {
            ch = SocketChannel.open();
            ch.setOption(StandardSocketOptions.TCP_NODELAY, true);
            channel = ch;
            ch.connect(new InetSocketAddress(host, port));
        } catch (IOException e) {
            closeChannel();
            String detail = "connect to " + host + ":" + port + " failed: " + e;
            logger.debug(detail);
            return SendResult.notConnected(detail);
        }

        byte[] payload = new byte[chunkBytes];
        Arrays.fill(payload, (byte) 'X');
        ByteBuffer data = ByteBuffer.wrap(payload);

        long intervalNanos = targetIntervalNanos();
        long start = System.nanoTime();
        long durationNanos = (long) (config.getDurationSeconds() * 1_000_000_000L);
        long end = start + durationNanos;
        long nextSend = start;

        long bytesSent = 0;
        long blockedNanos = 0;
        long blockCount = 0;
        long writeStart = -1;
        String error = "";

        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sender-watchdog");
            t.setDaemon(true);
            return t;
        });
        ScheduledFuture<?> release = watchdog.schedule(this::closeChannel,
                durationNanos + blockThresholdNanos, TimeUnit.NANOSECONDS);
        try {
            while (!stopRequested) {
                long now = System.nanoTime();
                if (now >= end) break;
                if (now < nextSend) {
                    TimeUnit.NANOSECONDS.sleep(Math.min(nextSend, end) - now);
                    if (System.nanoTime() >= end || stopRequested) break;
                }
                nextSend += intervalNanos;

                data.clear();
                writeStart = System.nanoTime();
                while (data.hasRemaining()) {
                    ch.write(data);
                }
                long elapsed = System.nanoTime() - writeStart;
                writeStart = -1;
                if (elapsed > blockThresholdNanos) {
                    blockedNanos += elapsed;
                    blockCount++;
                }
                bytesSent += chunkBytes;
            }
        } catch (ClosedChannelException e) {
            // released by the watchdog or by requestStop(); a write cut short still counts
            if (writeStart >= 0) {
                long elapsed = System.nanoTime() - writeStart;
                if (elapsed > blockThresholdNanos) {
                    blockedNanos += elapsed;
                    blockCount++;
                }
                bytesSent += data.position();
            }
            logger.debug("Sender write released after deadline/stop");
        } catch (IOException e) {
            error = String.valueOf(e.getMessage());
            logger.debug("Sender loop ended early: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Sender interrupted");
        } finally {
            release.cancel(false);
            watchdog.shutdownNow();
            closeChannel();
        }
        return new SendResult(true, bytesSent, blockedNanos, blockCount, error);
    }

    /**
     * Ends the send loop promptly, including a write currently blocked in the kernel.
     */
    public void requestStop() {
        stopRequested = true;
        closeChannel();
    }

    private void closeChannel() {
        SocketChannel ch = channel;
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            logger.debug("closing sender channel: {}", e.toString());
        }
    }
}
