package flowprobe.tcp;

/**
 * Outcome of one {@link RateLimitedSender#run()}.
 * A sender that never connected reports zero bytes and the connect error.
 * A connected sender whose loop ended on reset or broken pipe still reports what it sent.
 */
public final class SendResult {
    private final boolean connected;
    private final long bytesSent;
    private final long blockedNanos;
    private final long blockCount;
    private final String error;

    SendResult(boolean connected, long bytesSent, long blockedNanos, long blockCount, String error) {
        this.connected = connected;
        this.bytesSent = bytesSent;
        this.blockedNanos = blockedNanos;
        this.blockCount = blockCount;
        this.error = error == null ? "" : error;
    }

    static SendResult notConnected(String error) {
        return new SendResult(false, 0, 0, 0, error);
    }

    public boolean isConnected() { return connected; }
    public long getBytesSent() { return bytesSent; }
    public long getBlockedNanos() { return blockedNanos; }
    public double getBlockedMillis() { return blockedNanos / 1_000_000.0; }
    public long getBlockCount() { return blockCount; }

    /** Empty when the loop ran to its deadline or was stopped on request. */
    public String getError() { return error; }

    @Override
    public String toString() {
        return "SendResult{connected=" + connected + ", bytesSent=" + bytesSent
                + ", blockCount=" + blockCount + ", blockedMs=" + getBlockedMillis()
                + (error.isEmpty() ? "" : ", error=" + error) + "}";
    }
}
