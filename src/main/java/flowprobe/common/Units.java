package flowprobe.common;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Formatting helpers shared by log output and the result store.
 */
public final class Units {

    private Units() {
    }

    public static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + "B";
        if (bytes < 1024 * 1024) return formatNumber(bytes / 1024.0) + "KB";
        if (bytes < 1024L * 1024 * 1024) return formatNumber(bytes / (1024.0 * 1024.0)) + "MB";
        return formatNumber(bytes / (1024.0 * 1024.0 * 1024.0)) + "GB";
    }

    public static String formatRate(double bytesPerSec) {
        if (Double.isInfinite(bytesPerSec)) return "unbounded";
        if (bytesPerSec < 1024) return formatNumber(bytesPerSec) + "B/s";
        if (bytesPerSec < 1024 * 1024) return formatNumber(bytesPerSec / 1024.0) + "KB/s";
        return formatNumber(bytesPerSec / (1024.0 * 1024.0)) + "MB/s";
    }

    /**
     * Shortest readable rendering: integral values lose the ".0", others keep up to 3 decimals.
     * Infinities render as "inf" so the CSV stays parseable by common analysis tools.
     */
    public static String formatNumber(double v) {
        if (Double.isNaN(v)) return "nan";
        if (Double.isInfinite(v)) return v > 0 ? "inf" : "-inf";
        if (v == Math.rint(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        String s = String.format(Locale.ROOT, "%.3f", v);
        s = s.replaceAll("0+$", "");
        return s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
    }

    public static String formatBytesList(List<Integer> sizes) {
        return sizes.stream().map(Units::formatBytes).collect(Collectors.joining(", ", "[", "]"));
    }
}
