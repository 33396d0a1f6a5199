package flowprobe.experiments;

import flowprobe.common.TrialConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expands parameter ranges into the full list of trial configurations.
 *
 * Order is nested iteration: buffer size outermost, then read delay, then read size,
 * send rate innermost. Same input, same sequence.
 */
public final class ConfigurationSpace {

    private ConfigurationSpace() {
    }

    public static List<TrialConfig> generate(SweepParameters params) {
        params.validate();
        return generate(params.recvBufs, params.delaysMs, params.readSizes, params.sendRatesMbps, params.durationSec);
    }

    public static List<TrialConfig> generate(List<Integer> recvBufs, List<Double> delaysMs,
                                             List<Integer> readSizes, List<Double> sendRatesMbps,
                                             double durationSec) {
        List<TrialConfig> configs = new ArrayList<>(
                recvBufs.size() * delaysMs.size() * readSizes.size() * sendRatesMbps.size());
        for (int recvBuf : recvBufs) {
            for (double delay : delaysMs) {
                for (int readSize : readSizes) {
                    for (double rate : sendRatesMbps) {
                        configs.add(new TrialConfig(recvBuf, delay, readSize, rate, durationSec));
                    }
                }
            }
        }
        return Collections.unmodifiableList(configs);
    }
}
