package com.mouse.scanner.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Rolling average traded volume for one contract.
 * <p>
 * {@link #UNKNOWN} is distinct from a zero average: it means there is not enough history to say what
 * "normal" volume looks like, and any ratio against it is undefined.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BaselineVolume {

    public static final BaselineVolume UNKNOWN = new BaselineVolume(false, 0.0, 0);

    boolean known;
    double averageVolume;
    int sampleCount;

    /**
     * A zero (or negative) average is folded into {@link #UNKNOWN}: a contract with no trading history
     * has no baseline, not an infinite ratio.
     */
    public static BaselineVolume of(double averageVolume, int sampleCount) {
        if (sampleCount <= 0 || !(averageVolume > 0)) {
            return UNKNOWN;
        }
        return new BaselineVolume(true, averageVolume, sampleCount);
    }

    /**
     * @return volume / average, or null when the baseline is unknown
     */
    public Double ratio(long volume) {
        if (!known) {
            return null;
        }
        return volume / averageVolume;
    }
}
