package com.questrail.spe.config;

import com.questrail.spe.codec.HeaderLayout;
import com.questrail.spe.observability.Slf4jSpeObservabilitySink;
import com.questrail.spe.observability.SpeObservabilitySink;

import java.util.Objects;

/**
 * Options for a {@code SpeReader}.
 *
 * @param strict             check the legacy sentinel values in the header
 * @param withCalibration    attach calibration coordinates to each region
 * @param maxRoiCount        upper bound on the declared ROI count (1..10)
 * @param parallelism        number of threads decoding disjoint frame ranges
 * @param observabilitySink  receiver of decode events
 */
public record SpeReaderConfig(
    boolean strict,
    boolean withCalibration,
    int maxRoiCount,
    int parallelism,
    SpeObservabilitySink observabilitySink
) {
    public SpeReaderConfig {
        if (maxRoiCount < 1 || maxRoiCount > HeaderLayout.ROI_TABLE_CAPACITY) {
            throw new IllegalArgumentException("maxRoiCount must be 1.." + HeaderLayout.ROI_TABLE_CAPACITY
                + ", got " + maxRoiCount);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        }
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static SpeReaderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean strict = true;
        private boolean withCalibration = true;
        private int maxRoiCount = HeaderLayout.ROI_TABLE_CAPACITY;
        private int parallelism = 1;
        private SpeObservabilitySink observabilitySink;

        public Builder withStrict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder withCalibration(boolean withCalibration) {
            this.withCalibration = withCalibration;
            return this;
        }

        public Builder withMaxRoiCount(int maxRoiCount) {
            this.maxRoiCount = maxRoiCount;
            return this;
        }

        public Builder withParallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder withObservabilitySink(SpeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public SpeReaderConfig build() {
            return new SpeReaderConfig(
                strict,
                withCalibration,
                maxRoiCount,
                parallelism,
                observabilitySink != null ? observabilitySink : new Slf4jSpeObservabilitySink());
        }
    }
}
