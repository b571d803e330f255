package com.questrail.charting.config;

/**
 * Decoder options for the charting notation.
 *
 * <p>The defaults reproduce the behavior expected by existing charted
 * datasets. Tightening either option turns the corresponding leniency into a
 * decode failure.</p>
 *
 * @param allowDirectionlessFaults    accept a bare fault letter (e.g. {@code "n"})
 *                                    as a fault of unknown direction
 * @param rejectUnexpectedSecondServe fail when a second serve code is supplied
 *                                    although the first serve was not a fault
 */
public record ChartingDecoderConfig(
    boolean allowDirectionlessFaults,
    boolean rejectUnexpectedSecondServe
) {
    private static final ChartingDecoderConfig DEFAULTS = builder().build();

    public static ChartingDecoderConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean allowDirectionlessFaults = true;
        private boolean rejectUnexpectedSecondServe = true;

        public Builder withDirectionlessFaults(boolean allowed) {
            this.allowDirectionlessFaults = allowed;
            return this;
        }

        public Builder withRejectUnexpectedSecondServe(boolean reject) {
            this.rejectUnexpectedSecondServe = reject;
            return this;
        }

        public ChartingDecoderConfig build() {
            return new ChartingDecoderConfig(allowDirectionlessFaults, rejectUnexpectedSecondServe);
        }
    }
}
