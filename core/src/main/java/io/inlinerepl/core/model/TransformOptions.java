package io.inlinerepl.core.model;

import java.util.Objects;

/**
 * Options of a single transform call. Immutable; use {@link #builder()} to derive variants.
 *
 * @param showTopLevelResults capture values of stray top-level expressions
 * @param loopProtection      guard every loop with an iteration ceiling and a cancellation
 *                            checkpoint
 * @param magicComments       honour {@code //?} marker comments
 * @param showUndefined       report lone {@code undefined} values (affects execution only,
 *                            never the instrumented output)
 * @param internalLogLevel    when not {@link LogLevel#NONE}, assignments and declared
 *                            variables are captured too
 */
public record TransformOptions(
        boolean showTopLevelResults,
        boolean loopProtection,
        boolean magicComments,
        boolean showUndefined,
        LogLevel internalLogLevel) {

    /** Defaults: top-level results on, everything else off. */
    public static final TransformOptions DEFAULTS = builder().build();

    public TransformOptions {
        Objects.requireNonNull(internalLogLevel, "internalLogLevel must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .showTopLevelResults(showTopLevelResults)
                .loopProtection(loopProtection)
                .magicComments(magicComments)
                .showUndefined(showUndefined)
                .internalLogLevel(internalLogLevel);
    }

    /** Run options derived from these transform options. */
    public RunOptions runOptions() {
        return new RunOptions(showUndefined);
    }

    /** Builder for {@link TransformOptions}. */
    public static final class Builder {

        private boolean showTopLevelResults = true;
        private boolean loopProtection = false;
        private boolean magicComments = false;
        private boolean showUndefined = false;
        private LogLevel internalLogLevel = LogLevel.NONE;

        Builder() {}

        public Builder showTopLevelResults(boolean showTopLevelResults) {
            this.showTopLevelResults = showTopLevelResults;
            return this;
        }

        public Builder loopProtection(boolean loopProtection) {
            this.loopProtection = loopProtection;
            return this;
        }

        public Builder magicComments(boolean magicComments) {
            this.magicComments = magicComments;
            return this;
        }

        public Builder showUndefined(boolean showUndefined) {
            this.showUndefined = showUndefined;
            return this;
        }

        public Builder internalLogLevel(LogLevel internalLogLevel) {
            this.internalLogLevel = internalLogLevel;
            return this;
        }

        public TransformOptions build() {
            return new TransformOptions(
                    showTopLevelResults, loopProtection, magicComments, showUndefined, internalLogLevel);
        }
    }
}
