package org.mcts.engine.model;

import org.mcts.engine.model.exceptions.SearchConfigurationException;

/**
 * Immutable parameters of a {@link SearchTree}.  Build with {@link #builder()}; invalid values are rejected by
 * {@link Builder#build()}.
 */
public final class SearchSettings {

    public static final int DEFAULT_SAMPLES = 1000;
    public static final int DEFAULT_MAX_TREE_DEPTH = 10;
    public static final double DEFAULT_EXPLORATION_CONSTANT = 1.0;

    private final int samples;
    private final int maxTreeDepth;
    private final double explorationConstant;
    private final ExtractionMode extractionMode;
    private final long timeLimitMillis;
    private final Long randomSeed;

    private SearchSettings(Builder builder) {
        samples = builder.samples;
        maxTreeDepth = builder.maxTreeDepth;
        explorationConstant = builder.explorationConstant;
        extractionMode = builder.extractionMode;
        timeLimitMillis = builder.timeLimitMillis;
        randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SearchSettings defaults() {
        return builder().build();
    }

    public int getSamples() {
        return samples;
    }

    public int getMaxTreeDepth() {
        return maxTreeDepth;
    }

    public double getExplorationConstant() {
        return explorationConstant;
    }

    public ExtractionMode getExtractionMode() {
        return extractionMode;
    }

    /**
     * @return the wall-clock limit of one search in milliseconds, or 0 when only the sample budget applies.
     */
    public long getTimeLimitMillis() {
        return timeLimitMillis;
    }

    public boolean hasRandomSeed() {
        return randomSeed != null;
    }

    public long getRandomSeed() {
        if (randomSeed == null) {
            throw new IllegalStateException("No random seed configured");
        }
        return randomSeed;
    }

    @Override
    public String toString() {
        return "SearchSettings[samples=" + samples +
                ", maxTreeDepth=" + maxTreeDepth +
                ", explorationConstant=" + explorationConstant +
                ", extractionMode=" + extractionMode +
                ", timeLimitMillis=" + timeLimitMillis +
                ", randomSeed=" + randomSeed + "]";
    }

    public static final class Builder {

        private int samples = DEFAULT_SAMPLES;
        private int maxTreeDepth = DEFAULT_MAX_TREE_DEPTH;
        private double explorationConstant = DEFAULT_EXPLORATION_CONSTANT;
        private ExtractionMode extractionMode = ExtractionMode.GREEDY;
        private long timeLimitMillis = 0;
        private Long randomSeed = null;

        private Builder() {
        }

        public Builder samples(int samples) {
            this.samples = samples;
            return this;
        }

        public Builder maxTreeDepth(int maxTreeDepth) {
            this.maxTreeDepth = maxTreeDepth;
            return this;
        }

        public Builder explorationConstant(double explorationConstant) {
            this.explorationConstant = explorationConstant;
            return this;
        }

        public Builder extractionMode(ExtractionMode extractionMode) {
            this.extractionMode = extractionMode;
            return this;
        }

        public Builder timeLimitMillis(long timeLimitMillis) {
            this.timeLimitMillis = timeLimitMillis;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public SearchSettings build() {
            if (samples <= 0) {
                throw new SearchConfigurationException("The number of samples must be positive, got " + samples);
            }
            if (maxTreeDepth <= 1) {
                throw new SearchConfigurationException("The maximum tree depth must exceed 1, got " + maxTreeDepth);
            }
            if (!(explorationConstant >= 0) || Double.isInfinite(explorationConstant)) {
                throw new SearchConfigurationException(
                        "The exploration constant must be finite and non-negative, got " + explorationConstant);
            }
            if (extractionMode == null) {
                throw new SearchConfigurationException("An extraction mode is required");
            }
            if (timeLimitMillis < 0) {
                throw new SearchConfigurationException("The time limit must not be negative, got " + timeLimitMillis);
            }
            return new SearchSettings(this);
        }
    }
}
