package org.mcts.engine.model.strategy;

import org.mcts.engine.model.ExtractionMode;

public class PoolOfStrategies<A> {

    private final SelectionStrategy<A> selectionStrategy;
    private final ExpansionStrategy<A> expansionStrategy;
    private final PlayoutStrategy<A> playoutStrategy;
    private final BackPropagationStrategy<A> backPropagationStrategy;
    private final CuttingStrategy<A> cuttingStrategy;
    private final ExtractionStrategy<A> extractionStrategy;

    private PoolOfStrategies(Builder<A> builder, ExtractionMode extractionMode) {
        selectionStrategy = builder.selectionStrategy;
        expansionStrategy = builder.expansionStrategy;
        playoutStrategy = builder.playoutStrategy;
        backPropagationStrategy = builder.backPropagationStrategy;
        cuttingStrategy = builder.cuttingStrategy;
        if (builder.extractionStrategy != null) {
            extractionStrategy = builder.extractionStrategy;
        } else if (extractionMode == ExtractionMode.LOOKAHEAD) {
            extractionStrategy = new LookaheadExtractionStrategy<>();
        } else {
            extractionStrategy = new GreedyExtractionStrategy<>(selectionStrategy);
        }
    }

    public static <A> Builder<A> builder() {
        return new Builder<>();
    }

    public static <A> PoolOfStrategies<A> defaults(ExtractionMode extractionMode) {
        return PoolOfStrategies.<A>builder().build(extractionMode);
    }

    public SelectionStrategy<A> getSelectionStrategy() {
        return selectionStrategy;
    }

    public ExpansionStrategy<A> getExpansionStrategy() {
        return expansionStrategy;
    }

    public PlayoutStrategy<A> getPlayoutStrategy() {
        return playoutStrategy;
    }

    public BackPropagationStrategy<A> getBackPropagationStrategy() {
        return backPropagationStrategy;
    }

    public CuttingStrategy<A> getCuttingStrategy() {
        return cuttingStrategy;
    }

    public ExtractionStrategy<A> getExtractionStrategy() {
        return extractionStrategy;
    }

    public static final class Builder<A> {

        private SelectionStrategy<A> selectionStrategy = new Ucb1SelectionStrategy<>();
        private ExpansionStrategy<A> expansionStrategy = new RandomExpansionStrategy<>();
        private PlayoutStrategy<A> playoutStrategy = new RandomPlayoutStrategy<>();
        private BackPropagationStrategy<A> backPropagationStrategy = new CumulativeBackPropagationStrategy<>();
        private CuttingStrategy<A> cuttingStrategy = new CuttingStrategy<>();
        private ExtractionStrategy<A> extractionStrategy = null;

        private Builder() {
        }

        public Builder<A> selectionStrategy(SelectionStrategy<A> selectionStrategy) {
            this.selectionStrategy = selectionStrategy;
            return this;
        }

        public Builder<A> expansionStrategy(ExpansionStrategy<A> expansionStrategy) {
            this.expansionStrategy = expansionStrategy;
            return this;
        }

        public Builder<A> playoutStrategy(PlayoutStrategy<A> playoutStrategy) {
            this.playoutStrategy = playoutStrategy;
            return this;
        }

        public Builder<A> backPropagationStrategy(BackPropagationStrategy<A> backPropagationStrategy) {
            this.backPropagationStrategy = backPropagationStrategy;
            return this;
        }

        public Builder<A> cuttingStrategy(CuttingStrategy<A> cuttingStrategy) {
            this.cuttingStrategy = cuttingStrategy;
            return this;
        }

        /**
         * Override the extraction strategy that would otherwise follow the settings' {@link ExtractionMode}.
         */
        public Builder<A> extractionStrategy(ExtractionStrategy<A> extractionStrategy) {
            this.extractionStrategy = extractionStrategy;
            return this;
        }

        /**
         * @param extractionMode - the mode used to pick an extraction strategy when none was set explicitly.
         */
        public PoolOfStrategies<A> build(ExtractionMode extractionMode) {
            if (selectionStrategy == null || expansionStrategy == null || playoutStrategy == null ||
                    backPropagationStrategy == null || cuttingStrategy == null) {
                throw new IllegalStateException("Every search phase needs a strategy");
            }
            return new PoolOfStrategies<>(this, extractionMode);
        }
    }
}
