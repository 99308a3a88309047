package work.bindlang.engine;

import java.util.Objects;

/**
 * Tunables for cascades and payload conventions.
 *
 * @param maxRounds      round cap for one sweep
 * @param maxTurns       macro-round cap for {@link BindingEngine#evolveUntilConverged}
 * @param applyMutations whether sweeps apply declared state mutations between rounds
 * @param mutationKey    payload key holding the state-mutation map
 * @param weightKey      payload key overriding the default weight
 */
public record EngineSettings(int maxRounds, int maxTurns, boolean applyMutations, String mutationKey, String weightKey) {
    public static final int DEFAULT_MAX_ROUNDS = 10;
    public static final int DEFAULT_MAX_TURNS = 10;
    public static final String DEFAULT_MUTATION_KEY = "state_mutation";
    public static final String DEFAULT_WEIGHT_KEY = "weight";

    public EngineSettings {
        if (maxRounds < 0) {
            throw new IllegalArgumentException("maxRounds must be >= 0");
        }
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be >= 1");
        }
        Objects.requireNonNull(mutationKey, "mutationKey");
        Objects.requireNonNull(weightKey, "weightKey");
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxRounds(maxRounds)
            .maxTurns(maxTurns)
            .applyMutations(applyMutations)
            .mutationKey(mutationKey)
            .weightKey(weightKey);
    }

    public static final class Builder {
        private int maxRounds = DEFAULT_MAX_ROUNDS;
        private int maxTurns = DEFAULT_MAX_TURNS;
        private boolean applyMutations = true;
        private String mutationKey = DEFAULT_MUTATION_KEY;
        private String weightKey = DEFAULT_WEIGHT_KEY;

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder maxTurns(int maxTurns) {
            this.maxTurns = maxTurns;
            return this;
        }

        public Builder applyMutations(boolean applyMutations) {
            this.applyMutations = applyMutations;
            return this;
        }

        public Builder mutationKey(String mutationKey) {
            this.mutationKey = mutationKey;
            return this;
        }

        public Builder weightKey(String weightKey) {
            this.weightKey = weightKey;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(maxRounds, maxTurns, applyMutations, mutationKey, weightKey);
        }
    }
}
