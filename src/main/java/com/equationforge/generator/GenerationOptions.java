package com.equationforge.generator;

import java.util.Objects;

public final class GenerationOptions {

    public static final int DEFAULT_PROGRESS_LOG_PERCENT_STEP = 10;

    private final GameMode mode;
    private final int parallelism;
    private final Long candidateLimit;
    private final Integer progressLogPercentStep;

    private GenerationOptions(Builder builder) {
        this.mode = builder.mode;
        this.parallelism = builder.parallelism;
        this.candidateLimit = builder.candidateLimit;
        this.progressLogPercentStep = builder.progressLogPercentStep;
    }

    public GameMode mode() {
        return mode;
    }

    public int parallelism() {
        return parallelism;
    }

    public Long candidateLimit() {
        return candidateLimit;
    }

    public Integer progressLogPercentStep() {
        return progressLogPercentStep;
    }

    public boolean bounded() {
        return candidateLimit != null;
    }

    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GenerationOptions{mode=" + mode
                + ", parallelism=" + parallelism
                + ", candidateLimit=" + (candidateLimit == null ? "-" : candidateLimit)
                + ", progressLogPercentStep=" + (progressLogPercentStep == null ? "-" : progressLogPercentStep)
                + "}";
    }

    public static final class Builder {
        private GameMode mode = GameMode.REGULAR;
        private int parallelism = defaultParallelism();
        private Long candidateLimit;
        private Integer progressLogPercentStep = DEFAULT_PROGRESS_LOG_PERCENT_STEP;

        public Builder mode(GameMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("Parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder candidateLimit(Long candidateLimit) {
            if (candidateLimit != null && candidateLimit <= 0) {
                throw new IllegalArgumentException("Candidate limit must be positive");
            }
            this.candidateLimit = candidateLimit;
            return this;
        }

        public Builder progressLogPercentStep(Integer percentStep) {
            if (percentStep != null) {
                if (percentStep <= 0 || percentStep > 100) {
                    throw new IllegalArgumentException("Progress log percent step must be between 1 and 100");
                }
            }
            this.progressLogPercentStep = percentStep;
            return this;
        }

        public GenerationOptions build() {
            if (mode == null) {
                throw new IllegalStateException("Game mode must be provided");
            }
            return new GenerationOptions(this);
        }
    }
}
