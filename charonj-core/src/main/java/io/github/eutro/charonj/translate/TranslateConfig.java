package io.github.eutro.charonj.translate;

import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.names.NamePattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options for translating a crate. Build with {@link #builder()}.
 */
public final class TranslateConfig {
    public static final TranslateConfig DEFAULT = builder().build();

    /**
     * Whether to produce LLBC bodies at all.
     */
    public final boolean structureOutput;
    public final DuplicationMode duplicationMode;
    /**
     * Items matching any of these are imported without a body.
     */
    public final List<NamePattern> opaqueItems;
    /**
     * Whether to rewrite discriminant reads followed by a switch into matches.
     */
    public final boolean removeReadDiscriminant;
    /**
     * How many threads to structure bodies on.
     */
    public final int threads;

    private TranslateConfig(Builder builder) {
        this.structureOutput = builder.structureOutput;
        this.duplicationMode = builder.duplicationMode;
        this.opaqueItems = Collections.unmodifiableList(new ArrayList<>(builder.opaqueItems));
        this.removeReadDiscriminant = builder.removeReadDiscriminant;
        this.threads = builder.threads;
    }

    public boolean isOpaque(Name name) {
        for (NamePattern pattern : opaqueItems) {
            if (pattern.matches(name)) return true;
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.structureOutput = structureOutput;
        builder.duplicationMode = duplicationMode;
        builder.opaqueItems.addAll(opaqueItems);
        builder.removeReadDiscriminant = removeReadDiscriminant;
        builder.threads = threads;
        return builder;
    }

    public static final class Builder {
        private boolean structureOutput = true;
        private DuplicationMode duplicationMode = DuplicationMode.DUPLICATE_TAILS;
        private final List<NamePattern> opaqueItems = new ArrayList<>();
        private boolean removeReadDiscriminant = true;
        private int threads = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        public Builder structureOutput(boolean structureOutput) {
            this.structureOutput = structureOutput;
            return this;
        }

        public Builder duplicationMode(DuplicationMode duplicationMode) {
            this.duplicationMode = duplicationMode;
            return this;
        }

        public Builder opaque(NamePattern pattern) {
            opaqueItems.add(pattern);
            return this;
        }

        public Builder opaque(String pattern) {
            return opaque(NamePattern.parse(pattern));
        }

        public Builder removeReadDiscriminant(boolean removeReadDiscriminant) {
            this.removeReadDiscriminant = removeReadDiscriminant;
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 1) throw new IllegalArgumentException("threads must be positive, got " + threads);
            this.threads = threads;
            return this;
        }

        public TranslateConfig build() {
            return new TranslateConfig(this);
        }
    }
}
