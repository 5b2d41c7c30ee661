package com.project.image.editdetection.service.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Owns a lazily built {@link PatchScorer}. The factory runs at most once, on first use,
 * and every caller after that shares the same instance.
 */
public final class PatchScorerHandle {
    private static final Logger log = LoggerFactory.getLogger(PatchScorerHandle.class);

    private final String name;
    private final Supplier<? extends PatchScorer> factory;
    private volatile PatchScorer scorer;

    public PatchScorerHandle(String name, Supplier<? extends PatchScorer> factory) {
        this.name = name;
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /** Handle around an already built scorer. */
    public static PatchScorerHandle of(PatchScorer scorer) {
        Objects.requireNonNull(scorer, "scorer");
        PatchScorerHandle handle = new PatchScorerHandle(scorer.getClass().getSimpleName(), () -> scorer);
        handle.scorer = scorer;
        return handle;
    }

    public PatchScorer get() {
        PatchScorer s = scorer;
        if (s != null) return s;
        synchronized (this) {
            if (scorer == null) {
                long start = System.nanoTime();
                scorer = Objects.requireNonNull(factory.get(), "scorer factory returned null");
                log.info("Patch scorer '{}' initialised in {} ms", name, (System.nanoTime() - start) / 1_000_000);
            }
            return scorer;
        }
    }

    public boolean isInitialized() {
        return scorer != null;
    }

    public String name() {
        return name;
    }
}
