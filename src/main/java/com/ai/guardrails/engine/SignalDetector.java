package com.ai.guardrails.engine;

import java.util.Optional;

/**
 * A stateless content matcher for one category.
 *
 * Implementations must be deterministic, case-insensitive, free of I/O and
 * safe to call from many request threads at once; their signature tables are
 * compiled once at construction and never modified.
 *
 * @param <C> category enum the detector is registered under
 * @param <F> finding type it produces
 */
public interface SignalDetector<C extends Enum<C>, F> {

    /**
     * The category this detector is registered under. One detector per category.
     */
    C getCategory();

    /**
     * Scan content and return at most one finding.
     *
     * @param content text to scan, never null (the engine substitutes "")
     * @return the finding, or empty when nothing matched
     */
    Optional<F> detect(String content);
}
