package com.platform.faultorchestrator.fault;

/**
 * Which configuration supplies the probability of each secondary injection in a cascade.
 *
 * Selected by {@code faultorchestrator.cascade.probability-source}; defaults to {@link #PRIMARY}.
 */
public enum CascadeProbabilitySource {
    /**
     * Every secondary kind is drawn against the primary kind's cascade probability, so a single
     * knob on the injected kind decides how far it spreads. A primary probability of 1.0
     * cascades into every other catalogued kind. This is the default.
     */
    PRIMARY,

    /**
     * Every secondary kind is drawn against its own cascade probability
     * ({@code catalog.get(target).cascadeProbability()}). This is the classic per-target
     * behaviour: how likely a kind is to be dragged in depends on that kind, not on the
     * fault that triggered the cascade.
     */
    TARGET
}
