package com.brick.query.health;

/**
 * A probe of one dependency of the query pipeline (graph engine, language model, ontology).
 */
public interface HealthCheck {

    String getName();

    /**
     * Probes the dependency. Implementations report failures in the returned status.
     */
    HealthStatus check();
}
