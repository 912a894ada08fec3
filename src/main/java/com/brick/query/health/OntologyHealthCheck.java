package com.brick.query.health;

import com.brick.query.ontology.BrickOntology;

/**
 * Reports the size of the loaded ontology. An ontology without entity definitions
 * cannot match anything and counts as DOWN.
 */
public class OntologyHealthCheck implements HealthCheck {

    private final BrickOntology ontology;

    public OntologyHealthCheck(BrickOntology ontology) {
        this.ontology = ontology;
    }

    @Override
    public String getName() {
        return "ontology";
    }

    @Override
    public HealthStatus check() {
        int entities = ontology.getEntityDefinitions().size();
        HealthStatus status = entities > 0 ? HealthStatus.up() : HealthStatus.down("No entity definitions loaded");
        return status.withDetail("entityDefinitions", entities)
                .withDetail("traversalPatterns", ontology.getTraversals().size())
                .withDetail("intentRules", ontology.getIntentRules().size());
    }
}
