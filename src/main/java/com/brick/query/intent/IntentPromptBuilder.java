package com.brick.query.intent;

import com.brick.query.core.model.IntentKind;
import com.brick.query.core.model.QueryLocale;
import com.brick.query.ontology.BrickOntology;
import com.brick.query.ontology.EntityDefinition;
import com.brick.query.ontology.TraversalPattern;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders the system prompt that asks a language model to classify a question.
 * The prompt lists the whole entity catalogue, the traversal patterns, the intent
 * codes, the expected JSON shape and a few worked examples. The ontology is immutable,
 * so the prompt is rendered once.
 */
public class IntentPromptBuilder {

    private static final int NORWEGIAN_SYNONYMS_SHOWN = 3;
    private static final int ENGLISH_SYNONYMS_SHOWN = 2;

    private final String systemPrompt;

    public IntentPromptBuilder(BrickOntology ontology) {
        Objects.requireNonNull(ontology, "ontology is required");
        this.systemPrompt = render(ontology);
    }

    public String buildSystemPrompt() {
        return systemPrompt;
    }

    private static String render(BrickOntology ontology) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("You translate questions about a building knowledge graph (Brick Schema) ")
                .append("into a structured intent. Questions are usually Norwegian, sometimes English.\n\n");

        prompt.append("Entity classes:\n");
        for (EntityDefinition definition : ontology.getEntityDefinitions()) {
            prompt.append("- ").append(definition.getType().getLabel())
                    .append(" (").append(definition.getName()).append("): ")
                    .append(synonymPreview(definition))
                    .append('\n');
        }
        prompt.append('\n');

        prompt.append("Traversal patterns:\n");
        for (TraversalPattern pattern : ontology.getTraversals()) {
            prompt.append("- ").append(pattern.name()).append(": ").append(pattern.description())
                    .append(" [").append(pattern.path()).append("]\n");
        }
        prompt.append('\n');

        prompt.append("Intent types:\n");
        prompt.append("- ").append(IntentKind.ENTITY.getCode()).append(": details about one specific thing\n");
        prompt.append("- ").append(IntentKind.LIST.getCode()).append(": list several things of one kind\n");
        prompt.append("- ").append(IntentKind.TRAVERSE.getCode()).append(": follow relations (sensors in a zone, zones fed by an AHU)\n");
        prompt.append("- ").append(IntentKind.AGGREGATE.getCode()).append(": count or sum\n");
        prompt.append("- ").append(IntentKind.PATH.getCode()).append(": how two things are connected\n");
        prompt.append("- ").append(IntentKind.UNKNOWN.getCode()).append(": none of the above\n\n");

        prompt.append("Respond with a single JSON object and nothing else:\n");
        prompt.append("{\n");
        prompt.append("  \"intent_type\": one of the intent types above,\n");
        prompt.append("  \"entity_class\": one of the entity class labels above, or null,\n");
        prompt.append("  \"parameters\": object of string or number values (id, name, building_name, zone_name, equipment_name, building_id),\n");
        prompt.append("  \"fields\": array of field names to return, or [] for defaults,\n");
        prompt.append("  \"traversal_hint\": one of the traversal pattern names above, or null,\n");
        prompt.append("  \"confidence\": number between 0.0 and 1.0\n");
        prompt.append("}\n\n");

        prompt.append("Examples:\n");
        prompt.append("Q: Hva er energimerket til Operahuset?\n");
        prompt.append("A: {\"intent_type\": \"query_entity\", \"entity_class\": \"brick_Building\", ")
                .append("\"parameters\": {\"building_name\": \"Operahuset\"}, \"fields\": [\"energyClass\"], ")
                .append("\"traversal_hint\": null, \"confidence\": 0.95}\n");
        prompt.append("Q: Vis alle temperatursensorer\n");
        prompt.append("A: {\"intent_type\": \"query_list\", \"entity_class\": \"brick_Temperature_Sensor\", ")
                .append("\"parameters\": {}, \"fields\": [], \"traversal_hint\": null, \"confidence\": 0.9}\n");
        prompt.append("Q: Hvilke soner mater hovedaggregatet?\n");
        prompt.append("A: {\"intent_type\": \"query_traverse\", \"entity_class\": \"brick_Air_Handling_Unit\", ")
                .append("\"parameters\": {\"name\": \"hovedaggregat\"}, \"fields\": [], ")
                .append("\"traversal_hint\": \"ahu_zones\", \"confidence\": 0.9}\n");
        prompt.append("Q: Hvor mange etasjer har bygningen?\n");
        prompt.append("A: {\"intent_type\": \"query_aggregate\", \"entity_class\": \"brick_Floor\", ")
                .append("\"parameters\": {}, \"fields\": [], \"traversal_hint\": null, \"confidence\": 0.9}\n");

        return prompt.toString();
    }

    private static String synonymPreview(EntityDefinition definition) {
        List<String> norwegian = definition.getSynonyms(QueryLocale.NO);
        List<String> english = definition.getSynonyms(QueryLocale.EN);
        return norwegian.stream().limit(NORWEGIAN_SYNONYMS_SHOWN).map(String::trim)
                .collect(Collectors.joining(", "))
                + " / "
                + english.stream().limit(ENGLISH_SYNONYMS_SHOWN).map(String::trim)
                .collect(Collectors.joining(", "));
    }
}
