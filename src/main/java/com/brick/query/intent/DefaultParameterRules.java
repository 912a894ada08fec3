package com.brick.query.intent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Built-in parameter extraction rules, in the order they are applied:
 * identifiers, quoted names, then known building, zone and equipment names.
 */
public final class DefaultParameterRules {

    /** Parameter key for an explicit identifier. */
    public static final String ID = "id";
    /** Parameter key for a quoted name. */
    public static final String NAME = "name";
    public static final String BUILDING_NAME = "building_name";
    public static final String ZONE_NAME = "zone_name";
    public static final String EQUIPMENT_NAME = "equipment_name";

    private DefaultParameterRules() {
        // Utility class
    }

    /**
     * Returns all default rules sorted by priority.
     */
    public static List<ParameterRule> getRules() {
        List<ParameterRule> rules = new ArrayList<>();
        rules.addAll(getIdentifierRules());
        rules.addAll(getQuotedNameRules());
        rules.addAll(getKnownNameRules());
        rules.sort(Comparator.comparingInt(ParameterRule::getPriority));
        return List.copyOf(rules);
    }

    public static List<ParameterRule> getIdentifierRules() {
        return List.of(
                // "id: ahu-01", "nummer='3'"
                ParameterRule.builder()
                        .name("id-explicit")
                        .key(ID)
                        .pattern("\\b(?:id|nummer|number)\\s*[=:]\\s*(?<q>['\"]?)(?<value>[\\w-]+)\\k<q>")
                        .priority(10)
                        .build(),
                // "id building_opera", "nummer 3"; the token must look like an identifier
                // so "number of floors" does not yield id=of
                ParameterRule.builder()
                        .name("id-token")
                        .key(ID)
                        .pattern("\\b(?:id|nummer|number)\\s+(?<q>['\"]?)(?<value>[\\w-]*[\\d_-][\\w-]*)\\k<q>")
                        .priority(11)
                        .build()
        );
    }

    public static List<ParameterRule> getQuotedNameRules() {
        return List.of(
                ParameterRule.builder()
                        .name("name-straight-quotes")
                        .key(NAME)
                        .pattern("(?<![\\p{L}\\d])[\"'](?<value>[^\"']+)[\"'](?![\\p{L}\\d])")
                        .priority(20)
                        .build(),
                ParameterRule.builder()
                        .name("name-guillemets")
                        .key(NAME)
                        .pattern("«(?<value>[^»]+)»")
                        .priority(21)
                        .build(),
                ParameterRule.builder()
                        .name("name-curly-quotes")
                        .key(NAME)
                        .pattern("“(?<value>[^”]+)”")
                        .priority(22)
                        .build()
        );
    }

    public static List<ParameterRule> getKnownNameRules() {
        return List.of(
                ParameterRule.builder()
                        .name("building-literal")
                        .key(BUILDING_NAME)
                        .pattern("(?<value>operahuset|opera|hovedbygg)")
                        .priority(30)
                        .build(),
                ParameterRule.builder()
                        .name("zone-literal")
                        .key(ZONE_NAME)
                        .pattern("(?<value>foyer|hovedsal|backstage)")
                        .priority(40)
                        .build(),
                // "ahu" only as a whole word, it also occurs inside "operahuset"
                ParameterRule.builder()
                        .name("equipment-literal")
                        .key(EQUIPMENT_NAME)
                        .pattern("(?<value>(?<!\\p{L})ahu(?!\\p{L})|aggregat|kjølemaskin|chiller|pumpe)")
                        .priority(50)
                        .build()
        );
    }
}
