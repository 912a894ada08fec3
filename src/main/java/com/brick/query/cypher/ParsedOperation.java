package com.brick.query.cypher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parts of a structured query the resolver works from.
 *
 * @param rootField     first field of the operation body, as written
 * @param literals      literal arguments of the root field ({@code sensorType: "CO2_Sensor"})
 * @param variableRefs  arguments bound to variables, argument name to variable name
 * @param selection     selection set of the root field, empty for scalar roots
 */
public record ParsedOperation(
        String rootField,
        Map<String, Object> literals,
        Map<String, String> variableRefs,
        List<Selection> selection
) {
    public ParsedOperation {
        literals = Collections.unmodifiableMap(new LinkedHashMap<>(literals));
        variableRefs = Collections.unmodifiableMap(new LinkedHashMap<>(variableRefs));
        selection = List.copyOf(selection);
    }
}
