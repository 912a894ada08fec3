package com.brick.query.format;

import com.brick.query.core.model.QueryLocale;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Every piece of locale-dependent response text. Templates use {@link String#format} placeholders.
 *
 * @param noResults        sentence for an empty result
 * @param count            aggregate line, one {@code %s} for the count
 * @param found            list header, one {@code %d} for the row count
 * @param moreResults      trailer after a truncated result, one {@code %d}
 * @param moreItems        suffix after a truncated nested list, one {@code %d}
 * @param resultsHeader    traversal header when the query carries no description
 * @param lowConfidence    reply when the question was not understood, one {@code %s} for the question
 * @param connectionError  reply when the graph engine is unreachable, one {@code %s} for the error
 * @param queryError       reply when the graph engine rejected the query, one {@code %s}
 * @param resolutionError  reply when no graph query could be built, one {@code %s}
 * @param fieldLabels      display names of stored fields
 */
public record ResponseMessages(
        String noResults,
        String count,
        String found,
        String moreResults,
        String moreItems,
        String resultsHeader,
        String lowConfidence,
        String connectionError,
        String queryError,
        String resolutionError,
        Map<String, String> fieldLabels
) {

    public static final ResponseMessages NORWEGIAN = new ResponseMessages(
            "Ingen resultater funnet for spørringen din.",
            "Antall: %s",
            "Fant %d resultater:",
            "... og %d flere resultater",
            "... +%d mer",
            "Resultater",
            "Beklager, jeg forstod ikke helt spørsmålet: \"%s\"\n\n"
                    + "Prøv å spørre om:\n"
                    + "  • Sensorer i bygget eller en sone\n"
                    + "  • Utstyr som AHU, kjølemaskin, pumper\n"
                    + "  • Målere og energidata\n"
                    + "  • Soner og etasjer",
            "Kunne ikke koble til FalkorDB: %s\nSjekk at databasen kjører: docker start falkordb",
            "Feil ved kjøring av spørring: %s",
            "Kunne ikke lage en spørring for spørsmålet: %s",
            Map.ofEntries(
                    Map.entry("energy_class", "Energimerke"),
                    Map.entry("area_sqm", "Areal (m²)"),
                    Map.entry("year_built", "Byggeår"),
                    Map.entry("address", "Adresse"),
                    Map.entry("description", "Beskrivelse"),
                    Map.entry("floors", "Etasjer"),
                    Map.entry("level", "Nivå"),
                    Map.entry("systems", "Systemer"),
                    Map.entry("meters", "Målere"),
                    Map.entry("sensors", "Sensorer"),
                    Map.entry("equipment", "Utstyr"),
                    Map.entry("zones", "Soner"),
                    Map.entry("rooms", "Rom"),
                    Map.entry("fedBy", "Forsynes av"),
                    Map.entry("unit", "Enhet"),
                    Map.entry("manufacturer", "Produsent"),
                    Map.entry("model", "Modell"),
                    Map.entry("capacity", "Kapasitet"),
                    Map.entry("capacity_unit", "Kapasitetsenhet"),
                    Map.entry("external_id", "Ekstern ID"),
                    Map.entry("resolution", "Oppløsning"),
                    Map.entry("timeseries", "Tidsserie"),
                    Map.entry("count", "Antall"),
                    Map.entry("type", "Type"),
                    Map.entry("sensorType", "Type"),
                    Map.entry("equipmentType", "Type"),
                    Map.entry("systemType", "Type"),
                    Map.entry("meterType", "Type")
            ));

    public static final ResponseMessages ENGLISH = new ResponseMessages(
            "No results found for your query.",
            "Count: %s",
            "Found %d results:",
            "... and %d more results",
            "... +%d more",
            "Results",
            "Sorry, I didn't understand: \"%s\"\n\n"
                    + "Try asking about:\n"
                    + "  • Sensors in building or zone\n"
                    + "  • Equipment like AHU, chiller, pumps\n"
                    + "  • Meters and energy data\n"
                    + "  • Zones and floors",
            "Could not connect to FalkorDB: %s\nMake sure the database is running: docker start falkordb",
            "Query execution error: %s",
            "Could not build a graph query for the question: %s",
            Map.ofEntries(
                    Map.entry("energy_class", "Energy Class"),
                    Map.entry("area_sqm", "Area (m²)"),
                    Map.entry("year_built", "Year Built"),
                    Map.entry("external_id", "External ID"),
                    Map.entry("fedBy", "Fed By"),
                    Map.entry("capacity_unit", "Capacity Unit"),
                    Map.entry("type", "Type"),
                    Map.entry("sensorType", "Type"),
                    Map.entry("equipmentType", "Type"),
                    Map.entry("systemType", "Type"),
                    Map.entry("meterType", "Type")
            ));

    public ResponseMessages {
        Objects.requireNonNull(noResults, "noResults is required");
        fieldLabels = fieldLabels != null ? Map.copyOf(fieldLabels) : Map.of();
    }

    public static ResponseMessages forLocale(QueryLocale locale) {
        return locale == QueryLocale.EN ? ENGLISH : NORWEGIAN;
    }

    /**
     * Display name of a field: the translation when one exists, otherwise the name split
     * into words and title-cased ({@code supply_temp} becomes {@code Supply Temp}).
     */
    public String fieldLabel(String key) {
        String label = fieldLabels.get(key);
        if (label != null) {
            return label;
        }
        StringBuilder sb = new StringBuilder();
        boolean startOfWord = true;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '_') {
                sb.append(' ');
                startOfWord = true;
                continue;
            }
            if (Character.isUpperCase(c) && i > 0 && key.charAt(i - 1) != '_') {
                sb.append(' ');
                startOfWord = true;
            }
            sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
            startOfWord = false;
        }
        return sb.toString();
    }

    String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
