package com.brick.query.format;

import java.util.List;
import java.util.Locale;

/**
 * Answers a question about one field directly ("Hva er energimerket?") instead of
 * rendering the whole result.
 *
 * @param phrase   lower-case phrase looked for in the question
 * @param field    stored field holding the answer
 * @param template answer text, one {@code %s} for the value
 */
public record FieldAnswerRule(String phrase, String field, String template) {

    /**
     * Checked in order, Norwegian phrases first.
     */
    public static final List<FieldAnswerRule> DEFAULT_RULES = List.of(
            new FieldAnswerRule("energimerke", "energy_class", "Energimerket er: %s"),
            new FieldAnswerRule("energiklasse", "energy_class", "Energiklassen er: %s"),
            new FieldAnswerRule("adresse", "address", "Adressen er: %s"),
            new FieldAnswerRule("areal", "area_sqm", "Arealet er: %s m²"),
            new FieldAnswerRule("størrelse", "area_sqm", "Størrelsen er: %s m²"),
            new FieldAnswerRule("byggeår", "year_built", "Bygget ble bygget i: %s"),
            new FieldAnswerRule("når ble", "year_built", "Bygget ble bygget i: %s"),
            new FieldAnswerRule("navn", "name", "Navnet er: %s"),
            new FieldAnswerRule("hva heter", "name", "Navnet er: %s"),
            new FieldAnswerRule("energy class", "energy_class", "The energy class is: %s"),
            new FieldAnswerRule("energy rating", "energy_class", "The energy rating is: %s"),
            new FieldAnswerRule("address", "address", "The address is: %s"),
            new FieldAnswerRule("area", "area_sqm", "The area is: %s m²"),
            new FieldAnswerRule("size", "area_sqm", "The size is: %s m²"),
            new FieldAnswerRule("built", "year_built", "It was built in: %s"),
            new FieldAnswerRule("year", "year_built", "Year built: %s")
    );

    public boolean appliesTo(String lowerQuestion) {
        return lowerQuestion.contains(phrase);
    }

    public String answer(Object value) {
        return String.format(Locale.ROOT, template, value);
    }
}
