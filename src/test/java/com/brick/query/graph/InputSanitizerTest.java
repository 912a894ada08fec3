package com.brick.query.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputSanitizer validation utility.
 */
class InputSanitizerTest {

    // ========== validateQuestion ==========

    @Test
    void validateQuestion_rejectsNullAndBlank() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateQuestion(null));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateQuestion(""));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateQuestion("   "));
    }

    @Test
    void validateQuestion_rejectsOverMaxLength() {
        String longQuestion = "a".repeat(InputSanitizer.MAX_QUESTION_LENGTH + 1);
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateQuestion(longQuestion));
    }

    @Test
    void validateQuestion_acceptsMaxLength() {
        String maxQuestion = "a".repeat(InputSanitizer.MAX_QUESTION_LENGTH);
        assertDoesNotThrow(() -> InputSanitizer.validateQuestion(maxQuestion));
    }

    @Test
    void validateQuestion_rejectsControlCharacters() {
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateQuestion("Vis\u0000sensorer"));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateQuestion("Vis\u007Fsensorer"));
    }

    @Test
    void validateQuestion_acceptsNorwegianTextAndWhitespace() {
        assertDoesNotThrow(() -> InputSanitizer.validateQuestion("Hvilke målere har bygget?"));
        assertDoesNotThrow(() -> InputSanitizer.validateQuestion("Vis «Foyer»\tog\nkjølemaskin"));
    }

    // ========== validateLabel ==========

    @Test
    void validateLabel_acceptsBrickLabels() {
        assertDoesNotThrow(() -> InputSanitizer.validateLabel("brick_Temperature_Sensor"));
        assertDoesNotThrow(() -> InputSanitizer.validateLabel("CO2_Sensor"));
    }

    @Test
    void validateLabel_rejectsInjection() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateLabel("Sensor) DETACH DELETE (n"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateLabel("Sensor`"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateLabel("_Sensor"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateLabel("2Sensor"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateLabel(null));
    }

    @Test
    void validateLabel_rejectsOverMaxLength() {
        String longLabel = "A".repeat(InputSanitizer.MAX_LABEL_LENGTH + 1);
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateLabel(longLabel));
    }

    // ========== validateIdentifier ==========

    @Test
    void validateIdentifier_acceptsFieldNames() {
        assertDoesNotThrow(() -> InputSanitizer.validateIdentifier("energy_class"));
        assertDoesNotThrow(() -> InputSanitizer.validateIdentifier("_internal"));
        assertTrue(InputSanitizer.isIdentifier("sensorType"));
    }

    @Test
    void validateIdentifier_rejectsPunctuation() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateIdentifier("name; DROP"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateIdentifier(" "));
        assertFalse(InputSanitizer.isIdentifier("a.b"));
        assertFalse(InputSanitizer.isIdentifier(null));
    }
}
