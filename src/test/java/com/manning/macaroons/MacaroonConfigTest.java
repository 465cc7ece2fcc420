package com.manning.macaroons;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.manning.macaroons.json.CaveatForm;

class MacaroonConfigTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(MacaroonConfig.JSON_CAVEATS_PROPERTY);
    }

    @Test
    void compactByDefault() {
        System.clearProperty(MacaroonConfig.JSON_CAVEATS_PROPERTY);

        assertEquals(CaveatForm.COMPACT, MacaroonConfig.jsonCaveatForm());
    }

    @Test
    void legacyWhenConfigured() {
        System.setProperty(MacaroonConfig.JSON_CAVEATS_PROPERTY, " Legacy ");

        assertEquals(CaveatForm.LEGACY, MacaroonConfig.jsonCaveatForm());
    }

    @Test
    void unknownValueIsRejected() {
        System.setProperty(MacaroonConfig.JSON_CAVEATS_PROPERTY, "pretty");

        assertThrows(IllegalArgumentException.class, MacaroonConfig::jsonCaveatForm);
    }
}
