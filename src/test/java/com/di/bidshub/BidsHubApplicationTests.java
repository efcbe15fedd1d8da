package com.di.bidshub;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for BidsHubApplication. The full context needs GCS credentials, so this only
 * checks the entry point.
 */
@DisplayName("BidsHubApplication Tests")
class BidsHubApplicationTests {

    @Test
    @DisplayName("Should have main class")
    void testMainClassExists() {
        assertEquals("BidsHubApplication", BidsHubApplication.class.getSimpleName());
    }

    @Test
    @DisplayName("Should have a public static main method")
    void testMainMethodExists() throws NoSuchMethodException {
        Method main = BidsHubApplication.class.getMethod("main", String[].class);
        assertTrue(Modifier.isStatic(main.getModifiers()));
        assertTrue(Modifier.isPublic(main.getModifiers()));
    }
}
