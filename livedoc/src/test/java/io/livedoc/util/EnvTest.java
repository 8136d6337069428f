package io.livedoc.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("LIVEDOC_ENV_TEST_VALUE");
    }

    @Test
    void testDefaultWhenUnset() {
        assertEquals("fallback", Env.get("LIVEDOC_ENV_TEST_VALUE", "fallback"));
        assertEquals(7, Env.getInt("LIVEDOC_ENV_TEST_VALUE", 7));
        assertEquals(7L, Env.getLong("LIVEDOC_ENV_TEST_VALUE", 7L));
        assertTrue(Env.getBool("LIVEDOC_ENV_TEST_VALUE", true));
    }

    @Test
    void testSystemPropertyFallback() {
        System.setProperty("LIVEDOC_ENV_TEST_VALUE", " 42 ");

        assertEquals(42, Env.getInt("LIVEDOC_ENV_TEST_VALUE", 0));
        assertEquals(42L, Env.getLong("LIVEDOC_ENV_TEST_VALUE", 0L));
    }

    @Test
    void testBooleanParsing() {
        System.setProperty("LIVEDOC_ENV_TEST_VALUE", "TRUE");
        assertTrue(Env.getBool("LIVEDOC_ENV_TEST_VALUE", false));

        System.setProperty("LIVEDOC_ENV_TEST_VALUE", "1");
        assertTrue(Env.getBool("LIVEDOC_ENV_TEST_VALUE", false));

        System.setProperty("LIVEDOC_ENV_TEST_VALUE", "no");
        assertFalse(Env.getBool("LIVEDOC_ENV_TEST_VALUE", true));
    }

    @Test
    void testInvalidNumberFailsLoudly() {
        System.setProperty("LIVEDOC_ENV_TEST_VALUE", "abc");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> Env.getInt("LIVEDOC_ENV_TEST_VALUE", 1));
        assertTrue(e.getMessage().contains("LIVEDOC_ENV_TEST_VALUE"), "Message names the key");
    }
}
