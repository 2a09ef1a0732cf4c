package com.mesosphere.secretsmanager.config;

import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class EnvStoreTest {

    @Test
    public void testOptional() {
        EnvStore store = EnvStore.fromMap(ImmutableMap.of("SET", " value ", "BLANK", "  "));
        Assert.assertEquals("value", store.getOptional("SET", "default"));
        Assert.assertEquals("default", store.getOptional("BLANK", "default"));
        Assert.assertEquals("default", store.getOptional("MISSING", "default"));
        Assert.assertNull(store.getOptional("MISSING", null));
    }

    @Test
    public void testRequired() {
        EnvStore store = EnvStore.fromMap(ImmutableMap.of("SET", "value", "BLANK", ""));
        Assert.assertEquals("value", store.getRequired("SET"));
        assertConfigError(() -> store.getRequired("BLANK"), EnvStore.ConfigException.Type.NOT_FOUND);
        assertConfigError(() -> store.getRequired("MISSING"), EnvStore.ConfigException.Type.NOT_FOUND);
    }

    @Test
    public void testNumbers() {
        EnvStore store = EnvStore.fromMap(ImmutableMap.of("N", "42", "BAD", "forty-two", "NEG", "-1"));
        Assert.assertEquals(42, store.getOptionalLong("N", 1));
        Assert.assertEquals(1, store.getOptionalLong("MISSING", 1));
        Assert.assertEquals(Duration.ofSeconds(42), store.getOptionalSeconds("N", 1));
        assertConfigError(() -> store.getOptionalLong("BAD", 1), EnvStore.ConfigException.Type.INVALID_VALUE);
        assertConfigError(() -> store.getOptionalSeconds("NEG", 1), EnvStore.ConfigException.Type.INVALID_VALUE);
    }

    @Test
    public void testStringList() {
        EnvStore store = EnvStore.fromMap(ImmutableMap.of("LIST", " a, b ,,c "));
        Assert.assertEquals(Arrays.asList("a", "b", "c"), store.getOptionalStringList("LIST"));
        Assert.assertEquals(Collections.emptyList(), store.getOptionalStringList("MISSING"));
    }

    @Test
    public void testPresence() {
        Map<String, String> env = new HashMap<>();
        env.put("EMPTY", "");
        EnvStore store = EnvStore.fromMap(env);
        Assert.assertTrue(store.isPresent("EMPTY"));
        Assert.assertFalse(store.isPresent("MISSING"));
    }

    private static void assertConfigError(Runnable call, EnvStore.ConfigException.Type type) {
        try {
            call.run();
            Assert.fail("expected failure");
        } catch (EnvStore.ConfigException e) {
            Assert.assertEquals(type, e.getType());
        }
    }
}
