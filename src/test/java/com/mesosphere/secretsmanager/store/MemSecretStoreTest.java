package com.mesosphere.secretsmanager.store;

import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class MemSecretStoreTest {

    private MemSecretStore store;

    @Before
    public void beforeEach() {
        store = new MemSecretStore();
    }

    @Test
    public void testCreateGetUpdateDelete() throws Exception {
        store.create(secret("v1"));
        Assert.assertEquals(secret("v1"), store.get("ns", "s1"));

        store.update(secret("v2"));
        Assert.assertEquals(secret("v2"), store.get("ns", "s1"));

        store.delete("ns", "s1");
        Assert.assertFalse(store.contains("ns", "s1"));
        Assert.assertEquals(3, store.getWriteCount());
    }

    @Test
    public void testCreateExistingFails() throws Exception {
        store.create(secret("v1"));
        try {
            store.create(secret("v2"));
            Assert.fail("expected failure");
        } catch (StoreException e) {
            Assert.assertEquals(StoreException.Reason.ALREADY_EXISTS, e.getReason());
        }
        Assert.assertEquals(secret("v1"), store.get("ns", "s1"));
    }

    @Test
    public void testMissingSecretIsNotFound() {
        assertNotFound(() -> store.get("ns", "s1"));
        assertNotFound(() -> store.update(secret("v1")));
        assertNotFound(() -> store.delete("ns", "s1"));
        Assert.assertEquals(0, store.getWriteCount());
    }

    private static void assertNotFound(StoreCall call) {
        try {
            call.run();
            Assert.fail("expected failure");
        } catch (StoreException e) {
            Assert.assertEquals(StoreException.Reason.NOT_FOUND, e.getReason());
            Assert.assertTrue(e.getMessage().endsWith("(reason: NOT_FOUND)"));
        }
    }

    private interface StoreCall {
        void run() throws StoreException;
    }

    private static TargetSecret secret(String value) {
        return TargetSecret.newBuilder("ns", "s1")
                .data(SecretData.of(ImmutableMap.of("foo", value.getBytes(StandardCharsets.UTF_8))))
                .build();
    }
}
