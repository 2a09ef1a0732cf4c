package com.mesosphere.secretsmanager.backend.vault;

import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;

import org.json.JSONObject;
import org.junit.Assert;
import org.junit.Test;

public class KvEngineTest {

    @Test
    public void testUnwrapV1() {
        JSONObject response = new JSONObject("{\"data\": {\"v\": \"x\"}}");
        Assert.assertEquals("x", KvEngine.KV1.unwrap(response).get().getString("v"));
    }

    @Test
    public void testUnwrapV2() {
        JSONObject response = new JSONObject(
                "{\"data\": {\"data\": {\"v\": \"x\"}, \"metadata\": {\"version\": 3}}}");
        Assert.assertEquals("x", KvEngine.KV2.unwrap(response).get().getString("v"));
    }

    @Test
    public void testUnwrapV2DeletedVersion() {
        JSONObject response = new JSONObject(
                "{\"data\": {\"data\": null, \"metadata\": {\"deletion_time\": \"2020-01-01T00:00:00Z\"}}}");
        Assert.assertFalse(KvEngine.KV2.unwrap(response).isPresent());
        Assert.assertFalse(KvEngine.KV2.unwrap(new JSONObject("{\"warnings\": [\"gone\"]}")).isPresent());
    }

    @Test
    public void testFromName() throws Exception {
        Assert.assertEquals(KvEngine.KV2, KvEngine.fromName(null));
        Assert.assertEquals(KvEngine.KV2, KvEngine.fromName(""));
        Assert.assertEquals(KvEngine.KV1, KvEngine.fromName("kv1"));
        Assert.assertEquals(KvEngine.KV2, KvEngine.fromName("kv2"));
    }

    @Test
    public void testUnknownEngine() {
        try {
            KvEngine.fromName("kv3");
            Assert.fail("expected failure");
        } catch (SecretsManagerException e) {
            Assert.assertEquals(ErrorType.UNSUPPORTED_ENGINE, e.getType());
        }
    }
}
