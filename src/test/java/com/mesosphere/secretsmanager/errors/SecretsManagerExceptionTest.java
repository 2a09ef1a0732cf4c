package com.mesosphere.secretsmanager.errors;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;

public class SecretsManagerExceptionTest {

    @Test
    public void testMessageIncludesType() {
        SecretsManagerException e = SecretsManagerException.backendSecretNotFound("kv/a", "v");
        Assert.assertEquals(
                "secret key 'v' not found at 'kv/a' (errtype: BACKEND_SECRET_NOT_FOUND)", e.getMessage());
        Assert.assertEquals(ErrorType.BACKEND_SECRET_NOT_FOUND, e.getType());
    }

    @Test
    public void testCauseIsKept() {
        IOException cause = new IOException("connection refused");
        SecretsManagerException e = new SecretsManagerException(ErrorType.UNKNOWN_BACKEND_ERROR, "read failed", cause);
        Assert.assertSame(cause, e.getCause());
    }

    @Test
    public void testEveryTypeHasASource() {
        for (ErrorType type : ErrorType.values()) {
            Assert.assertNotNull(type.getSource());
        }
        Assert.assertEquals(ErrorType.Source.CONSUMER_STORE, ErrorType.CONSUMER_STORE_ERROR.getSource());
        Assert.assertEquals(ErrorType.Source.CONSUMER_STORE, ErrorType.CONSUMER_STORE_NOT_FOUND.getSource());
        Assert.assertEquals(ErrorType.Source.BACKEND, ErrorType.TOKEN_NOT_RENEWABLE.getSource());
        Assert.assertEquals(ErrorType.Source.CONFIGURATION,
                SecretsManagerException.unsupportedEngine("kv3").getSource());
        Assert.assertEquals(ErrorType.Source.CONFIGURATION,
                SecretsManagerException.unsupportedBackend("consul").getSource());
    }
}
