package com.mesosphere.secretsmanager.http;

import org.apache.http.HttpResponse;
import org.apache.http.entity.StringEntity;
import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;

import static org.mockito.Mockito.when;

public class BackendHttpExecutorTest {

    @Test
    public void testGetBody() throws Exception {
        HttpResponse response = Mockito.mock(HttpResponse.class);
        when(response.getEntity()).thenReturn(new StringEntity("{\"ok\": \"é\"}", StandardCharsets.UTF_8));
        Assert.assertEquals("{\"ok\": \"é\"}", BackendHttpExecutor.getBody(response));
    }

    @Test
    public void testGetBodyWithoutEntity() throws Exception {
        Assert.assertEquals("", BackendHttpExecutor.getBody(Mockito.mock(HttpResponse.class)));
    }
}
