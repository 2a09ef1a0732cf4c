package com.mesosphere.secretsmanager.backend.azure;

import com.mesosphere.secretsmanager.http.BackendHttpExecutor;
import com.mesosphere.secretsmanager.http.HttpStatusException;

import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.protocol.HttpContext;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class HttpKeyVaultApiTest {

    @Mock private HttpClientBuilder mockHttpClientBuilder;
    @Mock private CloseableHttpClient mockHttpClient;
    @Mock private CloseableHttpResponse mockHttpResponse;
    @Mock private HttpEntity mockHttpEntity;
    @Mock private StatusLine mockStatusLine;

    private HttpKeyVaultApi api;

    @Before
    public void init() throws Exception {
        MockitoAnnotations.initMocks(this);
        when(mockHttpClientBuilder.build()).thenReturn(mockHttpClient);
        when(mockHttpClient.execute(
                Mockito.any(HttpUriRequest.class), Mockito.any(HttpContext.class))).thenReturn(mockHttpResponse);
        when(mockHttpResponse.getEntity()).thenReturn(mockHttpEntity);
        when(mockHttpResponse.getStatusLine()).thenReturn(mockStatusLine);
        when(mockStatusLine.getStatusCode()).thenReturn(200);
        byte[] bytes = "{\"value\": \"hunter2\", \"id\": \"https://my-vault.vault.azure.net/secrets/db/1\"}"
                .getBytes(StandardCharsets.UTF_8);
        when(mockHttpEntity.getContent()).thenAnswer(invocation -> new ByteArrayInputStream(bytes));

        api = new HttpKeyVaultApi("my-vault", new BackendHttpExecutor(mockHttpClientBuilder));
    }

    @Test
    public void testGetSecret() throws Exception {
        Assert.assertEquals("https://my-vault.vault.azure.net", api.getBaseUrl());
        Assert.assertEquals("hunter2", api.getSecret("token", "db"));

        ArgumentCaptor<HttpUriRequest> passedRequest = ArgumentCaptor.forClass(HttpUriRequest.class);
        verify(mockHttpClient).execute(passedRequest.capture(), Mockito.any(HttpContext.class));
        HttpUriRequest request = passedRequest.getValue();
        Assert.assertEquals("GET", request.getMethod());
        Assert.assertEquals("https://my-vault.vault.azure.net/secrets/db?api-version=7.4", request.getURI().toString());
        Assert.assertEquals("Bearer token", request.getFirstHeader("Authorization").getValue());
    }

    @Test
    public void testStatusIsExposed() throws Exception {
        when(mockStatusLine.getStatusCode()).thenReturn(404);
        try {
            api.getSecret("token", "db");
            Assert.fail("expected failure");
        } catch (HttpStatusException e) {
            Assert.assertEquals(404, e.getStatusCode());
        }
    }
}
