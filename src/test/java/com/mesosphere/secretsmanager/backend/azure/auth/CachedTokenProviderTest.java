package com.mesosphere.secretsmanager.backend.azure.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CachedTokenProviderTest {

    @Mock private TokenProvider mockProvider;

    private CachedTokenProvider provider;

    @Before
    public void beforeEach() {
        MockitoAnnotations.initMocks(this);
        provider = new CachedTokenProvider(mockProvider, Duration.ofMinutes(5), false);
    }

    @Test
    public void testFreshTokenIsCached() throws Exception {
        DecodedJWT token = token(Duration.ofHours(1));
        when(mockProvider.getToken()).thenReturn(token);

        Assert.assertSame(token, provider.getToken());
        Assert.assertSame(token, provider.getToken());
        verify(mockProvider, times(1)).getToken();
    }

    @Test
    public void testTokenCloseToExpiryIsRefreshed() throws Exception {
        DecodedJWT expiring = token(Duration.ofMinutes(1));
        DecodedJWT fresh = token(Duration.ofHours(1));
        when(mockProvider.getToken()).thenReturn(expiring, fresh);

        Assert.assertSame(expiring, provider.getToken());
        Assert.assertSame(fresh, provider.getToken());
        Assert.assertSame(fresh, provider.getToken());
        verify(mockProvider, times(2)).getToken();
    }

    @Test
    public void testTokenWithoutExpiryIsCached() throws Exception {
        DecodedJWT token = JWT.decode(JWT.create().withSubject("app").sign(Algorithm.HMAC256("secret")));
        when(mockProvider.getToken()).thenReturn(token);

        provider.getToken();
        provider.getToken();
        verify(mockProvider, times(1)).getToken();
    }

    @Test
    public void testFailureIsNotCached() throws Exception {
        DecodedJWT token = token(Duration.ofHours(1));
        when(mockProvider.getToken()).thenThrow(new IOException("unavailable")).thenReturn(token);

        try {
            provider.getToken();
            Assert.fail("expected failure");
        } catch (IOException e) {
            Assert.assertEquals("unavailable", e.getMessage());
        }
        Assert.assertSame(token, provider.getToken());
    }

    static DecodedJWT token(Duration validFor) {
        return JWT.decode(JWT.create()
                .withSubject("app")
                .withExpiresAt(Date.from(Instant.now().plus(validFor)))
                .sign(Algorithm.HMAC256("secret")));
    }
}
