package com.mesosphere.secretsmanager.backend.azure.auth;

import com.auth0.jwt.interfaces.DecodedJWT;

import java.io.IOException;

/**
 * TokenProvider describes an interface that provides a valid Azure AD access token.
 */
public interface TokenProvider {

  DecodedJWT getToken() throws IOException;

}
