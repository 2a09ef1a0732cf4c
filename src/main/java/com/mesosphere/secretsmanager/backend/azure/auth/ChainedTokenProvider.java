package com.mesosphere.secretsmanager.backend.azure.auth;

import com.mesosphere.secretsmanager.common.LoggingUtils;

import com.auth0.jwt.interfaces.DecodedJWT;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Tries each provider in order and returns the first token obtained. Fails only when every
 * provider failed, listing each failure.
 */
public class ChainedTokenProvider implements TokenProvider {

  private static final Logger LOGGER = LoggingUtils.getLogger(ChainedTokenProvider.class);

  private final List<TokenProvider> providers;

  public ChainedTokenProvider(List<TokenProvider> providers) {
    if (providers.isEmpty()) {
      throw new IllegalArgumentException("At least one token provider is required");
    }
    this.providers = ImmutableList.copyOf(providers);
  }

  @Override
  public DecodedJWT getToken() throws IOException {
    List<String> failures = new ArrayList<>();
    IOException last = null;
    for (TokenProvider provider : providers) {
      try {
        return provider.getToken();
      } catch (IOException e) {
        LOGGER.debug("Token provider {} failed: {}", provider, e.getMessage());
        failures.add(String.format("%s: %s", provider, e.getMessage()));
        last = e;
      }
    }
    throw new IOException(String.format("No credential in the chain could obtain a token: %s", failures), last);
  }
}
