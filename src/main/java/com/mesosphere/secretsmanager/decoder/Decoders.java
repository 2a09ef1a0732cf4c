package com.mesosphere.secretsmanager.decoder;

import com.mesosphere.secretsmanager.errors.SecretsManagerException;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Set;

/**
 * Registry of the supported value encodings.
 */
public final class Decoders {

  /**
   * Encoding used when a data source does not declare one.
   */
  public static final String DEFAULT_ENCODING = TextDecoder.ENCODING;

  private static final Map<String, Decoder> DECODERS = ImmutableMap.of(
      TextDecoder.ENCODING, new TextDecoder(),
      Base64Decoder.ENCODING, new Base64Decoder());

  private Decoders() {
    // do not instantiate
  }

  /**
   * Returns the decoder registered for {@code encoding}. A null or empty encoding resolves to the
   * text decoder.
   *
   * @throws SecretsManagerException with type {@code UNSUPPORTED_ENCODING} for unknown names
   */
  public static Decoder resolve(String encoding) throws SecretsManagerException {
    String name = StringUtils.isEmpty(encoding) ? DEFAULT_ENCODING : encoding;
    Decoder decoder = DECODERS.get(name);
    if (decoder == null) {
      throw SecretsManagerException.unsupportedEncoding(encoding);
    }
    return decoder;
  }

  public static Set<String> getSupportedEncodings() {
    return DECODERS.keySet();
  }
}
