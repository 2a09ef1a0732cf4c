package com.mesosphere.secretsmanager.decoder;

import com.mesosphere.secretsmanager.errors.SecretsManagerException;

/**
 * Turns the string representation of a backend value into the raw bytes stored in a target secret.
 * Implementations are stateless.
 */
public interface Decoder {

  /**
   * Returns the encoding name this decoder is registered under.
   */
  String getEncoding();

  /**
   * Decodes the provided value.
   *
   * @throws SecretsManagerException with type {@code DECODE_ERROR} if the input is not valid for
   *                                 this encoding. No partial output is returned in that case.
   */
  byte[] decode(String input) throws SecretsManagerException;
}
