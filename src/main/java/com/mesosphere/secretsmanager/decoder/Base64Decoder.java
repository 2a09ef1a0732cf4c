package com.mesosphere.secretsmanager.decoder;

import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;

import org.apache.commons.lang3.StringUtils;

import java.util.Base64;

/**
 * Decodes standard (RFC 4648, padded) base64 text. Line breaks are ignored, so wrapped values such
 * as PEM bodies decode as-is, but input without its padding is rejected.
 */
public class Base64Decoder implements Decoder {

  public static final String ENCODING = "base64";

  @Override
  public String getEncoding() {
    return ENCODING;
  }

  @Override
  public byte[] decode(String input) throws SecretsManagerException {
    String unwrapped = StringUtils.replaceChars(input, "\r\n", "");
    if (unwrapped.length() % 4 != 0) {
      throw new SecretsManagerException(
          ErrorType.DECODE_ERROR, "value is not valid base64: bad padding");
    }
    try {
      return Base64.getDecoder().decode(unwrapped);
    } catch (IllegalArgumentException e) {
      throw new SecretsManagerException(ErrorType.DECODE_ERROR, "value is not valid base64", e);
    }
  }
}
