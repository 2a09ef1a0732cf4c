package com.mesosphere.secretsmanager.decoder;

import java.nio.charset.StandardCharsets;

/**
 * Identity decoder: the value is stored as its UTF-8 bytes.
 */
public class TextDecoder implements Decoder {

  public static final String ENCODING = "text";

  @Override
  public String getEncoding() {
    return ENCODING;
  }

  @Override
  public byte[] decode(String input) {
    return input.getBytes(StandardCharsets.UTF_8);
  }
}
