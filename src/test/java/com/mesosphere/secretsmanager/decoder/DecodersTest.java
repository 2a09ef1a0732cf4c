package com.mesosphere.secretsmanager.decoder;

import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;

import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

public class DecodersTest {

    @Test
    public void testEmptyEncodingResolvesToText() throws Exception {
        Assert.assertEquals(TextDecoder.ENCODING, Decoders.resolve("").getEncoding());
        Assert.assertEquals(TextDecoder.ENCODING, Decoders.resolve(null).getEncoding());
    }

    @Test
    public void testResolveRegisteredEncodings() throws Exception {
        Assert.assertTrue(Decoders.resolve("text") instanceof TextDecoder);
        Assert.assertTrue(Decoders.resolve("base64") instanceof Base64Decoder);
        Assert.assertEquals(2, Decoders.getSupportedEncodings().size());
    }

    @Test
    public void testUnknownEncodingFails() {
        try {
            Decoders.resolve("rot13");
            Assert.fail("expected failure");
        } catch (SecretsManagerException e) {
            Assert.assertEquals(ErrorType.UNSUPPORTED_ENCODING, e.getType());
            Assert.assertTrue(e.getMessage().contains("rot13"));
        }
    }

    @Test
    public void testTextDecodeIsUtf8Bytes() throws Exception {
        Assert.assertArrayEquals(
                "héllo".getBytes(StandardCharsets.UTF_8),
                Decoders.resolve("text").decode("héllo"));
    }

    @Test
    public void testBase64Decode() throws Exception {
        byte[] decoded = Decoders.resolve("base64").decode("aGVsbG8=");
        Assert.assertEquals("hello", new String(decoded, StandardCharsets.UTF_8));
        Assert.assertEquals("aGVsbG8=", Base64.getEncoder().encodeToString(decoded));
    }

    @Test
    public void testBase64DecodeBinary() throws Exception {
        byte[] binary = new byte[] {0, (byte) 0xff, 0x10, (byte) 0x80, 42};
        String encoded = Base64.getEncoder().encodeToString(binary);
        Assert.assertArrayEquals(binary, Decoders.resolve("base64").decode(encoded));
    }

    @Test
    public void testBase64IgnoresLineBreaks() throws Exception {
        byte[] decoded = Decoders.resolve("base64").decode("aGVs\nbG8=\r\n");
        Assert.assertEquals("hello", new String(decoded, StandardCharsets.UTF_8));
    }

    @Test
    public void testUnpaddedBase64Fails() {
        try {
            Decoders.resolve("base64").decode("aGVsbG8");
            Assert.fail("expected failure");
        } catch (SecretsManagerException e) {
            Assert.assertEquals(ErrorType.DECODE_ERROR, e.getType());
        }
    }

    @Test
    public void testInvalidBase64Fails() {
        try {
            Decoders.resolve("base64").decode("%%% not base64 %%%");
            Assert.fail("expected failure");
        } catch (SecretsManagerException e) {
            Assert.assertEquals(ErrorType.DECODE_ERROR, e.getType());
            Assert.assertEquals(ErrorType.Source.BACKEND, e.getSource());
        }
    }
}
