package com.mesosphere.secretsmanager.config;

import com.mesosphere.secretsmanager.record.DataSource;
import com.mesosphere.secretsmanager.record.RecordIdentity;
import com.mesosphere.secretsmanager.record.SecretRecord;

import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

public class SecretDefinitionsLoaderTest {

    @Test
    public void testLoadFixture() throws Exception {
        File file = new File(getClass().getClassLoader().getResource("secret-definitions.yml").getFile());
        List<SecretDefinition> definitions = SecretDefinitionsLoader.load(file);
        Assert.assertEquals(2, definitions.size());

        Map<RecordIdentity, SecretRecord> records = SecretDefinitionsLoader.toRecords(definitions);
        assertThat(records.keySet(), contains(
                RecordIdentity.of("payments", "db-credentials"),
                RecordIdentity.of("billing", "db-credentials"),
                RecordIdentity.of("ingress", "tls-cert")));

        SecretRecord db = records.get(RecordIdentity.of("billing", "db-credentials"));
        Assert.assertEquals("db-credentials", db.getTargetName());
        Assert.assertEquals("Opaque", db.getTargetType());
        Assert.assertEquals(new DataSource("secret/data/db", "username", "text"), db.getKeysMap().get("username"));
        Assert.assertEquals("base64", db.getKeysMap().get("password").getEncoding());

        SecretRecord tls = records.get(RecordIdentity.of("ingress", "tls-cert"));
        Assert.assertEquals("kubernetes.io/tls", tls.getTargetType());
        Assert.assertEquals("crt", tls.getKeysMap().get("tls.crt").getKey());
    }

    @Test
    public void testDefaults() throws Exception {
        List<SecretDefinition> definitions = SecretDefinitionsLoader.parse(
                "- name: plain\n"
                + "  namespaces: [default]\n"
                + "  data:\n"
                + "    foo:\n"
                + "      path: kv/a\n");
        SecretRecord record = definitions.get(0).toRecords().get(0);
        Assert.assertEquals(SecretRecord.DEFAULT_TYPE, record.getTargetType());
        DataSource source = record.getKeysMap().get("foo");
        Assert.assertEquals("", source.getKey());
        Assert.assertEquals("text", source.getEncoding());
    }

    @Test
    public void testEmptyDocument() throws Exception {
        Assert.assertTrue(SecretDefinitionsLoader.parse("").isEmpty());
        Assert.assertTrue(SecretDefinitionsLoader.parse("\n# nothing yet\n").isEmpty());
    }

    @Test(expected = IOException.class)
    public void testNamelessDefinition() throws Exception {
        SecretDefinitionsLoader.parse("- namespaces: [default]\n");
    }

    @Test(expected = IOException.class)
    public void testMalformedDocument() throws Exception {
        SecretDefinitionsLoader.parse("- name: [unterminated\n");
    }

    @Test
    public void testFirstDuplicateWins() throws Exception {
        List<SecretDefinition> definitions = SecretDefinitionsLoader.parse(
                "- name: dup\n"
                + "  namespaces: [default]\n"
                + "  type: first\n"
                + "- name: dup\n"
                + "  namespaces: [default]\n"
                + "  type: second\n");
        Map<RecordIdentity, SecretRecord> records = SecretDefinitionsLoader.toRecords(definitions);
        Assert.assertEquals(1, records.size());
        Assert.assertEquals("first", records.get(RecordIdentity.of("default", "dup")).getTargetType());
    }
}
