package com.mesosphere.secretsmanager.config;

import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.record.RecordIdentity;
import com.mesosphere.secretsmanager.record.SecretRecord;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class that loads the YAML secret definitions file and expands it into records.
 */
public final class SecretDefinitionsLoader {

  private static final Logger LOGGER = LoggingUtils.getLogger(SecretDefinitionsLoader.class);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private SecretDefinitionsLoader() {
    // do not instantiate
  }

  public static List<SecretDefinition> load(File file) throws IOException {
    LOGGER.debug("Parsing secret definitions from {}", file);
    return parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
  }

  /**
   * Parses a YAML list of definitions. An empty document yields an empty list.
   *
   * @throws IOException if the YAML is malformed or a definition has no name
   */
  public static List<SecretDefinition> parse(String yaml) throws IOException {
    if (StringUtils.isBlank(yaml)) {
      return Collections.emptyList();
    }
    // A document holding only comments has no content at all.
    JsonNode tree = YAML_MAPPER.readTree(yaml);
    if (tree == null || tree.isMissingNode() || tree.isNull()) {
      return Collections.emptyList();
    }
    List<SecretDefinition> definitions =
        YAML_MAPPER.readerFor(new TypeReference<List<SecretDefinition>>() { }).readValue(tree);
    for (SecretDefinition definition : definitions) {
      if (StringUtils.isBlank(definition.getName())) {
        throw new IOException(String.format("Secret definition without a name: %s", definition));
      }
    }
    return definitions;
  }

  /**
   * Expands definitions into records keyed by identity. When two definitions produce the same
   * identity, the first one wins.
   */
  public static Map<RecordIdentity, SecretRecord> toRecords(List<SecretDefinition> definitions) {
    Map<RecordIdentity, SecretRecord> records = new LinkedHashMap<>();
    for (SecretDefinition definition : definitions) {
      for (SecretRecord record : definition.toRecords()) {
        if (records.containsKey(record.getIdentity())) {
          LOGGER.warn("Ignoring duplicate secret definition {}", record.getIdentity());
          continue;
        }
        records.put(record.getIdentity(), record);
      }
    }
    return records;
  }
}
