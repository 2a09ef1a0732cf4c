package com.mesosphere.secretsmanager.config;

import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.record.MemRecordStore;
import com.mesosphere.secretsmanager.record.RecordIdentity;
import com.mesosphere.secretsmanager.record.SecretRecord;

import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Mirrors the secret definitions file into a {@link MemRecordStore}. New and changed definitions
 * are put into the store; records whose definition disappeared are marked for deletion so that
 * their target secrets get cleaned up before the records go away.
 * <p>
 * A file that can't be read or parsed leaves the store untouched.
 */
public class SecretDefinitionsSync implements Runnable {

  private static final Logger LOGGER = LoggingUtils.getLogger(SecretDefinitionsSync.class);

  private final File definitionsFile;
  private final MemRecordStore recordStore;

  public SecretDefinitionsSync(File definitionsFile, MemRecordStore recordStore) {
    this.definitionsFile = definitionsFile;
    this.recordStore = recordStore;
  }

  @Override
  public void run() {
    try {
      sync();
    } catch (IOException e) {
      LOGGER.error(String.format("Failed to load secret definitions from %s, keeping current records",
          definitionsFile), e);
    }
  }

  /**
   * Loads the file once and applies it to the store.
   *
   * @throws IOException if the file could not be read or parsed
   */
  public void sync() throws IOException {
    List<SecretDefinition> definitions = SecretDefinitionsLoader.load(definitionsFile);
    Map<RecordIdentity, SecretRecord> records = SecretDefinitionsLoader.toRecords(definitions);

    int changed = 0;
    for (SecretRecord record : records.values()) {
      if (recordStore.put(record)) {
        changed++;
      }
    }
    int removed = 0;
    for (RecordIdentity identity : recordStore.list()) {
      if (!records.containsKey(identity) && recordStore.markForDeletion(identity)) {
        LOGGER.info("Definition of {} was removed, marking it for deletion", identity);
        removed++;
      }
    }
    if (changed > 0 || removed > 0) {
      LOGGER.info("Applied {} secret definition(s) from {}: {} added or changed, {} removed",
          records.size(), definitionsFile, changed, removed);
    }
  }
}
