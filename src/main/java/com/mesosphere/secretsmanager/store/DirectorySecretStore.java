package com.mesosphere.secretsmanager.store;

import com.mesosphere.secretsmanager.common.CycleDetectingLockUtils;
import com.mesosphere.secretsmanager.common.LoggingUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.regex.Pattern;

/**
 * Implementation of {@link SecretStore} which materializes each secret as a directory on the local
 * filesystem, for consumption by workloads which mount or read that directory:
 *
 * <pre>
 * [root]/[namespace]/[name]/
 *     .metadata.json     type, labels, annotations
 *     [key]              raw bytes of one data entry, one file per key
 * </pre>
 *
 * A secret is always written in full to a temporary sibling directory which is then renamed into
 * place, so readers see either the previous or the new content.
 */
public final class DirectorySecretStore implements SecretStore {

  static final String METADATA_FILE = ".metadata.json";

  private static final Logger LOGGER = LoggingUtils.getLogger(DirectorySecretStore.class);

  private static final Pattern VALID_NAME = Pattern.compile("[-._a-zA-Z0-9]+");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final File root;

  private final Lock rlock;

  private final Lock rwlock;

  public DirectorySecretStore(File root, boolean exitOnDeadlock) {
    this.root = root;
    ReadWriteLock lock = CycleDetectingLockUtils.newLock(exitOnDeadlock, DirectorySecretStore.class);
    this.rlock = lock.readLock();
    this.rwlock = lock.writeLock();
  }

  @Override
  public TargetSecret get(String namespace, String name) throws StoreException {
    File dir = getSecretDir(namespace, name);
    rlock.lock();
    try {
      if (!dir.isDirectory()) {
        throw StoreException.notFound(namespace + "/" + name);
      }
      return read(namespace, name, dir);
    } finally {
      rlock.unlock();
    }
  }

  @Override
  public void create(TargetSecret secret) throws StoreException {
    File dir = getSecretDir(secret.getNamespace(), secret.getName());
    rwlock.lock();
    try {
      if (dir.exists()) {
        throw new StoreException(StoreException.Reason.ALREADY_EXISTS,
            String.format("'%s/%s' already exists", secret.getNamespace(), secret.getName()));
      }
      write(secret, dir);
    } finally {
      rwlock.unlock();
    }
  }

  @Override
  public void update(TargetSecret secret) throws StoreException {
    File dir = getSecretDir(secret.getNamespace(), secret.getName());
    rwlock.lock();
    try {
      if (!dir.isDirectory()) {
        throw StoreException.notFound(secret.getNamespace() + "/" + secret.getName());
      }
      write(secret, dir);
    } finally {
      rwlock.unlock();
    }
  }

  @Override
  public void delete(String namespace, String name) throws StoreException {
    File dir = getSecretDir(namespace, name);
    rwlock.lock();
    try {
      if (!dir.isDirectory()) {
        throw StoreException.notFound(namespace + "/" + name);
      }
      File trash = sibling(dir, "deleted");
      move(dir, trash);
      deleteQuietly(trash);
    } finally {
      rwlock.unlock();
    }
  }

  private TargetSecret read(String namespace, String name, File dir) throws StoreException {
    Metadata metadata;
    try {
      metadata = MAPPER.readValue(new File(dir, METADATA_FILE), Metadata.class);
    } catch (IOException e) {
      throw new StoreException(StoreException.Reason.SERIALIZATION_ERROR,
          String.format("Failed to read metadata of '%s/%s'", namespace, name), e);
    }
    Map<String, byte[]> data = new HashMap<>();
    File[] files = dir.listFiles();
    if (files != null) {
      for (File file : files) {
        if (file.isFile() && !METADATA_FILE.equals(file.getName())) {
          try {
            data.put(file.getName(), FileUtils.readFileToByteArray(file));
          } catch (IOException e) {
            throw new StoreException(StoreException.Reason.STORAGE_ERROR,
                String.format("Failed to read '%s'", file), e);
          }
        }
      }
    }
    return TargetSecret.newBuilder(namespace, name)
        .type(metadata.type)
        .data(SecretData.of(data))
        .labels(metadata.labels)
        .annotations(metadata.annotations)
        .build();
  }

  private void write(TargetSecret secret, File dir) throws StoreException {
    for (String key : secret.getData().keySet()) {
      if (METADATA_FILE.equals(key) || !VALID_NAME.matcher(key).matches()) {
        throw new StoreException(StoreException.Reason.SERIALIZATION_ERROR,
            String.format("Data key '%s' of '%s/%s' can't be stored as a file",
                key, secret.getNamespace(), secret.getName()));
      }
    }

    File staging = sibling(dir, "staging");
    try {
      FileUtils.forceMkdir(staging);
      MAPPER.writeValue(new File(staging, METADATA_FILE),
          new Metadata(secret.getType(), secret.getLabels(), secret.getAnnotations()));
      for (String key : secret.getData().keySet()) {
        FileUtils.writeByteArrayToFile(new File(staging, key), secret.getData().get(key));
      }
    } catch (IOException e) {
      deleteQuietly(staging);
      throw new StoreException(StoreException.Reason.STORAGE_ERROR,
          String.format("Failed to stage '%s/%s'", secret.getNamespace(), secret.getName()), e);
    }

    File previous = null;
    if (dir.exists()) {
      previous = sibling(dir, "previous");
      move(dir, previous);
    }
    try {
      move(staging, dir);
    } catch (StoreException e) {
      if (previous != null) {
        // Put the previous content back so the secret doesn't vanish.
        move(previous, dir);
      }
      deleteQuietly(staging);
      throw e;
    }
    if (previous != null) {
      deleteQuietly(previous);
    }
    LOGGER.info("Wrote {} key(s) to {}", secret.getData().size(), dir);
  }

  private File getSecretDir(String namespace, String name) throws StoreException {
    if (!VALID_NAME.matcher(namespace).matches() || !VALID_NAME.matcher(name).matches()
        || namespace.startsWith(".") || name.startsWith(".")) {
      throw new StoreException(StoreException.Reason.STORAGE_ERROR,
          String.format("Invalid secret location '%s/%s'", namespace, name));
    }
    return new File(new File(root, namespace), name);
  }

  private static File sibling(File dir, String purpose) {
    return new File(dir.getParentFile(),
        String.format(".%s.%s-%s", dir.getName(), purpose, UUID.randomUUID()));
  }

  private static void move(File from, File to) throws StoreException {
    try {
      Files.move(from.toPath(), to.toPath(), StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new StoreException(StoreException.Reason.STORAGE_ERROR,
          String.format("Failed to move '%s' to '%s'", from, to), e);
    }
  }

  private static void deleteQuietly(File dir) {
    if (!FileUtils.deleteQuietly(dir)) {
      LOGGER.warn("Failed to clean up {}", dir);
    }
  }

  /**
   * Serialized form of everything in a secret except its data.
   */
  private static final class Metadata {
    @JsonProperty("type")
    private final String type;
    @JsonProperty("labels")
    private final Map<String, String> labels;
    @JsonProperty("annotations")
    private final Map<String, String> annotations;

    @JsonCreator
    Metadata(
        @JsonProperty("type") String type,
        @JsonProperty("labels") Map<String, String> labels,
        @JsonProperty("annotations") Map<String, String> annotations) {
      this.type = type;
      this.labels = labels == null ? Collections.emptyMap() : labels;
      this.annotations = annotations == null ? Collections.emptyMap() : annotations;
    }
  }
}
