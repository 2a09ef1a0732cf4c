package com.mesosphere.secretsmanager.reconciliation;

import com.mesosphere.secretsmanager.backend.BackendClient;
import com.mesosphere.secretsmanager.decoder.Decoder;
import com.mesosphere.secretsmanager.decoder.Decoders;
import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;
import com.mesosphere.secretsmanager.record.DataSource;
import com.mesosphere.secretsmanager.record.RecordIdentity;
import com.mesosphere.secretsmanager.record.SecretRecord;
import com.mesosphere.secretsmanager.store.SecretData;
import com.mesosphere.secretsmanager.store.SecretStore;
import com.mesosphere.secretsmanager.store.StoreException;

import java.util.HashMap;
import java.util.Map;

/**
 * Computes the desired content of a target secret from the backend, and reads its current content
 * from the consumer store.
 */
public class StateResolver {

  private final BackendClient backendClient;
  private final SecretStore secretStore;

  public StateResolver(BackendClient backendClient, SecretStore secretStore) {
    this.backendClient = backendClient;
    this.secretStore = secretStore;
  }

  /**
   * Reads and decodes every data source of the record. The result has exactly one entry per logical
   * key of the record. The first failure aborts the whole computation.
   *
   * @throws SecretsManagerException from the backend or decoder
   */
  public SecretData desiredState(SecretRecord record) throws SecretsManagerException {
    Map<String, byte[]> values = new HashMap<>();
    for (Map.Entry<String, DataSource> entry : record.getKeysMap().entrySet()) {
      DataSource source = entry.getValue();
      // Resolve first: an unsupported encoding fails without touching the backend.
      Decoder decoder = Decoders.resolve(source.getEncoding());
      String raw = backendClient.readSecret(source.getPath(), source.getKey());
      values.put(entry.getKey(), decoder.decode(raw));
    }
    return SecretData.of(values);
  }

  /**
   * Returns the data of the target secret, or empty data if the secret doesn't exist.
   *
   * @throws SecretsManagerException with type {@code CONSUMER_STORE_ERROR} if the store could not
   *                                 be read
   */
  public SecretData currentState(RecordIdentity target) throws SecretsManagerException {
    try {
      return secretStore.get(target.getNamespace(), target.getName()).getData();
    } catch (StoreException e) {
      if (e.getReason() == StoreException.Reason.NOT_FOUND) {
        return SecretData.empty();
      }
      throw new SecretsManagerException(
          ErrorType.CONSUMER_STORE_ERROR, String.format("Unable to read secret %s", target), e);
    }
  }
}
