package io.intellixity.mosaic.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.mosaic.spi.BackendConnectException;
import io.intellixity.mosaic.spi.BackendConnection;
import io.intellixity.mosaic.spi.BackendKind;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Backend kind {@code mongodb}.
 * <p>
 * Params: {@code connectionUri} (required), {@code database} (pin the mount to one database) and
 * {@code serverSelectionTimeoutMs} (default 5000). Opening pings the server so a bad address fails the mount
 * instead of the first read.
 */
public final class MongoBackendKind implements BackendKind {
  private static final Logger log = LoggerFactory.getLogger(MongoBackendKind.class);

  public static final String ID = "mongodb";
  public static final String CONNECTION_URI = "connectionUri";
  public static final String DATABASE = "database";
  public static final String SERVER_SELECTION_TIMEOUT_MS = "serverSelectionTimeoutMs";

  private static final long DEFAULT_TIMEOUT_MS = 5_000;

  @Override
  public String id() {
    return ID;
  }

  @Override
  public BackendConnection open(Map<String, String> params) {
    ConnectionString uri = connectionString(params.get(CONNECTION_URI));
    long timeoutMs = timeoutMs(params.get(SERVER_SELECTION_TIMEOUT_MS));
    MongoPaths paths = new MongoPaths(params.get(DATABASE));

    MongoClient client = MongoClients.create(MongoClientSettings.builder()
        .applyConnectionString(uri)
        .applyToClusterSettings(b -> b.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS))
        .build());
    try {
      client.getDatabase(paths.database().orElse("admin")).runCommand(new Document("ping", 1));
    } catch (RuntimeException e) {
      client.close();
      throw new BackendConnectException("Cannot reach MongoDB at " + uri.getHosts() + ": " + e.getMessage(), e);
    }
    log.info("mosaic.mongo connected hosts={} database={}", uri.getHosts(), paths.database().orElse("*"));
    return BackendConnection.of(new MongoBackend(client, paths));
  }

  static ConnectionString connectionString(String raw) {
    if (raw == null || raw.isBlank()) throw new BackendConnectException(CONNECTION_URI + " is required");
    try {
      return new ConnectionString(raw.trim());
    } catch (IllegalArgumentException e) {
      throw new BackendConnectException("Invalid " + CONNECTION_URI + ": " + e.getMessage(), e);
    }
  }

  static long timeoutMs(String raw) {
    if (raw == null || raw.isBlank()) return DEFAULT_TIMEOUT_MS;
    try {
      long v = Long.parseLong(raw.trim());
      if (v <= 0) throw new BackendConnectException(SERVER_SELECTION_TIMEOUT_MS + " must be > 0");
      return v;
    } catch (NumberFormatException e) {
      throw new BackendConnectException("Invalid " + SERVER_SELECTION_TIMEOUT_MS + ": " + raw, e);
    }
  }
}
