/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.storage.file;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.BaseEncoding;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.signal.ledger.verifier.storage.TrustStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A trust state repository that keeps one file per server and database in a directory.
 */
@Singleton
@Requires(property = "trust-store.file.directory")
public class FileTrustStateRepository implements TrustStateRepository {

  private static final Logger logger = LoggerFactory.getLogger(FileTrustStateRepository.class);
  private static final String FILE_SUFFIX = ".state";
  private final Path directory;

  public FileTrustStateRepository(@Property(name = "trust-store.file.directory") final String directory) {
    this.directory = Paths.get(directory);
  }

  @Override
  public Optional<byte[]> getTrustState(final String serverIdentity, final String database) throws IOException {
    final Path path = pathFor(serverIdentity, database);
    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (final NoSuchFileException e) {
      logger.info("Trust state for {} on {} not found", database, serverIdentity);
      return Optional.empty();
    } catch (final IOException e) {
      logger.error("Unexpected error reading trust state from {}", path, e);
      throw e;
    }
  }

  @Override
  public void storeTrustState(final String serverIdentity, final String database,
      final byte[] serializedTrustState) throws IOException {
    final Path path = pathFor(serverIdentity, database);
    Path temporaryPath = null;
    try {
      Files.createDirectories(directory);
      // write to a sibling file first so a crash never leaves a truncated state behind
      temporaryPath = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
      Files.write(temporaryPath, serializedTrustState);
      Files.move(temporaryPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      logger.error("Unexpected error writing trust state to {}", path, e);
      throw e;
    } finally {
      if (temporaryPath != null) {
        deleteTemporaryFile(temporaryPath);
      }
    }
  }

  private static void deleteTemporaryFile(final Path temporaryPath) {
    try {
      Files.deleteIfExists(temporaryPath);
    } catch (final IOException e) {
      logger.warn("Could not delete temporary trust state file {}", temporaryPath, e);
    }
  }

  @VisibleForTesting
  Path pathFor(final String serverIdentity, final String database) {
    final String name = BaseEncoding.base64Url().omitPadding()
        .encode((serverIdentity + "/" + database).getBytes(StandardCharsets.UTF_8));
    return directory.resolve(name + FILE_SUFFIX);
  }
}
