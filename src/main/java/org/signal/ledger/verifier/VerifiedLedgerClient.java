/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import org.signal.ledger.verifier.client.LedgerServiceClient;
import org.signal.ledger.verifier.crypto.Digest;
import org.signal.ledger.verifier.crypto.InclusionProof;
import org.signal.ledger.verifier.crypto.MerkleProofVerifier;
import org.signal.ledger.verifier.crypto.MerkleTree;
import org.signal.ledger.verifier.metrics.MetricsUtil;
import org.signal.ledger.verifier.trust.TrustAnchorCache;
import org.signal.ledger.verifier.trust.TrustState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes ledger data and verifies every response against the client's trusted state before returning it.
 * <p>
 * Each verified operation runs the same sequence:
 * <ol>
 *   <li>Load the trusted state of the current database, bootstrapping it from the server's current state if the
 *   client trusts nothing yet</li>
 *   <li>Make a single call to the ledger service, asking for proofs relative to the trusted transaction</li>
 *   <li>Recompute the digest of the returned entry from its raw key and value</li>
 *   <li>Verify that the digest is included in the entries tree of its transaction</li>
 *   <li>Verify that the transaction and the trusted state lie on the same append-only history</li>
 *   <li>Advance the trusted state</li>
 * </ol>
 * <p>Any failure aborts the operation without changing the trusted state. Transport failures are rethrown unchanged,
 * so callers can always tell them apart from a {@link LedgerVerificationException}.</p>
 */
@Singleton
public class VerifiedLedgerClient {

  private static final Logger logger = LoggerFactory.getLogger(VerifiedLedgerClient.class);
  private static final String OPERATION_TIMER_NAME = MetricsUtil.name(VerifiedLedgerClient.class, "verifiedOperation");

  private final LedgerServiceClient ledgerServiceClient;
  private final TrustAnchorCache trustAnchorCache;
  private final MeterRegistry meterRegistry;
  private volatile String database;

  public VerifiedLedgerClient(final LedgerServiceClient ledgerServiceClient,
      final TrustAnchorCache trustAnchorCache,
      final LedgerClientConfiguration configuration,
      final MeterRegistry meterRegistry) {
    this.ledgerServiceClient = ledgerServiceClient;
    this.trustAnchorCache = trustAnchorCache;
    this.meterRegistry = meterRegistry;
    this.database = configuration.database();
  }

  public String getDatabase() {
    return database;
  }

  /**
   * Directs subsequent operations to another database. Trusted states are kept per database, so switching never
   * carries trust from one database to another.
   */
  public void useDatabase(final String database) {
    logger.info("Switching from database {} to {}", this.database, database);
    this.database = database;
  }

  /**
   * Requires every state trusted from now on to be signed by the holder of the given key.
   *
   * @param pem a PEM-encoded elliptic curve public key
   */
  public void loadPublicKey(final String pem) throws InvalidKeySpecException {
    trustAnchorCache.loadPublicKey(pem);
  }

  public TrustState getState(final String database) throws SignatureInvalidException {
    return trustAnchorCache.get(database);
  }

  public TrustAnchorCache.SetResult setState(final String database, final TrustState state)
      throws SignatureInvalidException {
    return trustAnchorCache.set(database, state);
  }

  /**
   * Fetches the server's current state of the current database. The state is not verified against the trusted state
   * and does not replace it; only its database and, if a server key is configured, its signature are checked.
   */
  public TrustState currentState() throws LedgerVerificationException {
    return currentState(database);
  }

  TrustState currentState(final String database) throws LedgerVerificationException {
    final TrustState state = ledgerServiceClient.currentState(database);
    if (!database.equals(state.database())) {
      throw new TamperDetectedException(VerificationStage.ANCHOR_LOADED,
          "Server returned a state for database " + state.database() + " instead of " + database);
    }
    trustAnchorCache.verifySignature(state);
    return state;
  }

  public VerifiedEntry verifiedGet(final byte[] key) throws LedgerVerificationException {
    return instrument("verifiedGet", this.database,
        database -> verifiedGet(database, EntryLookup.latest(key)));
  }

  public VerifiedEntry verifiedGetAtTx(final byte[] key, final long txId) throws LedgerVerificationException {
    return instrument("verifiedGetAtTx", this.database,
        database -> verifiedGet(database, EntryLookup.atTx(key, txId)));
  }

  public VerifiedEntry verifiedGetSinceTx(final byte[] key, final long txId) throws LedgerVerificationException {
    return instrument("verifiedGetSinceTx", this.database,
        database -> verifiedGet(database, EntryLookup.sinceTx(key, txId)));
  }

  public VerifiedEntry verifiedGetAtRevision(final byte[] key, final long revision)
      throws LedgerVerificationException {
    return instrument("verifiedGetAtRevision", this.database,
        database -> verifiedGet(database, EntryLookup.atRevision(key, revision)));
  }

  public VerifiedTx verifiedSet(final byte[] key, final byte[] value) throws LedgerVerificationException {
    return instrument("verifiedSet", this.database, database -> {
      final TrustState anchor = loadAnchor(database);
      final VerifiableTx verifiableTx = ledgerServiceClient.verifiableSet(database, key, value, anchor.txId());
      return verifyWrite(database, anchor, verifiableTx, new PlainEntry(key, value));
    });
  }

  public VerifiedTx verifiedSetReference(final byte[] key, final byte[] referencedKey)
      throws LedgerVerificationException {
    return verifiedSetReference(key, referencedKey, 0);
  }

  /**
   * @param atTx the transaction at which {@code referencedKey} is read, or 0 to always read its latest value
   */
  public VerifiedTx verifiedSetReference(final byte[] key, final byte[] referencedKey, final long atTx)
      throws LedgerVerificationException {
    return instrument("verifiedSetReference", this.database, database -> {
      final TrustState anchor = loadAnchor(database);
      final VerifiableTx verifiableTx =
          ledgerServiceClient.verifiableSetReference(database, key, referencedKey, atTx, anchor.txId());
      return verifyWrite(database, anchor, verifiableTx, new ReferenceEntry(key, referencedKey, atTx));
    });
  }

  public VerifiedTx verifiedZAdd(final byte[] set, final byte[] key, final double score)
      throws LedgerVerificationException {
    return verifiedZAdd(set, key, 0, score);
  }

  /**
   * @param atTx the transaction at which {@code key} is read, or 0 to always read its latest value
   */
  public VerifiedTx verifiedZAdd(final byte[] set, final byte[] key, final long atTx, final double score)
      throws LedgerVerificationException {
    return instrument("verifiedZAdd", this.database, database -> {
      final TrustState anchor = loadAnchor(database);
      final VerifiableTx verifiableTx =
          ledgerServiceClient.verifiableZAdd(database, set, score, key, atTx, anchor.txId());
      return verifyWrite(database, anchor, verifiableTx, new SortedSetEntry(set, score, key, atTx));
    });
  }

  public VerifiedTx verifiedTxById(final long txId) throws LedgerVerificationException {
    return verifiedTxById(database, txId);
  }

  VerifiedTx verifiedTxById(final String database, final long txId) throws LedgerVerificationException {
    return instrument("verifiedTxById", database, ignored -> {
      final TrustState anchor = loadAnchor(database);
      final VerifiableTx verifiableTx = ledgerServiceClient.verifiableTxById(database, txId, anchor.txId());
      final Tx tx = verifiableTx.tx();
      final TxMetadata metadata = tx.metadata();

      if (metadata.id() != txId) {
        throw new TamperDetectedException(VerificationStage.DIGEST_RECOMPUTED,
            "Server returned transaction " + metadata.id() + " instead of " + txId);
      }
      if (tx.entries().isEmpty() || tx.entries().size() != metadata.entryCount()) {
        throw new TamperDetectedException(VerificationStage.DIGEST_RECOMPUTED,
            "Transaction " + txId + " lists " + tx.entries().size() + " of " + metadata.entryCount() + " entries");
      }
      if (!tx.entriesTree().getRootHash().equals(metadata.entriesHash())) {
        throw new TamperDetectedException(VerificationStage.INCLUSION_VERIFIED,
            "Entries of transaction " + txId + " do not match its entries hash");
      }

      final DualProof dualProof = verifiableTx.dualProof();
      final TxMetadata provenMetadata = anchor.txId() <= txId
          ? dualProof.targetTxMetadata()
          : dualProof.sourceTxMetadata();
      if (provenMetadata == null || !metadata.alh().equals(provenMetadata.alh())) {
        throw new TamperDetectedException(VerificationStage.DUAL_VERIFIED,
            "Transaction " + txId + " does not match the header covered by the dual proof");
      }

      advanceAnchor(database, verifyDualProof(database, anchor, txId, dualProof, verifiableTx.signature()));
      return new VerifiedTx(metadata, tx.entries().stream().map(TxEntry::encodedKey).toList(), true);
    });
  }

  private VerifiedEntry verifiedGet(final String database, final EntryLookup lookup)
      throws LedgerVerificationException {
    final TrustState anchor = loadAnchor(database);
    final VerifiableEntry verifiableEntry = ledgerServiceClient.verifiableGet(database, lookup, anchor.txId());
    final KeyValueEntry entry = verifiableEntry.entry();

    final LedgerEntry ledgerEntry;
    final long entryTxId;
    if (entry.referencedBy() == null) {
      if (!Arrays.equals(lookup.key(), entry.key())) {
        throw new TamperDetectedException(VerificationStage.DIGEST_RECOMPUTED,
            "Server returned an entry for a different key");
      }
      ledgerEntry = new PlainEntry(entry.key(), entry.value());
      entryTxId = entry.tx();
    } else {
      final EntryReference reference = entry.referencedBy();
      if (!Arrays.equals(lookup.key(), reference.key())) {
        throw new TamperDetectedException(VerificationStage.DIGEST_RECOMPUTED,
            "Server resolved a reference from a different key");
      }
      ledgerEntry = new ReferenceEntry(reference.key(), entry.key(), reference.atTx());
      entryTxId = reference.tx();
    }

    if (lookup.atTx() != 0 && entryTxId != lookup.atTx()) {
      throw new TamperDetectedException(VerificationStage.DIGEST_RECOMPUTED,
          "Server returned an entry from transaction " + entryTxId + " instead of " + lookup.atTx());
    }

    final DualProof dualProof = verifiableEntry.verifiableTx().dualProof();
    final TxMetadata entryTxMetadata = anchor.txId() <= entryTxId
        ? dualProof.targetTxMetadata()
        : dualProof.sourceTxMetadata();
    if (entryTxMetadata == null) {
      throw new MalformedProofException("Dual proof is missing transaction metadata");
    }
    if (entryTxMetadata.id() != entryTxId) {
      throw new TamperDetectedException(VerificationStage.DIGEST_RECOMPUTED,
          "Proof describes transaction " + entryTxMetadata.id() + " instead of " + entryTxId);
    }

    final Digest entryDigest = ledgerEntry.encode().digest(entryTxMetadata.version());
    verifyInclusion(verifiableEntry.inclusionProof(), entryDigest, entryTxMetadata);

    advanceAnchor(database,
        verifyDualProof(database, anchor, entryTxId, dualProof, verifiableEntry.verifiableTx().signature()));

    return new VerifiedEntry(entry.key(), entry.value(), entryTxId, entryTxMetadata.timestamp(), entry.revision(),
        entry.referencedBy() == null ? null : entry.referencedBy().key(), true);
  }

  /**
   * Verifies the response to a write of a single entry. The entries tree is rebuilt from the returned transaction, so
   * inclusion of the locally encoded entry is proven without relying on a server-supplied audit path.
   */
  private VerifiedTx verifyWrite(final String database, final TrustState anchor, final VerifiableTx verifiableTx,
      final LedgerEntry ledgerEntry) throws LedgerVerificationException {

    final Tx tx = verifiableTx.tx();
    final TxMetadata metadata = tx.metadata();

    if (metadata.entryCount() != 1 || tx.entries().size() != 1) {
      throw new TamperDetectedException(VerificationStage.DIGEST_RECOMPUTED,
          "Expected a single entry in transaction " + metadata.id() + ", got " + metadata.entryCount());
    }

    final EncodedEntry encodedEntry = ledgerEntry.encode();
    final Digest entryDigest = encodedEntry.digest(metadata.version());
    final InclusionProof inclusionProof = tx.inclusionProof(encodedEntry.key())
        .orElseThrow(() -> new TamperDetectedException(VerificationStage.INCLUSION_VERIFIED,
            "Transaction " + metadata.id() + " does not contain the written key"));
    verifyInclusion(inclusionProof, entryDigest, metadata);

    final DualProof dualProof = verifiableTx.dualProof();
    final TxMetadata provenMetadata = anchor.txId() <= metadata.id()
        ? dualProof.targetTxMetadata()
        : dualProof.sourceTxMetadata();
    if (provenMetadata == null || !metadata.alh().equals(provenMetadata.alh())) {
      throw new TamperDetectedException(VerificationStage.DUAL_VERIFIED,
          "Transaction " + metadata.id() + " does not match the header covered by the dual proof");
    }

    advanceAnchor(database, verifyDualProof(database, anchor, metadata.id(), dualProof, verifiableTx.signature()));
    return new VerifiedTx(metadata, tx.entries().stream().map(TxEntry::encodedKey).toList(), true);
  }

  private TrustState loadAnchor(final String database) throws LedgerVerificationException {
    final TrustState anchor = trustAnchorCache.get(database);
    if (!anchor.isEmpty()) {
      return anchor;
    }

    // Nothing is trusted yet, so accept the server's current state on first use
    final TrustState serverState = currentState(database);
    if (trustAnchorCache.set(database, serverState) == TrustAnchorCache.SetResult.ADVANCED) {
      logger.info("Bootstrapped trust for {} at tx {}", database, serverState.txId());
    }
    return trustAnchorCache.get(database);
  }

  private static void verifyInclusion(final InclusionProof inclusionProof, final Digest entryDigest,
      final TxMetadata txMetadata) throws LedgerVerificationException {
    if (!MerkleProofVerifier.verifyInclusion(inclusionProof, MerkleTree.leafHash(entryDigest),
        txMetadata.entriesHash())) {
      throw new TamperDetectedException(VerificationStage.INCLUSION_VERIFIED,
          "Entry is not included in transaction " + txMetadata.id());
    }
  }

  /**
   * Checks that the transaction {@code txId} and the trusted state lie on one history, in whichever order they occur.
   *
   * @return the state to trust afterwards: the later of the two
   */
  @VisibleForTesting
  static TrustState verifyDualProof(final String database, final TrustState anchor, final long txId,
      final DualProof dualProof, @Nullable final byte[] signature) throws LedgerVerificationException {

    if (dualProof.sourceTxMetadata() == null || dualProof.targetTxMetadata() == null) {
      throw new MalformedProofException("Dual proof is missing transaction metadata");
    }

    final long sourceTxId;
    final long targetTxId;
    final Digest sourceAlh;
    final Digest targetAlh;

    if (anchor.txId() <= txId) {
      sourceTxId = anchor.txId();
      sourceAlh = anchor.txHash();
      targetTxId = txId;
      targetAlh = dualProof.targetTxMetadata().alh();
    } else {
      // the trusted state is already ahead of the transaction, e.g. a concurrent call advanced it
      sourceTxId = txId;
      sourceAlh = dualProof.sourceTxMetadata().alh();
      targetTxId = anchor.txId();
      targetAlh = anchor.txHash();
    }

    if (!anchor.isEmpty()
        && !DualProofVerifier.verifyDual(dualProof, sourceTxId, targetTxId, sourceAlh, targetAlh)) {
      throw new TamperDetectedException(VerificationStage.DUAL_VERIFIED,
          "Transaction " + sourceTxId + " is not an ancestor of transaction " + targetTxId);
    }

    return new TrustState(database, targetTxId, targetAlh, signature);
  }

  private void advanceAnchor(final String database, final TrustState state) throws SignatureInvalidException {
    if (trustAnchorCache.set(database, state) == TrustAnchorCache.SetResult.STALE) {
      logger.debug("Verified tx {} for {} without advancing trust", state.txId(), database);
    }
  }

  private <T> T instrument(final String operation, final String database,
      final VerifiedOperation<T> verifiedOperation) throws LedgerVerificationException {

    final Timer.Sample sample = Timer.start();
    String outcome = "verified";
    try {
      return verifiedOperation.call(database);
    } catch (final TamperDetectedException e) {
      outcome = "tamperDetected";
      logger.error("Tampering detected during {} on {}: {}", operation, database, e.getMessage());
      throw e;
    } catch (final SignatureInvalidException e) {
      outcome = "signatureInvalid";
      logger.error("Invalid server signature during {} on {}: {}", operation, database, e.getMessage());
      throw e;
    } catch (final MalformedProofException e) {
      outcome = "malformedProof";
      logger.warn("Malformed proof during {} on {}: {}", operation, database, e.getMessage());
      throw e;
    } catch (final RuntimeException e) {
      outcome = "error";
      throw e;
    } finally {
      sample.stop(meterRegistry.timer(OPERATION_TIMER_NAME,
          "operation", operation, "database", database, "outcome", outcome));
    }
  }

  @FunctionalInterface
  private interface VerifiedOperation<T> {

    T call(String database) throws LedgerVerificationException;
  }
}
