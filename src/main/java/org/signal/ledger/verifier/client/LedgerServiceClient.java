/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.client;

import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.ByteString;
import io.grpc.StatusRuntimeException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.signal.ledger.verifier.DualProof;
import org.signal.ledger.verifier.EntryLookup;
import org.signal.ledger.verifier.EntryReference;
import org.signal.ledger.verifier.KeyValueEntry;
import org.signal.ledger.verifier.LedgerClientConfiguration;
import org.signal.ledger.verifier.LinearProof;
import org.signal.ledger.verifier.MalformedProofException;
import org.signal.ledger.verifier.Tx;
import org.signal.ledger.verifier.TxEntry;
import org.signal.ledger.verifier.TxMetadata;
import org.signal.ledger.verifier.VerifiableEntry;
import org.signal.ledger.verifier.VerifiableTx;
import org.signal.ledger.verifier.crypto.Digest;
import org.signal.ledger.verifier.crypto.InclusionProof;
import org.signal.ledger.verifier.metrics.MetricsUtil;
import org.signal.ledger.verifier.trust.TrustState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client that talks to the ledger service's verifiable RPCs and converts its responses into the types the
 * verification engine works with. It performs no verification itself, and transport failures are rethrown unchanged.
 */
@Singleton
public class LedgerServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(LedgerServiceClient.class);

  private final LedgerServiceGrpc.LedgerServiceBlockingStub stub;
  private final Duration requestTimeout;
  private final MeterRegistry meterRegistry;

  public LedgerServiceClient(final LedgerServiceGrpc.LedgerServiceBlockingStub stub,
      final LedgerClientConfiguration configuration,
      final MeterRegistry meterRegistry) {
    this.stub = stub;
    this.requestTimeout = configuration.requestTimeout();
    this.meterRegistry = meterRegistry;
  }

  /**
   * @return the server's current, unverified state of the given database
   */
  public TrustState currentState(final String database) throws MalformedProofException {
    final LedgerProto.ImmutableState state = call("currentState", () -> stub()
        .currentState(LedgerProto.CurrentStateRequest.newBuilder()
            .setDatabase(database)
            .build()));

    try {
      return new TrustState(state.getDatabase(),
          state.getTxId(),
          state.getTxId() == 0 && state.getTxHash().isEmpty() ? Digest.ZERO : toDigest(state.getTxHash()),
          state.hasSignature() ? nonEmptyBytes(state.getSignature().getSignature()) : null);
    } catch (final IllegalArgumentException e) {
      throw new MalformedProofException("Malformed server state: " + e.getMessage());
    }
  }

  public VerifiableEntry verifiableGet(final String database, final EntryLookup lookup, final long proveSinceTx)
      throws MalformedProofException {

    final LedgerProto.VerifiableEntry response = call("verifiableGet", () -> stub()
        .verifiableGet(LedgerProto.VerifiableGetRequest.newBuilder()
            .setDatabase(database)
            .setKeyRequest(LedgerProto.KeyRequest.newBuilder()
                .setKey(ByteString.copyFrom(lookup.key()))
                .setAtTx(lookup.atTx())
                .setSinceTx(lookup.sinceTx())
                .setAtRevision(lookup.atRevision()))
            .setProveSinceTx(proveSinceTx)
            .build()));

    return fromVerifiableEntryProtobuf(response);
  }

  public VerifiableTx verifiableSet(final String database, final byte[] key, final byte[] value,
      final long proveSinceTx) throws MalformedProofException {

    final LedgerProto.VerifiableTx response = call("verifiableSet", () -> stub()
        .verifiableSet(LedgerProto.VerifiableSetRequest.newBuilder()
            .setDatabase(database)
            .setKv(LedgerProto.KeyValue.newBuilder()
                .setKey(ByteString.copyFrom(key))
                .setValue(ByteString.copyFrom(value)))
            .setProveSinceTx(proveSinceTx)
            .build()));

    return fromVerifiableTxProtobuf(response);
  }

  public VerifiableTx verifiableSetReference(final String database, final byte[] key, final byte[] referencedKey,
      final long atTx, final long proveSinceTx) throws MalformedProofException {

    final LedgerProto.VerifiableTx response = call("verifiableSetReference", () -> stub()
        .verifiableSetReference(LedgerProto.VerifiableReferenceRequest.newBuilder()
            .setDatabase(database)
            .setReferenceRequest(LedgerProto.ReferenceRequest.newBuilder()
                .setKey(ByteString.copyFrom(key))
                .setReferencedKey(ByteString.copyFrom(referencedKey))
                .setAtTx(atTx)
                .setBoundRef(atTx > 0))
            .setProveSinceTx(proveSinceTx)
            .build()));

    return fromVerifiableTxProtobuf(response);
  }

  public VerifiableTx verifiableZAdd(final String database, final byte[] set, final double score, final byte[] key,
      final long atTx, final long proveSinceTx) throws MalformedProofException {

    final LedgerProto.VerifiableTx response = call("verifiableZAdd", () -> stub()
        .verifiableZAdd(LedgerProto.VerifiableZAddRequest.newBuilder()
            .setDatabase(database)
            .setZAddRequest(LedgerProto.ZAddRequest.newBuilder()
                .setSet(ByteString.copyFrom(set))
                .setScore(score)
                .setKey(ByteString.copyFrom(key))
                .setAtTx(atTx)
                .setBoundRef(atTx > 0))
            .setProveSinceTx(proveSinceTx)
            .build()));

    return fromVerifiableTxProtobuf(response);
  }

  public VerifiableTx verifiableTxById(final String database, final long txId, final long proveSinceTx)
      throws MalformedProofException {

    final LedgerProto.VerifiableTx response = call("verifiableTxById", () -> stub()
        .verifiableTxById(LedgerProto.VerifiableTxRequest.newBuilder()
            .setDatabase(database)
            .setTx(txId)
            .setProveSinceTx(proveSinceTx)
            .build()));

    return fromVerifiableTxProtobuf(response);
  }

  private LedgerServiceGrpc.LedgerServiceBlockingStub stub() {
    return stub.withDeadlineAfter(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private <T> T call(final String rpc, final Supplier<T> request) {
    final Timer.Sample sample = Timer.start();
    String outcome = "success";
    try {
      return request.get();
    } catch (final StatusRuntimeException e) {
      outcome = e.getStatus().getCode().name();
      logger.warn("Ledger service call {} failed: {}", rpc, e.getStatus());
      throw e;
    } finally {
      sample.stop(meterRegistry.timer(MetricsUtil.name(LedgerServiceClient.class, "rpc"),
          "rpc", rpc, "outcome", outcome));
    }
  }

  @VisibleForTesting
  static VerifiableEntry fromVerifiableEntryProtobuf(final LedgerProto.VerifiableEntry protobuf)
      throws MalformedProofException {

    if (!protobuf.hasEntry() || !protobuf.hasVerifiableTx() || !protobuf.hasInclusionProof()) {
      throw new MalformedProofException("Verifiable entry is missing its entry or proofs");
    }

    final LedgerProto.Entry entry = protobuf.getEntry();
    final EntryReference referencedBy = entry.hasReferencedBy()
        ? new EntryReference(entry.getReferencedBy().getTx(),
        entry.getReferencedBy().getKey().toByteArray(),
        entry.getReferencedBy().getAtTx())
        : null;

    try {
      return new VerifiableEntry(
          new KeyValueEntry(entry.getTx(), entry.getKey().toByteArray(), entry.getValue().toByteArray(), referencedBy,
              entry.getRevision()),
          fromVerifiableTxProtobuf(protobuf.getVerifiableTx()),
          new InclusionProof(protobuf.getInclusionProof().getLeaf(),
              protobuf.getInclusionProof().getWidth(),
              toDigests(protobuf.getInclusionProof().getTermsList())));
    } catch (final IllegalArgumentException e) {
      throw new MalformedProofException("Malformed verifiable entry: " + e.getMessage());
    }
  }

  @VisibleForTesting
  static VerifiableTx fromVerifiableTxProtobuf(final LedgerProto.VerifiableTx protobuf)
      throws MalformedProofException {

    if (!protobuf.hasTx() || !protobuf.getTx().hasHeader() || !protobuf.hasDualProof()) {
      throw new MalformedProofException("Verifiable transaction is missing its header or dual proof");
    }

    final LedgerProto.DualProof dualProof = protobuf.getDualProof();
    if (!dualProof.hasSourceTxHeader() || !dualProof.hasTargetTxHeader() || !dualProof.hasLinearProof()) {
      throw new MalformedProofException("Dual proof is missing transaction metadata or its linear proof");
    }

    try {
      final List<TxEntry> entries = new ArrayList<>(protobuf.getTx().getEntriesCount());
      for (final LedgerProto.TxEntry entry : protobuf.getTx().getEntriesList()) {
        entries.add(new TxEntry(entry.getKey().toByteArray(), toDigest(entry.getHValue())));
      }

      return new VerifiableTx(
          new Tx(fromTxHeaderProtobuf(protobuf.getTx().getHeader()), entries),
          new DualProof(
              fromTxHeaderProtobuf(dualProof.getSourceTxHeader()),
              fromTxHeaderProtobuf(dualProof.getTargetTxHeader()),
              toDigests(dualProof.getInclusionProofList()),
              toDigests(dualProof.getConsistencyProofList()),
              dualProof.getTargetBlTxAlh().isEmpty() ? null : toDigest(dualProof.getTargetBlTxAlh()),
              toDigests(dualProof.getLastInclusionProofList()),
              new LinearProof(dualProof.getLinearProof().getSourceTxId(),
                  dualProof.getLinearProof().getTargetTxId(),
                  toDigests(dualProof.getLinearProof().getTermsList()))),
          protobuf.hasSignature() ? nonEmptyBytes(protobuf.getSignature().getSignature()) : null);
    } catch (final IllegalArgumentException e) {
      throw new MalformedProofException("Malformed verifiable transaction: " + e.getMessage());
    }
  }

  @VisibleForTesting
  static TxMetadata fromTxHeaderProtobuf(final LedgerProto.TxHeader protobuf) {
    return new TxMetadata(protobuf.getId(),
        toDigest(protobuf.getPrevAlh()),
        protobuf.getTs(),
        protobuf.getVersion(),
        protobuf.getNentries(),
        toDigest(protobuf.getEh()),
        protobuf.getBlTxId(),
        protobuf.getBlTxId() == 0 && protobuf.getBlRoot().isEmpty() ? Digest.ZERO : toDigest(protobuf.getBlRoot()));
  }

  private static Digest toDigest(final ByteString bytes) {
    return Digest.fromBytes(bytes.toByteArray());
  }

  private static List<Digest> toDigests(final List<ByteString> terms) {
    return terms.stream().map(LedgerServiceClient::toDigest).toList();
  }

  @Nullable
  private static byte[] nonEmptyBytes(final ByteString bytes) {
    return bytes.isEmpty() ? null : bytes.toByteArray();
  }
}
