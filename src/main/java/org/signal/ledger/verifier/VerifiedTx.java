/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import java.util.List;

/**
 * A transaction whose contents and position in the ledger have been verified.
 *
 * @param metadata    the transaction header
 * @param encodedKeys the encoded keys of the transaction's entries, in commit order
 * @param verified    always {@code true}; failed verifications throw instead of returning
 */
public record VerifiedTx(TxMetadata metadata, List<byte[]> encodedKeys, boolean verified) {
}
