package com.lntracker.domain;

import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Wallet transaction notification. lnd sends one when the transaction is seen and again
 * when it confirms, so a transaction usually has two rows.
 */
@Document(collection = "onchain_transactions")
@CompoundIndex(name = "node_received", def = "{'nodeId': 1, 'receivedAt': 1}")
@NoArgsConstructor
public class OnchainTransactionRecord extends RawEventRecord {
}
