package com.lntracker.domain;

import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Channel event update (open, close, active, inactive, pending).
 */
@Document(collection = "channel_events")
@CompoundIndex(name = "node_received", def = "{'nodeId': 1, 'receivedAt': 1}")
@NoArgsConstructor
public class ChannelEventRecord extends RawEventRecord {
}
