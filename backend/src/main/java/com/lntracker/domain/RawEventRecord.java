package com.lntracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Stream event stored untransformed. There is no natural key, so the id is
 * (nodeId, receivedAt, payload digest).
 */
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public abstract class RawEventRecord implements TrackedRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String nodeId;
    private String type;
    private Instant receivedAt;
    private org.bson.Document payload;
}
