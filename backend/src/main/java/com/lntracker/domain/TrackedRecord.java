package com.lntracker.domain;

/**
 * A row written by a tracker. The id is derived from the upstream item, so writing the
 * same item twice updates one document.
 */
public interface TrackedRecord {

    String getId();

    String getNodeId();
}
