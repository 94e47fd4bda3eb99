package com.dealdesk.deal_bff.model;

/** A single problem found while walking one source's hash chain. */
public record ChainIssue(Type type, Long sequenceNumber, String eventId, String message) {

  public enum Type {
    SEQUENCE_GAP,
    CHAIN_BREAK,
    AUTHORITY_REPORTED,
    UNAVAILABLE
  }

  public static ChainIssue sequenceGap(long expected, Long found, String eventId) {
    return new ChainIssue(
        Type.SEQUENCE_GAP,
        found,
        eventId,
        "Sequence gap: expected " + expected + ", found " + found);
  }

  public static ChainIssue chainBreak(Long sequenceNumber, String eventId) {
    return new ChainIssue(
        Type.CHAIN_BREAK, sequenceNumber, eventId, "Chain break at sequence " + sequenceNumber);
  }
}
