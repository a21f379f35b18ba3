package com.synoptic.stationbot.model;

/**
 * Outcome of a quota reservation.
 *
 * <ul>
 *   <li>COMMITTED – the download event was appended</li>
 *   <li>DENIED    – quota exhausted, or the ledger could not be reached in time</li>
 *   <li>ABORTED   – the reservation was granted but the delivery did not complete, so
 *                   nothing was appended</li>
 * </ul>
 */
public enum QuotaDecision {
    COMMITTED,
    DENIED,
    ABORTED
}
