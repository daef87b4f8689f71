package com.scratchodds.domain.model;

/**
 * Phases of one snapshot run.
 * ERROR is reachable only from LISTING and abandons the whole run.
 */
public enum SnapshotState {
    IDLE,
    LISTING,
    DETAILING,
    DONE,
    ERROR
}
