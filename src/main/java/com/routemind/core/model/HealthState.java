package com.routemind.core.model;

/**
 * Cached liveness of a backend as last observed by the health monitor.
 */
public enum HealthState {
    ONLINE,
    DEGRADED,   // probes failing, failure threshold not reached yet
    OFFLINE,
    UNKNOWN     // not probed yet
}
