package com.routemind.core.registry;

/**
 * Outcome of probing one backend.
 *
 * @param healthy true when one of the health endpoints answered HTTP 200
 * @param detail  the endpoint that answered, or why every endpoint failed
 */
public record ProbeResult(boolean healthy, String detail) {

    public ProbeResult {
        detail = detail == null ? "" : detail;
    }

    public static ProbeResult up(String detail) {
        return new ProbeResult(true, detail);
    }

    public static ProbeResult down(String detail) {
        return new ProbeResult(false, detail);
    }
}
