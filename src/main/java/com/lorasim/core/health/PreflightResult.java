package com.lorasim.core.health;

import java.util.List;

/**
 * Outcome of one preflight check.
 *
 * @param check    which check ran: {@code executable}, {@code outdir} or {@code timeline}
 * @param status   overall verdict
 * @param detail   one-line summary for the console
 * @param findings the individual problems behind a DEGRADED verdict, one per line
 */
public record PreflightResult(
    String check,
    Status status,
    String detail,
    List<String> findings
) {

    public enum Status { UP, DEGRADED, DOWN }

    public PreflightResult {
        findings = List.copyOf(findings);
    }

    public static PreflightResult up(String check, String detail) {
        return new PreflightResult(check, Status.UP, detail, List.of());
    }

    public static PreflightResult down(String check, String detail) {
        return new PreflightResult(check, Status.DOWN, detail, List.of());
    }

    public static PreflightResult degraded(String check, String detail, List<String> findings) {
        return new PreflightResult(check, Status.DEGRADED, detail, findings);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
