package com.lorasim.core.health;

import com.lorasim.core.timeline.TimelineParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PreflightCheckServiceTest {

    @TempDir
    Path dir;

    private PreflightCheckService service;

    @BeforeEach
    void setUp() {
        service = new PreflightCheckService(new TimelineParser());
    }

    @Test
    @DisplayName("reports a missing executable as DOWN")
    void missingExecutable() {
        var status = service.checkExecutable(dir.resolve("network_simulator"));

        assertEquals("executable", status.check());
        assertEquals(PreflightResult.Status.DOWN, status.status());
        assertTrue(status.detail().contains("not found"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("reports a non-executable file as DOWN and an executable one as UP")
    void executableBit() throws Exception {
        Path exe = Files.writeString(dir.resolve("node.sh"), "#!/bin/sh\n");
        assertTrue(exe.toFile().setExecutable(false));
        assertEquals(PreflightResult.Status.DOWN, service.checkExecutable(exe).status());

        assertTrue(exe.toFile().setExecutable(true));
        assertEquals(PreflightResult.Status.UP, service.checkExecutable(exe).status());
    }

    @Test
    @DisplayName("an existing or creatable output directory is UP")
    void outdir() throws Exception {
        assertEquals(PreflightResult.Status.UP, service.checkOutdir(dir).status());
        assertEquals(PreflightResult.Status.UP, service.checkOutdir(dir.resolve("a/b")).status());

        Path file = Files.writeString(dir.resolve("file"), "x");
        assertEquals(PreflightResult.Status.DOWN, service.checkOutdir(file).status());
    }

    @Test
    @DisplayName("a clean timeline addressing configured nodes is UP")
    void cleanTimeline() throws Exception {
        Path input = Files.writeString(dir.resolve("events.csv"), "0,-1,0110\n1,A,x\n");

        var status = service.checkTimeline(input, List.of("A", "B"));

        assertEquals(PreflightResult.Status.UP, status.status());
        assertTrue(status.detail().startsWith("2 events"));
        assertTrue(status.findings().isEmpty());
    }

    @Test
    @DisplayName("skipped lines or unknown destinations degrade the timeline check")
    void degradedTimeline() throws Exception {
        Path malformed = Files.writeString(dir.resolve("bad.csv"), "1,A,x\noops\n");
        var skipped = service.checkTimeline(malformed, List.of("A"));
        assertEquals(PreflightResult.Status.DEGRADED, skipped.status());
        assertEquals(1, skipped.findings().size());
        assertTrue(skipped.findings().get(0).startsWith("line 2: "), skipped.findings().toString());

        Path unknown = Files.writeString(dir.resolve("unknown.csv"), "1,Z,x\n");
        var status = service.checkTimeline(unknown, List.of("A"));
        assertEquals(PreflightResult.Status.DEGRADED, status.status());
        assertEquals(List.of("unknown destination Z"), status.findings());
    }

    @Test
    @DisplayName("a missing timeline is DOWN")
    void missingTimeline() {
        var status = service.checkTimeline(dir.resolve("missing.csv"), List.of("A"));
        assertEquals(PreflightResult.Status.DOWN, status.status());
    }

    @Test
    @DisplayName("checkAll runs every check in order")
    void checkAll() throws Exception {
        Path input = Files.writeString(dir.resolve("events.csv"), "1,A,x\n");

        var results = service.checkAll(dir.resolve("missing-exe"), dir, input, List.of("A"));

        assertEquals(List.of("executable", "outdir", "timeline"),
                results.stream().map(PreflightResult::check).toList());
        assertEquals(PreflightResult.Status.DOWN, results.get(0).status());
    }
}
