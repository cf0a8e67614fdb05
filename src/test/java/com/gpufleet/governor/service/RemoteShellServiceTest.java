package com.gpufleet.governor.service;

import com.gpufleet.governor.model.CommandResult;
import com.gpufleet.governor.model.Machine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RemoteShellServiceTest {

    private RemoteShellService remoteShell;

    @TempDir
    Path keysDir;

    @BeforeEach
    void setUp() {
        remoteShell = new RemoteShellService();
        remoteShell.setKeysDir(keysDir.toString());
        remoteShell.setDefaultKey("");
    }

    private static Machine machineWithKeys(String... keys) {
        return Machine.builder().id("m1").name("train-1").sshKeyNames(List.of(keys)).build();
    }

    @Test
    void shouldBuildNonInteractiveSshCommand() {
        List<String> command = remoteShell.buildSshCommand("1.2.3.4", "uptime", "/keys/alice.pem");

        assertEquals("ssh", command.get(0));
        assertTrue(command.contains("BatchMode=yes"));
        assertTrue(command.contains("StrictHostKeyChecking=no"));
        assertEquals("/keys/alice.pem", command.get(command.indexOf("-i") + 1));
        assertEquals("ubuntu@1.2.3.4", command.get(command.size() - 2));
        assertEquals("uptime", command.get(command.size() - 1));
    }

    @Test
    void shouldOmitIdentityWhenNoKey() {
        assertFalse(remoteShell.buildSshCommand("1.2.3.4", "uptime", null).contains("-i"));
    }

    @Test
    void shouldResolveKeyWithPemSuffix() throws Exception {
        Path key = Files.createFile(keysDir.resolve("alice.pem"));

        Optional<String> resolved = remoteShell.resolveKeyFor(machineWithKeys("alice"));

        assertEquals(Optional.of(key.toString()), resolved);
    }

    @Test
    void shouldPreferExactFileName() throws Exception {
        Path exact = Files.createFile(keysDir.resolve("alice"));
        Files.createFile(keysDir.resolve("alice.key"));

        assertEquals(Optional.of(exact.toString()), remoteShell.resolveKeyFor(machineWithKeys("alice")));
    }

    @Test
    void shouldResolveFirstPemInKeyFolder() throws Exception {
        Path folder = Files.createDirectory(keysDir.resolve("bob"));
        Files.createFile(folder.resolve("zeta.pem"));
        Path first = Files.createFile(folder.resolve("alpha.pem"));

        assertEquals(Optional.of(first.toString()), remoteShell.resolveKeyFor(machineWithKeys("unknown", "bob")));
    }

    @Test
    void shouldFallBackToDefaultKey() throws Exception {
        Path fallback = Files.createFile(keysDir.resolve("id_rsa_default"));
        remoteShell.setDefaultKey(fallback.toString());

        assertEquals(Optional.of(fallback.toString()), remoteShell.resolveKeyFor(machineWithKeys("carol")));
    }

    @Test
    void shouldReturnEmptyWhenNoKeyFound() {
        assertTrue(remoteShell.resolveKeyFor(machineWithKeys("carol")).isEmpty());
    }

    @Test
    void shouldCaptureOutputAndExitCode() {
        CommandResult result = remoteShell.execute(List.of("sh", "-c", "echo 42; echo warn >&2; exit 3"), Duration.ofSeconds(10));

        assertEquals(3, result.getExitCode());
        assertEquals("42", result.getOutput().trim());
        assertEquals("warn", result.getError().trim());
        assertFalse(result.isSuccess());
    }

    @Test
    void shouldKillCommandOnTimeout() {
        CommandResult result = remoteShell.execute(List.of("sleep", "10"), Duration.ofMillis(200));

        assertEquals(CommandResult.NO_EXIT_CODE, result.getExitCode());
        assertTrue(result.getError().contains("Timed out"));
    }

    @Test
    void shouldReportMissingBinary() {
        CommandResult result = remoteShell.execute(List.of("no-such-binary-xyz"), Duration.ofSeconds(1));

        assertFalse(result.isSuccess());
    }

    @Test
    void shouldNotCopyMissingLocalFile() {
        CommandResult result = remoteShell.copyFile(keysDir.resolve("missing.sh").toString(), "1.2.3.4", "/tmp/x", null,
            Duration.ofSeconds(5));

        assertFalse(result.isSuccess());
    }
}
