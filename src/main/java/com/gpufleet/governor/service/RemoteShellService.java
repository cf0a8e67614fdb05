package com.gpufleet.governor.service;

import com.gpufleet.governor.model.CommandResult;
import com.gpufleet.governor.model.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands on fleet machines over {@code ssh} and copies files with {@code scp}.
 * <p>
 * Nothing here throws to callers: timeouts, unreachable hosts and missing binaries all come back
 * as a {@link CommandResult} with a non-zero exit code.
 */
@Service
public class RemoteShellService {

    private static final Logger log = LoggerFactory.getLogger(RemoteShellService.class);

    private static final List<String> KEY_SUFFIXES = List.of("", ".pem", ".key");

    @Value("${fleet.ssh.user:ubuntu}")
    private String user = "ubuntu";

    @Value("${fleet.ssh.keys-dir:keys}")
    private String keysDir = "keys";

    @Value("${fleet.ssh.default-key:}")
    private String defaultKey = "";

    @Value("${fleet.ssh.connect-timeout-seconds:10}")
    private long connectTimeoutSeconds = 10;

    public void setUser(String user) {
        this.user = user;
    }

    public void setKeysDir(String keysDir) {
        this.keysDir = keysDir;
    }

    public void setDefaultKey(String defaultKey) {
        this.defaultKey = defaultKey;
    }

    public CommandResult runCommand(String address, String command, String keyPath, Duration timeout) {
        return execute(buildSshCommand(address, command, keyPath), timeout);
    }

    public CommandResult copyFile(String localPath, String address, String remotePath, String keyPath, Duration timeout) {
        if (!new File(localPath).isFile()) {
            return CommandResult.failure("Local file not found: " + localPath);
        }
        List<String> scp = new ArrayList<>(List.of("scp"));
        scp.addAll(connectionOptions(keyPath));
        scp.add(localPath);
        scp.add(user + "@" + address + ":" + remotePath);
        return execute(scp, timeout);
    }

    public List<String> buildSshCommand(String address, String command, String keyPath) {
        List<String> ssh = new ArrayList<>(List.of("ssh"));
        ssh.addAll(connectionOptions(keyPath));
        ssh.add(user + "@" + address);
        ssh.add(command);
        return ssh;
    }

    /**
     * Finds the private key for a machine in the keys directory, trying each of its ownership key
     * names as a plain file, with a {@code .pem} or {@code .key} suffix, and as a sub-folder holding
     * a {@code .pem} file. Falls back to the default key.
     */
    public Optional<String> resolveKeyFor(Machine machine) {
        File dir = new File(keysDir);
        if (dir.isDirectory() && machine.getSshKeyNames() != null) {
            for (String keyName : machine.getSshKeyNames()) {
                if (keyName == null || keyName.isBlank()) continue;
                for (String suffix : KEY_SUFFIXES) {
                    File candidate = new File(dir, keyName + suffix);
                    if (candidate.isFile()) {
                        return Optional.of(candidate.getPath());
                    }
                }
                File folder = new File(dir, keyName);
                if (folder.isDirectory()) {
                    File[] pems = folder.listFiles((d, name) -> name.endsWith(".pem"));
                    if (pems != null && pems.length > 0) {
                        Arrays.sort(pems, Comparator.comparing(File::getName));
                        return Optional.of(pems[0].getPath());
                    }
                }
            }
        }
        if (defaultKey != null && !defaultKey.isBlank() && new File(defaultKey).isFile()) {
            return Optional.of(defaultKey);
        }
        log.debug("No private key found for machine {} (keys {})", machine.label(), machine.getSshKeyNames());
        return Optional.empty();
    }

    private List<String> connectionOptions(String keyPath) {
        List<String> options = new ArrayList<>(List.of(
            "-o", "StrictHostKeyChecking=no",
            "-o", "UserKnownHostsFile=/dev/null",
            "-o", "BatchMode=yes",
            "-o", "LogLevel=ERROR",
            "-o", "ConnectTimeout=" + connectTimeoutSeconds));
        if (keyPath != null && !keyPath.isBlank()) {
            options.add("-i");
            options.add(keyPath);
        }
        return options;
    }

    CommandResult execute(List<String> command, Duration timeout) {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            log.warn("Could not start {}: {}", command.get(0), e.getMessage());
            return CommandResult.failure(e.getMessage());
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readStream(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream()));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.debug("{} timed out after {}s", command.get(0), timeout.toSeconds());
                return CommandResult.failure("Timed out after " + timeout.toSeconds() + "s");
            }
            return new CommandResult(process.exitValue(), collect(stdout), collect(stderr));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return CommandResult.failure("Interrupted");
        }
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not collect process output: {}", e.getMessage());
            return "";
        }
    }

    private static String readStream(InputStream stream) {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString();
    }
}
