package com.phillippitts.geminibridge.service.cli.conflict;

import com.phillippitts.geminibridge.service.cli.process.ProcessOutcome;
import com.phillippitts.geminibridge.service.cli.process.ProcessRunner;
import com.phillippitts.geminibridge.util.LogSanitizer;
import com.phillippitts.geminibridge.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link ContainerRuntime} backed by the {@code docker} CLI.
 *
 * <p>Commands used:
 * <pre>
 * docker inspect --type container NAME                       (JSON array, State.Running / State.Status)
 * docker stop NAME
 * docker rm [-f] NAME
 * docker ps -a --filter name=PREFIX --format {{json .}}      (one JSON object per line)
 * </pre>
 *
 * <p>Each command runs with {@link ProcessTimeouts#CONTAINER_COMMAND_TIMEOUT}.
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger LOG = LogManager.getLogger(DockerContainerRuntime.class);

    private static final int OUTPUT_CAP_BYTES = 256 * 1024;
    private static final int STDERR_SNIPPET_CHARS = 300;

    private final ProcessRunner runner;
    private final String dockerBinary;

    public DockerContainerRuntime(ProcessRunner runner, String dockerBinary) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.dockerBinary = Objects.requireNonNull(dockerBinary, "dockerBinary");
    }

    @Override
    public ContainerState state(String name) {
        ProcessOutcome outcome = docker(List.of(dockerBinary, "inspect", "--type", "container", name));
        if (outcome == null || outcome.timedOut()) {
            return ContainerState.UNKNOWN;
        }
        if (outcome.exitCode() != 0) {
            return isNoSuchContainer(outcome.stderr()) ? ContainerState.NOT_FOUND : ContainerState.UNKNOWN;
        }
        return parseInspect(outcome.stdout());
    }

    static ContainerState parseInspect(String json) {
        try {
            JSONArray arr = new JSONArray(json);
            if (arr.isEmpty()) {
                return ContainerState.NOT_FOUND;
            }
            JSONObject state = arr.getJSONObject(0).optJSONObject("State");
            if (state == null) {
                return ContainerState.UNKNOWN;
            }
            return state.optBoolean("Running", false) ? ContainerState.RUNNING : ContainerState.STOPPED;
        } catch (JSONException e) {
            LOG.debug("Unparsable docker inspect output: {}", e.getMessage());
            return ContainerState.UNKNOWN;
        }
    }

    static boolean isNoSuchContainer(String stderr) {
        return stderr != null && stderr.toLowerCase(Locale.ROOT).contains("no such");
    }

    @Override
    public boolean stop(String name) {
        ProcessOutcome outcome = docker(List.of(dockerBinary, "stop", name));
        return outcome != null && (outcome.succeeded() || isNoSuchContainer(outcome.stderr()));
    }

    @Override
    public boolean remove(String name, boolean force) {
        List<String> cmd = force
                ? List.of(dockerBinary, "rm", "-f", name)
                : List.of(dockerBinary, "rm", name);
        ProcessOutcome outcome = docker(cmd);
        if (outcome == null) {
            return false;
        }
        if (outcome.succeeded() || isNoSuchContainer(outcome.stderr())) {
            LOG.debug("Docker container cleanup successful container={}", name);
            return true;
        }
        LOG.warn("Failed to cleanup Docker container container={} stderr={}", name,
                LogSanitizer.truncate(outcome.stderr(), STDERR_SNIPPET_CHARS));
        return false;
    }

    @Override
    public List<ContainerInfo> list(String namePrefix) {
        ProcessOutcome outcome = docker(List.of(dockerBinary, "ps", "-a",
                "--filter", "name=" + namePrefix, "--format", "{{json .}}"));
        if (outcome == null || !outcome.succeeded()) {
            return List.of();
        }
        return parsePs(outcome.stdout(), namePrefix);
    }

    static List<ContainerInfo> parsePs(String output, String namePrefix) {
        List<ContainerInfo> result = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                JSONObject obj = new JSONObject(line);
                String name = obj.optString("Names", "");
                if (!name.startsWith(namePrefix)) {
                    continue;
                }
                String state = obj.optString("State", "").toLowerCase(Locale.ROOT);
                result.add(new ContainerInfo(name, toState(state)));
            } catch (JSONException e) {
                LOG.debug("Skipping unparsable docker ps line: {}", e.getMessage());
            }
        }
        return result;
    }

    private static ContainerState toState(String state) {
        return switch (state) {
            case "running", "restarting", "paused" -> ContainerState.RUNNING;
            case "exited", "created", "dead" -> ContainerState.STOPPED;
            default -> ContainerState.UNKNOWN;
        };
    }

    private ProcessOutcome docker(List<String> command) {
        try {
            return runner.run(command, null, null, ProcessTimeouts.CONTAINER_COMMAND_TIMEOUT,
                    OUTPUT_CAP_BYTES, OUTPUT_CAP_BYTES, "docker");
        } catch (IOException e) {
            LOG.warn("Error running {} {}: {}", dockerBinary, command.get(1), e.toString());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while running {} {}", dockerBinary, command.get(1));
            return null;
        }
    }
}
