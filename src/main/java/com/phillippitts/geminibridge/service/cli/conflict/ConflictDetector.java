package com.phillippitts.geminibridge.service.cli.conflict;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes sandbox container name collisions in Gemini CLI failures.
 *
 * <p>When the CLI's sandbox reuses a container name still held by a previous invocation, docker
 * fails with exit code 125 and a message such as:
 * <pre>
 * docker: Error response from daemon: Conflict. The container name "/sandbox-0.23.0-0" is
 * already in use by container "3f2a...". You have to remove (or rename) that container...
 * </pre>
 */
public final class ConflictDetector {

    /** Docker's exit status for errors raised by the docker client/daemon itself. */
    public static final int DOCKER_RUNTIME_ERROR_EXIT_CODE = 125;

    private static final List<Pattern> CONFLICT_PATTERNS = List.of(
            Pattern.compile("already in use", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Conflict", Pattern.CASE_INSENSITIVE),
            Pattern.compile("container name.*is already in use", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern CONTAINER_NAME = Pattern.compile(
            "container name [\"']?([^\"']+)[\"']? is already in use", Pattern.CASE_INSENSITIVE);

    private ConflictDetector() {
        // Utility class - prevent instantiation
    }

    public static boolean isConflict(int exitCode, String stderr) {
        if (exitCode != DOCKER_RUNTIME_ERROR_EXIT_CODE || stderr == null) {
            return false;
        }
        for (Pattern pattern : CONFLICT_PATTERNS) {
            if (pattern.matcher(stderr).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extracts the conflicting container name, without docker's leading {@code '/'}.
     *
     * @param stderr CLI stderr
     * @return container name, or empty when the message has an unexpected shape
     */
    public static Optional<String> extractContainerName(String stderr) {
        if (stderr == null) {
            return Optional.empty();
        }
        Matcher m = CONTAINER_NAME.matcher(stderr);
        if (!m.find()) {
            return Optional.empty();
        }
        String name = m.group(1);
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        return name.isBlank() ? Optional.empty() : Optional.of(name);
    }
}
