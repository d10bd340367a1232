package com.phillippitts.geminibridge.service.cli.conflict;

import java.util.List;

/**
 * Minimal view of the container runtime used by the Gemini CLI sandbox.
 *
 * <p>All operations are best-effort: failures are reported through return values, never thrown.
 */
public interface ContainerRuntime {

    ContainerState state(String name);

    /**
     * Stops a running container.
     *
     * @return {@code true} if the runtime reported success
     */
    boolean stop(String name);

    /**
     * Removes a container.
     *
     * @param force also kill it when still running
     * @return {@code true} if removed or already gone
     */
    boolean remove(String name, boolean force);

    /**
     * Lists all containers (running or not) whose names start with {@code namePrefix}.
     */
    List<ContainerInfo> list(String namePrefix);
}
