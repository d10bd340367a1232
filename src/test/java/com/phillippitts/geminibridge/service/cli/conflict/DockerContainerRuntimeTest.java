package com.phillippitts.geminibridge.service.cli.conflict;

import com.phillippitts.geminibridge.service.cli.process.ProcessRunner;
import com.phillippitts.geminibridge.service.cli.process.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.geminibridge.service.cli.process.ProcessTestDoubles.ScriptedProcessFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DockerContainerRuntimeTest {

    private static DockerContainerRuntime runtimeFor(ScriptedProcessFactory factory) {
        return new DockerContainerRuntime(new ProcessRunner(factory), "docker");
    }

    @Test
    void parsesRunningAndStoppedFromInspect() {
        assertThat(DockerContainerRuntime.parseInspect("[{\"State\":{\"Status\":\"running\",\"Running\":true}}]"))
                .isEqualTo(ContainerState.RUNNING);
        assertThat(DockerContainerRuntime.parseInspect("[{\"State\":{\"Status\":\"exited\",\"Running\":false}}]"))
                .isEqualTo(ContainerState.STOPPED);
        assertThat(DockerContainerRuntime.parseInspect("[]")).isEqualTo(ContainerState.NOT_FOUND);
        assertThat(DockerContainerRuntime.parseInspect("not json")).isEqualTo(ContainerState.UNKNOWN);
    }

    @Test
    void parsesPsLinesFilteredByPrefix() {
        String output = "{\"Names\":\"sandbox-1\",\"State\":\"exited\"}\n"
                + "{\"Names\":\"sandbox-2\",\"State\":\"running\"}\n"
                + "{\"Names\":\"other\",\"State\":\"exited\"}\n"
                + "garbage\n";

        assertThat(DockerContainerRuntime.parsePs(output, "sandbox-")).containsExactly(
                new ContainerInfo("sandbox-1", ContainerState.STOPPED),
                new ContainerInfo("sandbox-2", ContainerState.RUNNING));
    }

    @Test
    void stateInspectsContainer() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd ->
                ProcessBehavior.exits(0, "[{\"State\":{\"Running\":false}}]", ""));

        assertThat(runtimeFor(factory).state("sandbox-1")).isEqualTo(ContainerState.STOPPED);
        assertThat(factory.commands()).containsExactly(
                List.of("docker", "inspect", "--type", "container", "sandbox-1"));
    }

    @Test
    void noSuchContainerMeansNotFound() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd ->
                ProcessBehavior.exits(1, "[]", "Error: No such container: sandbox-1"));

        assertThat(runtimeFor(factory).state("sandbox-1")).isEqualTo(ContainerState.NOT_FOUND);
    }

    @Test
    void daemonFailureMeansUnknown() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd ->
                ProcessBehavior.exits(1, "", "Cannot connect to the Docker daemon"));

        assertThat(runtimeFor(factory).state("sandbox-1")).isEqualTo(ContainerState.UNKNOWN);
    }

    @Test
    void removeUsesForceFlagOnlyWhenAsked() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd -> ProcessBehavior.exits(0, "", ""));
        DockerContainerRuntime runtime = runtimeFor(factory);

        assertThat(runtime.remove("sandbox-1", false)).isTrue();
        assertThat(runtime.remove("sandbox-2", true)).isTrue();

        assertThat(factory.commands()).containsExactly(
                List.of("docker", "rm", "sandbox-1"),
                List.of("docker", "rm", "-f", "sandbox-2"));
    }

    @Test
    void removingMissingContainerCountsAsSuccess() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd ->
                ProcessBehavior.exits(1, "", "Error response from daemon: No such container: sandbox-1"));

        assertThat(runtimeFor(factory).remove("sandbox-1", false)).isTrue();
    }

    @Test
    void removeReportsOtherFailures() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd ->
                ProcessBehavior.exits(1, "", "You cannot remove a running container"));

        assertThat(runtimeFor(factory).remove("sandbox-1", false)).isFalse();
    }

    @Test
    void listFiltersByName() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd ->
                ProcessBehavior.exits(0, "{\"Names\":\"sandbox-9\",\"State\":\"created\"}", ""));

        assertThat(runtimeFor(factory).list("sandbox-"))
                .containsExactly(new ContainerInfo("sandbox-9", ContainerState.STOPPED));
        assertThat(factory.commands().get(0))
                .containsExactly("docker", "ps", "-a", "--filter", "name=sandbox-", "--format", "{{json .}}");
    }

    @Test
    void missingDockerBinaryDegradesGracefully() {
        DockerContainerRuntime runtime = new DockerContainerRuntime(new ProcessRunner((cmd, dir) -> {
            throw new java.io.IOException("docker: not found");
        }), "docker");

        assertThat(runtime.state("x")).isEqualTo(ContainerState.UNKNOWN);
        assertThat(runtime.remove("x", true)).isFalse();
        assertThat(runtime.list("sandbox-")).isEmpty();
    }
}
