package com.phillippitts.geminibridge.service.cli.conflict;

/**
 * Name and state of one container returned by {@link ContainerRuntime#list(String)}.
 */
public record ContainerInfo(String name, ContainerState state) {}
