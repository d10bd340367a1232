package com.phillippitts.geminibridge.service.cli;

import com.phillippitts.geminibridge.config.cli.GeminiCliConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the Gemini CLI command line.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -m ${model} --sandbox        (prompt on stdin)
 * </pre>
 *
 * <p>On Windows the CLI is installed as a {@code .cmd} shim that only resolves and behaves
 * correctly when launched through the shell, so the command is wrapped in {@code cmd.exe /c}.
 * The binary path comes from server-side configuration and the model from the resolved
 * mapping, never from raw client input. Everywhere else the binary is executed directly with no
 * shell interpretation.
 */
public final class GeminiCommandBuilder {

    private final String osName;

    public GeminiCommandBuilder() {
        this(System.getProperty("os.name", ""));
    }

    GeminiCommandBuilder(String osName) {
        this.osName = osName == null ? "" : osName;
    }

    public boolean requiresShell() {
        return osName.toLowerCase(Locale.ROOT).startsWith("windows");
    }

    public List<String> build(GeminiCliConfig cfg, String model) {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(model, "model");

        List<String> cmd = new ArrayList<>();
        if (requiresShell()) {
            cmd.add("cmd.exe");
            cmd.add("/c");
        }
        cmd.add(cfg.binaryPath());
        cmd.add("-m");
        cmd.add(model);
        if (cfg.sandbox()) {
            cmd.add("--sandbox");
        }
        return cmd;
    }
}
