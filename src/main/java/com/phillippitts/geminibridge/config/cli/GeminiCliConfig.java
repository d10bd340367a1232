package com.phillippitts.geminibridge.config.cli;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gemini CLI invocation.
 * Binds to properties prefixed with "gemini.cli".
 *
 * <p>Example application.properties:
 * <pre>
 * gemini.cli.binary-path=gemini
 * gemini.cli.timeout-seconds=30
 * gemini.cli.sandbox=true
 * gemini.cli.max-stdout-bytes=4194304
 * gemini.cli.max-stderr-bytes=65536
 * gemini.cli.workdir-prefix=gemini-bridge-
 * </pre>
 *
 * @param binaryPath CLI executable; a bare name is resolved through PATH
 * @param timeoutSeconds wall-clock budget for one invocation
 * @param sandbox whether to pass {@code --sandbox}; production deployments keep this on
 * @param maxStdoutBytes cap on accumulated stdout
 * @param maxStderrBytes cap on accumulated stderr
 * @param workdirPrefix prefix of the per-request temporary working directory
 */
@ConfigurationProperties(prefix = "gemini.cli")
@Validated
public record GeminiCliConfig(
        @NotBlank(message = "Gemini CLI binary path must not be blank")
        @DefaultValue("gemini")
        String binaryPath,

        @Positive(message = "Timeout must be positive")
        @Max(value = 300, message = "Timeout must not exceed 300 seconds")
        @DefaultValue("30")
        int timeoutSeconds,

        @DefaultValue("true")
        boolean sandbox,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("4194304")
        int maxStdoutBytes,

        @Positive(message = "Max stderr bytes must be positive")
        @DefaultValue("65536")
        int maxStderrBytes,

        @NotBlank(message = "Working directory prefix must not be blank")
        @DefaultValue("gemini-bridge-")
        String workdirPrefix
) {

    /**
     * Standard values, matching the property defaults.
     */
    public static GeminiCliConfig defaults() {
        return new GeminiCliConfig("gemini", 30, true, 4_194_304, 65_536, "gemini-bridge-");
    }

    /**
     * Copy with a different binary and timeout, mostly useful for tests and tooling.
     */
    public GeminiCliConfig withBinary(String binary, int timeout) {
        return new GeminiCliConfig(binary, timeout, sandbox, maxStdoutBytes, maxStderrBytes, workdirPrefix);
    }
}
