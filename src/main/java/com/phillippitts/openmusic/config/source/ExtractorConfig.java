package com.phillippitts.openmusic.config.source;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the yt-dlp extractor subprocess.
 * Binds to properties prefixed with "source.extractor".
 *
 * <p>Example application.properties:
 * <pre>
 * source.extractor.binary-path=yt-dlp
 * source.extractor.timeout-seconds=15
 * source.extractor.socket-timeout-seconds=8
 * source.extractor.max-stdout-bytes=2097152
 * </pre>
 *
 * @param binaryPath extractor executable, resolved through PATH when not absolute
 * @param timeoutSeconds hard limit for one extractor process
 * @param socketTimeoutSeconds value passed as {@code --socket-timeout}
 * @param maxStdoutBytes cap on captured stdout (protects against pathological output)
 * @param userAgent value passed as {@code --user-agent}
 * @param playerClients value of the youtube {@code player_client} extractor argument
 */
@ConfigurationProperties(prefix = "source.extractor")
@Validated
public record ExtractorConfig(
        @DefaultValue("yt-dlp")
        @NotBlank(message = "Extractor binary path must not be blank")
        String binaryPath,

        @DefaultValue("15")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("8")
        @Positive(message = "Socket timeout must be positive")
        int socketTimeoutSeconds,

        @DefaultValue("2097152")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes,

        @DefaultValue("Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36")
        @NotBlank
        String userAgent,

        @DefaultValue("android,web")
        @NotBlank
        String playerClients
) {

    /**
     * Standard values, used by tests and when nothing is configured.
     */
    public static ExtractorConfig defaults() {
        return new ExtractorConfig("yt-dlp", 15, 8, 2_097_152,
                "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36",
                "android,web");
    }
}
