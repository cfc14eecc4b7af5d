package com.phillippitts.openmusic.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void queryPreviewIsCapped() {
        String longQuery = "a".repeat(500);

        assertThat(LogSanitizer.query(longQuery)).hasSize(LogSanitizer.QUERY_PREVIEW_CHARS);
        assertThat(LogSanitizer.query("abba")).isEqualTo("abba");
    }

    @Test
    void redactsCredentialParameters() {
        assertThat(LogSanitizer.redactUrl("https://api.example/v3/search?q=abba&key=SECRET123&part=snippet"))
                .isEqualTo("https://api.example/v3/search?q=abba&key=***&part=snippet");
        assertThat(LogSanitizer.redactUrl("https://m.example/x?TOKEN=abc"))
                .isEqualTo("https://m.example/x?TOKEN=***");
        assertThat(LogSanitizer.redactUrl("https://m.example/x?monkey=1"))
                .isEqualTo("https://m.example/x?monkey=1");
        assertThat(LogSanitizer.redactUrl(null)).isEmpty();
    }
}
