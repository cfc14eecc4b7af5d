package com.phillippitts.openmusic.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemTest {

    @Test
    void requiresTitleAndUrl() {
        assertThatThrownBy(() -> Item.of(" ", null, null, null, "https://x", SourceKind.FEED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("title");
        assertThatThrownBy(() -> Item.of("t", null, null, null, "", SourceKind.FEED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("canonicalUrl");
        assertThatThrownBy(() -> Item.of("t", null, null, null, "https://x", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void nonPositiveDurationMeansUnknown() {
        assertThat(Item.of("t", null, Duration.ZERO, null, "https://x", SourceKind.FEED).hasDuration()).isFalse();
        assertThat(Item.of("t", null, Duration.ofSeconds(-5), null, "https://x", SourceKind.FEED).duration()).isNull();
        assertThat(Item.of("t", null, Duration.ofSeconds(5), null, "https://x", SourceKind.FEED).hasDuration()).isTrue();
    }

    @Test
    void withRequestedByCopies() {
        Item item = Item.of("t", "a", null, null, "https://x", SourceKind.MIRROR);

        Item requested = item.withRequestedBy("user-1");

        assertThat(requested.requestedBy()).isEqualTo("user-1");
        assertThat(item.requestedBy()).isNull();
        assertThat(requested.canonicalUrl()).isEqualTo(item.canonicalUrl());
    }
}
