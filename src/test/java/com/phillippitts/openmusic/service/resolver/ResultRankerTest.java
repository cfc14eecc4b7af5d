package com.phillippitts.openmusic.service.resolver;

import com.phillippitts.openmusic.domain.Item;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.phillippitts.openmusic.testutil.TestItems.track;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResultRankerTest {

    @Test
    void titleMatchesComeFirst() {
        Item other = track("Something Else");
        Item match = track("Daft Punk - Around the World (Official)");

        List<Item> ranked = ResultRanker.rank(List.of(other, match), "daft punk around the world");

        assertThat(ranked).containsExactly(match, other);
    }

    @Test
    void typicalDurationBeatsVeryLongUpload() {
        Item tenHourLoop = track("song loop", Duration.ofHours(10));
        Item normal = track("song radio edit", Duration.ofMinutes(4));
        Item unknown = track("song live", null);

        List<Item> ranked = ResultRanker.rank(List.of(tenHourLoop, unknown, normal), "nothing matches");

        assertThat(ranked).containsExactly(normal, unknown, tenHourLoop);
    }

    @Test
    void equalScoresKeepBackendOrder() {
        Item first = track("first");
        Item second = track("second");
        Item third = track("third");

        assertThat(ResultRanker.rank(List.of(first, second, third), "zzz")).containsExactly(first, second, third);
    }

    @Test
    void durationScoreIsOneInsideBandAndDecaysOutside() {
        assertThat(ResultRanker.durationScore(track("a", Duration.ofMinutes(1)))).isEqualTo(1.0);
        assertThat(ResultRanker.durationScore(track("a", Duration.ofMinutes(10)))).isEqualTo(1.0);
        assertThat(ResultRanker.durationScore(track("a", Duration.ofSeconds(30)))).isLessThan(1.0).isPositive();
        assertThat(ResultRanker.durationScore(track("a", Duration.ofMinutes(20))))
                .isCloseTo(ResultRanker.durationScore(track("a", Duration.ofSeconds(30))), within(1e-9));
        assertThat(ResultRanker.durationScore(track("a", null))).isEqualTo(ResultRanker.UNKNOWN_DURATION_SCORE);
    }

    @Test
    void singleItemIsReturnedAsIs() {
        Item only = track("only");
        assertThat(ResultRanker.rank(List.of(only), "x")).containsExactly(only);
        assertThat(ResultRanker.rank(List.of(), "x")).isEmpty();
    }
}
