package com.phillippitts.openmusic.service.source.extractor;

import com.phillippitts.openmusic.config.source.ExtractorConfig;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.exception.BackendProtocolException;
import com.phillippitts.openmusic.service.source.SourceAdapter;
import com.phillippitts.openmusic.service.source.StreamUrlProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Primary backend: the local yt-dlp binary.
 *
 * <p>CLI contract for search:
 * <pre>
 * yt-dlp --dump-json --no-warnings --no-playlist --simulate --socket-timeout N --retries 1
 *        --no-cache-dir --user-agent UA --extractor-args youtube:player_client=... ytsearchL:QUERY
 * </pre>
 * Stream URLs come from {@code -f bestaudio/best --get-url URL}.
 */
@Component
public class ExtractorSourceAdapter implements SourceAdapter, StreamUrlProvider {

    private static final Logger LOG = LogManager.getLogger(ExtractorSourceAdapter.class);

    private final ExtractorProcessManager processManager;

    public ExtractorSourceAdapter(ExtractorProcessManager processManager) {
        this.processManager = processManager;
    }

    @Override
    public List<Item> search(String query, int limit) {
        List<String> args = commonArgs();
        args.add("ytsearch" + Math.max(1, limit) + ":" + query);
        List<Item> items = parse(processManager.run(args));
        LOG.debug("Extractor search returned {} items", items.size());
        return items.size() > limit ? items.subList(0, limit) : items;
    }

    @Override
    public Optional<Item> resolve(String url) {
        List<String> args = commonArgs();
        args.add(url);
        List<Item> items = parse(processManager.run(args));
        return items.stream().findFirst();
    }

    @Override
    public Optional<String> streamUrl(Item item) {
        ExtractorConfig cfg = processManager.config();
        List<String> args = new ArrayList<>(List.of(
                "-f", "bestaudio/best",
                "--get-url",
                "--no-warnings",
                "--no-playlist",
                "--socket-timeout", String.valueOf(cfg.socketTimeoutSeconds()),
                "--user-agent", cfg.userAgent(),
                item.canonicalUrl()));
        String url = ExtractorJsonParser.firstUrl(processManager.run(args));
        return Optional.ofNullable(url);
    }

    private List<Item> parse(String stdout) {
        ExtractorJsonParser.ParseResult result = ExtractorJsonParser.parseLines(stdout);
        if (result.allMalformed()) {
            throw new BackendProtocolException(
                    "Unparsable extractor output (" + result.malformedLines() + " lines)", name());
        }
        if (result.malformedLines() > 0) {
            LOG.debug("Extractor output contained {} malformed lines", result.malformedLines());
        }
        return result.items();
    }

    private List<String> commonArgs() {
        ExtractorConfig cfg = processManager.config();
        return new ArrayList<>(List.of(
                "--dump-json",
                "--no-warnings",
                "--no-playlist",
                "--simulate",
                "--socket-timeout", String.valueOf(cfg.socketTimeoutSeconds()),
                "--retries", "1",
                "--no-cache-dir",
                "--user-agent", cfg.userAgent(),
                "--extractor-args", "youtube:player_client=" + cfg.playerClients()));
    }

    @Override
    public boolean isValidUrl(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase();
        return lower.contains("youtube.com/") || lower.contains("youtu.be/")
                || lower.contains("soundcloud.com/") || lower.contains("bandcamp.com/")
                || lower.contains("vimeo.com/");
    }

    @Override
    public String name() {
        return ExtractorProcessManager.BACKEND;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.PRIMARY_EXTRACTOR;
    }
}
