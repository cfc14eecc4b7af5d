package com.phillippitts.openmusic.service.source.direct;

import com.phillippitts.openmusic.config.properties.SourceProperties;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.service.source.SourceAdapter;
import com.phillippitts.openmusic.service.source.StreamUrlProvider;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Plain links to audio files. Resolution is local: the item is named after the file and the
 * link itself is the stream URL. Cannot search.
 */
@Component
public class DirectUrlSourceAdapter implements SourceAdapter, StreamUrlProvider {

    private static final String NAME = "direct-url";

    private final List<String> extensions;

    public DirectUrlSourceAdapter(SourceProperties properties) {
        this.extensions = properties.getDirect().getExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public List<Item> search(String query, int limit) {
        return List.of();
    }

    @Override
    public Optional<Item> resolve(String url) {
        if (!isValidUrl(url)) {
            return Optional.empty();
        }
        return Optional.of(Item.of(titleFromPath(url), null, null, null, url.trim(), SourceKind.DIRECT_URL));
    }

    @Override
    public Optional<String> streamUrl(Item item) {
        return isValidUrl(item.canonicalUrl()) ? Optional.of(item.canonicalUrl()) : Optional.empty();
    }

    @Override
    public boolean isValidUrl(String url) {
        String path = path(url);
        if (path == null) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    static String titleFromPath(String url) {
        String path = path(url);
        String file = path == null ? url : path.substring(path.lastIndexOf('/') + 1);
        String decoded = URLDecoder.decode(file, StandardCharsets.UTF_8);
        int dot = decoded.lastIndexOf('.');
        String title = (dot > 0 ? decoded.substring(0, dot) : decoded).replace('_', ' ').trim();
        return title.isEmpty() ? url : title;
    }

    private static String path(String url) {
        if (url == null) {
            return null;
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return uri.getRawPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public boolean supportsSearch() {
        return false;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.DIRECT_URL;
    }
}
