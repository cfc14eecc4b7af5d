package com.phillippitts.openmusic.service.source;

import com.phillippitts.openmusic.domain.SourceKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of the adapter implementing each {@link SourceKind}.
 *
 * <p>Backend configuration names a kind; the resolver never dispatches on backend names.
 */
@Component
public class SourceAdapters {

    private static final Logger LOG = LogManager.getLogger(SourceAdapters.class);

    private final Map<SourceKind, SourceAdapter> byKind;

    public SourceAdapters(List<SourceAdapter> adapters) {
        Map<SourceKind, SourceAdapter> map = new EnumMap<>(SourceKind.class);
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = map.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.kind()
                        + ": " + previous.name() + ", " + adapter.name());
            }
        }
        for (SourceKind kind : SourceKind.values()) {
            if (!map.containsKey(kind)) {
                LOG.warn("No adapter registered for source kind {}", kind);
            }
        }
        this.byKind = Collections.unmodifiableMap(map);
    }

    public Optional<SourceAdapter> forKind(SourceKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    public Map<SourceKind, SourceAdapter> all() {
        return byKind;
    }
}
