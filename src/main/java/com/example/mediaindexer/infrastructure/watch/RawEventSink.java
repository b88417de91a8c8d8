package com.example.mediaindexer.infrastructure.watch;

import com.example.mediaindexer.domain.model.RawFileChange;

/**
 * Receiving end of a root watcher. Implementations must not block the caller.
 */
public interface RawEventSink {

    void accept(RawFileChange change);

    /**
     * The watcher lost track of changes under the root, either through an explicit overflow
     * notification or because it failed.
     */
    void overflow(Long rootId, String reason);
}
