package com.guildauction.persistence;

import java.util.List;

/**
 * Backend that takes over while the primary is away. Besides the data it keeps
 * {@link ReplayMarker}s for the rows the primary missed, so they survive a restart.
 */
public interface FallbackBackend extends PersistenceBackend {

    void addReplayMarker(ReplayMarker marker);

    /** Markers in the order they were first written. */
    List<ReplayMarker> findReplayMarkers();

    void clearReplayMarkers();
}
