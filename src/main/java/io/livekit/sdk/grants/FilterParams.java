package io.livekit.sdk.grants;

import java.util.List;

/**
 * Event filter of a webhook. An empty include list means every event not excluded.
 */
public record FilterParams(
    List<String> includeEvents,
    List<String> excludeEvents
) {

    public FilterParams {
        includeEvents = Copies.list(includeEvents);
        excludeEvents = Copies.list(excludeEvents);
    }
}
