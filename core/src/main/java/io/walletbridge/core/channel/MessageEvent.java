package io.walletbridge.core.channel;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One message observed on a {@link WindowChannel}.
 *
 * @param source posting context; the channel itself for same-window posts
 * @param origin origin string of the posting context
 * @param data   untyped payload, may be anything (including non-objects)
 */
public record MessageEvent(Object source, String origin, JsonNode data) {
}
