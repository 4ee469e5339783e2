package io.shapestreams.core;

import java.util.Map;
import java.util.Objects;

/**
 * Control item of a response batch. Carries no offset.
 */
public record ControlMessage(String control) implements LogItem {

    /** No more data is available right now. */
    public static final ControlMessage UP_TO_DATE = new ControlMessage(Protocol.CONTROL_UP_TO_DATE);

    /** The client must discard its state and restart from {@link LogOffset#BEFORE_ALL}. */
    public static final ControlMessage MUST_REFETCH = new ControlMessage(Protocol.CONTROL_MUST_REFETCH);

    public ControlMessage {
        Objects.requireNonNull(control, "control");
    }

    public Map<String, String> headers() {
        return Map.of(Protocol.ITEM_CONTROL, control);
    }
}
