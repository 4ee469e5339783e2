package io.shapestreams.core;

/**
 * One item of a response batch: either a row change or a control message.
 */
public sealed interface LogItem permits ChangeEvent, ControlMessage {
}
