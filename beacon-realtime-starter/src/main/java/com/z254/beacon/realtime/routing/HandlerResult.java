package com.z254.beacon.realtime.routing;

import com.z254.beacon.realtime.protocol.ErrorKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a route handler: a success payload, or an error kind with a message.
 * Handlers return failures through this type; exceptions are reserved for faults.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HandlerResult {

    boolean ok;
    Object data;
    ErrorKind errorKind;
    String errorMessage;

    public static HandlerResult ok(Object data) {
        return new HandlerResult(true, data, null, null);
    }

    public static HandlerResult empty() {
        return new HandlerResult(true, null, null, null);
    }

    public static HandlerResult error(ErrorKind kind, String message) {
        return new HandlerResult(false, null, kind, message);
    }

    public static HandlerResult notFound(String message) {
        return error(ErrorKind.NOT_FOUND, message);
    }

    public static HandlerResult badRequest(String message) {
        return error(ErrorKind.BAD_REQUEST, message);
    }

    public static HandlerResult conflict(String message) {
        return error(ErrorKind.CONFLICT, message);
    }
}
