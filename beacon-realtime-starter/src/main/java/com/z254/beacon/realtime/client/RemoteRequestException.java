package com.z254.beacon.realtime.client;

import com.z254.beacon.realtime.protocol.ErrorKind;

/**
 * The server answered a request with an error.
 */
public class RemoteRequestException extends RuntimeException {

    private final ErrorKind kind;

    public RemoteRequestException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
