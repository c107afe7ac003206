package com.beyond.webdav;

import lombok.Getter;

import java.io.IOException;

/**
 * The server answered with a status code outside the set the operation expects.
 */
@Getter
public class WebDavException extends IOException {

    private final String method;
    private final int statusCode;
    private final String reason;

    public WebDavException(String method, int statusCode, String reason) {
        super(String.format("Method %s returns status code: %d and reason: %s", method, statusCode, reason));
        this.method = method;
        this.statusCode = statusCode;
        this.reason = reason;
    }
}
