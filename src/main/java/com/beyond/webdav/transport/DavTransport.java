package com.beyond.webdav.transport;

import okhttp3.HttpUrl;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.Closeable;
import java.io.IOException;

public interface DavTransport extends Closeable {

    /**
     * Issues one request. The returned response is open and must be closed by the caller.
     */
    Response execute(String method, HttpUrl url, RequestBody body) throws IOException;

    @Override
    void close();
}
