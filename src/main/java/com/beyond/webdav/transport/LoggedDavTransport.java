package com.beyond.webdav.transport;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;

@Slf4j
public class LoggedDavTransport implements DavTransport {
    private final DavTransport transport;

    public LoggedDavTransport(DavTransport transport) {
        this.transport = transport;
    }

    @Override
    public Response execute(String method, HttpUrl url, RequestBody body) throws IOException {
        log.debug(method + ":" + url);
        Response response = transport.execute(method, url, body);
        log.debug("{}:{} -> {} {}", method, url, response.code(), response.message());
        return response;
    }

    @Override
    public void close() {
        transport.close();
    }
}
