package com.beyond.webdav.transport;

import okhttp3.MediaType;
import okhttp3.RequestBody;
import okio.BufferedSink;
import okio.Okio;

import java.io.IOException;
import java.io.InputStream;

/**
 * Streams an already open input stream as a request body. The stream is read once and never closed here.
 */
public class StreamRequestBody extends RequestBody {

    private final InputStream inputStream;
    private final long contentLength;

    public StreamRequestBody(InputStream inputStream) {
        this(inputStream, -1);
    }

    public StreamRequestBody(InputStream inputStream, long contentLength) {
        this.inputStream = inputStream;
        this.contentLength = contentLength;
    }

    @Override
    public MediaType contentType() {
        return null;
    }

    @Override
    public long contentLength() {
        return contentLength;
    }

    @Override
    public boolean isOneShot() {
        return true;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
        sink.writeAll(Okio.source(inputStream));
    }
}
