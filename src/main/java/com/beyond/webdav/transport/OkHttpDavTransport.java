package com.beyond.webdav.transport;

import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;

public class OkHttpDavTransport implements DavTransport {

    private static final int HTTP_UNAVAILABLE = 503;
    private static final String RETRY_AFTER = "Retry-After";

    private final OkHttpClient client;

    public OkHttpDavTransport(boolean followRedirects) {
        this(new OkHttpClient.Builder()
                .followRedirects(followRedirects)
                .followSslRedirects(followRedirects)
                .retryOnConnectionFailure(false)
                .addNetworkInterceptor(OkHttpDavTransport::dropRetryAfter)
                .build());
    }

    public OkHttpDavTransport(OkHttpClient client) {
        this.client = client;
    }

    // OkHttp re-sends a request answered with 503 and Retry-After: 0
    private static Response dropRetryAfter(Interceptor.Chain chain) throws IOException {
        Response response = chain.proceed(chain.request());
        if (response.code() == HTTP_UNAVAILABLE && response.header(RETRY_AFTER) != null) {
            return response.newBuilder().removeHeader(RETRY_AFTER).build();
        }
        return response;
    }

    @Override
    public Response execute(String method, HttpUrl url, RequestBody body) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .method(method, body)
                .build();
        return client.newCall(request).execute();
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
