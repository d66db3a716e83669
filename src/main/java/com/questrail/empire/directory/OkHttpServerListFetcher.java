package com.questrail.empire.directory;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ServerListFetcher} over OkHttp. The whole call (connect, redirects,
 * body) is bounded by one call timeout.
 */
public final class OkHttpServerListFetcher implements ServerListFetcher
{
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(60);

    private final OkHttpClient client;

    public OkHttpServerListFetcher()
    {
        this(new OkHttpClient.Builder().callTimeout(DEFAULT_CALL_TIMEOUT).build());
    }

    public OkHttpServerListFetcher(OkHttpClient client)
    {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public String fetch(String url) throws IOException
    {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("GET " + url + " answered " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("GET " + url + " returned no body");
            }
            return body.string();
        }
    }

    /**
     * Release the client's connection pool and dispatcher threads.
     */
    public void shutdown()
    {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
