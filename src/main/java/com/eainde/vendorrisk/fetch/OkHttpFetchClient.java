package com.eainde.vendorrisk.fetch;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@link FetchClient} on a single shared {@link OkHttpClient}.
 * <p>
 * The per-call timeout is applied by deriving a client with {@code newBuilder()}, which shares the
 * connection pool and dispatcher of the base client.
 */
@Slf4j
public class OkHttpFetchClient implements FetchClient {

    private static final int BUFFER = 8192;

    private final OkHttpClient httpClient;
    private final long maxBodyBytes;

    public OkHttpFetchClient(OkHttpClient baseClient, long maxBodyBytes) {
        Interceptor userAgent = chain -> {
            Request original = chain.request();
            return chain.proceed(original.newBuilder()
                    .header("User-Agent", USER_AGENT)
                    .header("Accept", "text/html,application/xhtml+xml,application/pdf,text/plain;q=0.9,*/*;q=0.8")
                    .build());
        };
        this.httpClient = baseClient.newBuilder()
                .addInterceptor(userAgent)
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public FetchResponse get(String url, Duration timeout) throws FetchException {
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, "Invalid URL", e);
        }

        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(timeout)
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String contentType = "";
            byte[] bytes = new byte[0];
            if (body != null) {
                MediaType mediaType = body.contentType();
                if (mediaType != null) {
                    contentType = (mediaType.type() + "/" + mediaType.subtype()).toLowerCase(Locale.ROOT);
                }
                if (response.isSuccessful()) {
                    bytes = readCapped(url, body);
                }
            }
            Map<String, String> headers = new HashMap<>();
            for (String name : response.headers().names()) {
                String value = response.header(name);
                if (value != null) {
                    headers.put(name.toLowerCase(Locale.ROOT), value);
                }
            }
            log.debug("GET {} -> {} ({} bytes, {})", url, response.code(), bytes.length, contentType);
            return new FetchResponse(response.request().url().toString(), response.code(), headers, contentType, bytes);
        } catch (InterruptedIOException e) {
            throw new FetchException(url, "Timed out after " + timeout.toMillis() + "ms", e);
        } catch (FetchException e) {
            throw e;
        } catch (IOException e) {
            throw new FetchException(url, "Request failed: " + e.getMessage(), e);
        }
    }

    private byte[] readCapped(String url, ResponseBody body) throws IOException {
        long declared = body.contentLength();
        if (declared > maxBodyBytes) {
            throw new FetchException(url, "Body of " + declared + " bytes exceeds limit of " + maxBodyBytes);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER];
        long total = 0;
        try (InputStream in = body.byteStream()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                if (total > maxBodyBytes) {
                    throw new FetchException(url, "Body exceeds limit of " + maxBodyBytes + " bytes");
                }
                out.write(buffer, 0, read);
            }
        }
        return out.toByteArray();
    }
}
