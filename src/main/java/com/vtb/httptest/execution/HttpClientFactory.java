package com.vtb.httptest.execution;

import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.time.Duration;

/**
 * Builds the shared OkHttp client. OkHttp's own connection retry is switched off; retries belong
 * to {@link RetryingTransport}.
 */
public final class HttpClientFactory {

    private HttpClientFactory() {
    }

    public static OkHttpClient create(Duration connectTimeout, Duration readTimeout, Duration writeTimeout,
                                      boolean followRedirects, String userAgent) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .writeTimeout(writeTimeout)
            .followRedirects(followRedirects)
            .followSslRedirects(followRedirects)
            .retryOnConnectionFailure(false)
            .addInterceptor(new RequestTimeout.TimeoutInterceptor());
        if (userAgent != null && !userAgent.isBlank()) {
            builder.addInterceptor(chain -> {
                Request request = chain.request();
                if (request.header("User-Agent") != null) {
                    return chain.proceed(request);
                }
                return chain.proceed(request.newBuilder().header("User-Agent", userAgent).build());
            });
        }
        return builder.build();
    }
}
