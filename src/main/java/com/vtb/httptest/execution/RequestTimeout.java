package com.vtb.httptest.execution;

import okhttp3.Interceptor;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Per-request timeout carried as a request tag and applied by {@link TimeoutInterceptor}.
 */
public record RequestTimeout(Duration value) {

    public static class TimeoutInterceptor implements Interceptor {
        @Override
        public Response intercept(Chain chain) throws IOException {
            RequestTimeout timeout = chain.request().tag(RequestTimeout.class);
            if (timeout == null || timeout.value() == null || timeout.value().isZero() || timeout.value().isNegative()) {
                return chain.proceed(chain.request());
            }
            int millis = (int) Math.min(Integer.MAX_VALUE, timeout.value().toMillis());
            return chain
                .withConnectTimeout(millis, TimeUnit.MILLISECONDS)
                .withReadTimeout(millis, TimeUnit.MILLISECONDS)
                .withWriteTimeout(millis, TimeUnit.MILLISECONDS)
                .proceed(chain.request());
        }
    }
}
