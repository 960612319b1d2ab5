package com.gentoro.toolbroker.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

/**
 * Builds the OkHttp clients used to talk to tool-providers. All clients derived here share one
 * connection pool and dispatcher; only the timeouts differ.
 */
public class OkHttpFactory {

  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  /** Client for long-lived event streams: no read timeout, the stream may stay idle for hours. */
  public static OkHttpClient streaming(OkHttpClient base) {
    return base.newBuilder().readTimeout(Duration.ZERO).retryOnConnectionFailure(false).build();
  }

  /** Client whose whole call (connect, write, read) is bounded by {@code callTimeout}. */
  public static OkHttpClient bounded(OkHttpClient base, Duration callTimeout) {
    return base.newBuilder().callTimeout(callTimeout).build();
  }
}
