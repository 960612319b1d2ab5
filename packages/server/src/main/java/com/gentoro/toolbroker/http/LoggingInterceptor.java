package com.gentoro.toolbroker.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("➡️ {} {}", request.method(), request.url());
    if (log.isTraceEnabled()) {
      log.trace("Request headers:\n{}\nBody:\n{}", request.headers(), bodyToString(request));
    }

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "⬅️ {} {} -> {} in {} ms",
        request.method(),
        response.request().url(),
        response.code(),
        String.format("%.1f", (endTime - startTime) / 1e6d));

    // Never peek event streams: the body is unbounded and owned by the stream reader.
    if (log.isTraceEnabled() && !isEventStream(response)) {
      log.trace("Response body:\n{}", response.peekBody(64 * 1024).string());
    }
    return response;
  }

  private static boolean isEventStream(Response response) {
    MediaType type = response.body() == null ? null : response.body().contentType();
    return type != null && "event-stream".equalsIgnoreCase(type.subtype());
  }

  private static String bodyToString(Request request) {
    try {
      Buffer buffer = new Buffer();
      if (request.body() != null) request.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
