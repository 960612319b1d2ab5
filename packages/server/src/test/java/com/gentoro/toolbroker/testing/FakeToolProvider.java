package com.gentoro.toolbroker.testing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.toolbroker.provider.ProviderDefinition;
import com.gentoro.toolbroker.provider.TransportKind;
import com.gentoro.toolbroker.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * In-process tool-provider speaking the broker's wire protocol: an SSE stream at {@code /stream},
 * JSON-RPC submissions at {@code /messages/{sessionId}}, a tool catalogue at {@code /tools} and a
 * liveness probe at {@code /health}. Tool behaviour and status codes are scriptable per test.
 */
public class FakeToolProvider implements AutoCloseable {

  public enum Behavior {
    /** Answer with the received name and arguments. */
    ECHO,
    /** Accept the submission, never answer. */
    SILENT,
    /** Emit one progress message, then the echo result. */
    PROGRESS,
    /** Answer with a JSON-RPC error. */
    ERROR,
    /** Echo after a short delay, recording how many calls overlap. */
    SLOW
  }

  private static final String CLOSE_STREAM = "\u0000close";

  private final Server server = new Server();
  private final ServerConnector connector = new ServerConnector(server);
  private final ScheduledExecutorService delayed = Executors.newSingleThreadScheduledExecutor();
  private final Map<String, Behavior> tools = new ConcurrentHashMap<>();
  private final Map<String, BlockingQueue<String>> streams = new ConcurrentHashMap<>();
  private final List<JsonNode> calls = new CopyOnWriteArrayList<>();
  private final AtomicInteger healthProbes = new AtomicInteger();
  private final AtomicInteger toolListRequests = new AtomicInteger();
  private final AtomicInteger streamsOpened = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger maxInFlight = new AtomicInteger();

  private volatile int healthStatus = 200;
  private volatile int toolsStatus = 200;
  private volatile int messageStatus = 202;
  private volatile boolean announceSession = true;
  private volatile boolean announceAsEndpointEvent = false;
  private volatile long slowDelayMs = 150;
  private volatile boolean running = true;

  public FakeToolProvider withTool(String name, Behavior behavior) {
    tools.put(name, behavior);
    return this;
  }

  public FakeToolProvider start() throws Exception {
    connector.setPort(0);
    server.addConnector(connector);
    ServletContextHandler context = new ServletContextHandler();
    context.setContextPath("/");
    context.addServlet(new ServletHolder(new StreamServlet()), "/stream");
    context.addServlet(new ServletHolder(new MessageServlet()), "/messages/*");
    context.addServlet(new ServletHolder(new ToolsServlet()), "/tools");
    context.addServlet(new ServletHolder(new HealthServlet()), "/health");
    server.setHandler(context);
    server.start();
    return this;
  }

  public String baseUrl() {
    return "http://localhost:" + connector.getLocalPort();
  }

  public ProviderDefinition definition(String id) {
    return new ProviderDefinition(id, baseUrl(), null, TransportKind.SSE, false);
  }

  public void setHealthStatus(int status) {
    this.healthStatus = status;
  }

  public void setToolsStatus(int status) {
    this.toolsStatus = status;
  }

  public void setMessageStatus(int status) {
    this.messageStatus = status;
  }

  /** When false the stream opens but no session is ever announced. */
  public void setAnnounceSession(boolean announce) {
    this.announceSession = announce;
  }

  public void setAnnounceAsEndpointEvent(boolean endpointEvent) {
    this.announceAsEndpointEvent = endpointEvent;
  }

  public void setSlowDelayMs(long delayMs) {
    this.slowDelayMs = delayMs;
  }

  /** Push a raw JSON message to every open stream. */
  public void broadcast(JsonNode message) {
    String frame = "data: " + JacksonUtility.toJson(message) + "\n\n";
    streams.values().forEach(q -> q.add(frame));
  }

  /** End every open stream from the provider side. */
  public void closeStreams() {
    streams.values().forEach(q -> q.add(CLOSE_STREAM));
  }

  public List<JsonNode> calls() {
    return new ArrayList<>(calls);
  }

  /** Received {@code tools/call} requests for the given tool. */
  public List<JsonNode> callsTo(String toolName) {
    List<JsonNode> result = new ArrayList<>();
    for (JsonNode call : calls) {
      if (toolName.equals(call.path("params").path("name").asText())) {
        result.add(call);
      }
    }
    return result;
  }

  public int healthProbes() {
    return healthProbes.get();
  }

  public int toolListRequests() {
    return toolListRequests.get();
  }

  public int streamsOpened() {
    return streamsOpened.get();
  }

  public int openStreams() {
    return streams.size();
  }

  public int maxConcurrentCalls() {
    return maxInFlight.get();
  }

  @Override
  public void close() throws Exception {
    running = false;
    delayed.shutdownNow();
    server.stop();
  }

  private void respond(String sessionId, JsonNode envelope) {
    BlockingQueue<String> stream = streams.get(sessionId);
    long id = envelope.path("id").asLong();
    String name = envelope.path("params").path("name").asText();
    Behavior behavior = tools.getOrDefault(name, Behavior.ECHO);
    switch (behavior) {
      case SILENT -> {}
      case ECHO -> stream.add(frame(result(id, envelope)));
      case PROGRESS -> {
        ObjectNode progress = JacksonUtility.getJsonMapper().createObjectNode();
        progress.put("type", "progress");
        progress.put("requestId", id);
        progress.putObject("data").put("percent", 50);
        stream.add(frame(progress));
        stream.add(frame(result(id, envelope)));
      }
      case ERROR -> {
        ObjectNode error = JacksonUtility.getJsonMapper().createObjectNode();
        error.put("jsonrpc", "2.0");
        error.put("id", id);
        error.putObject("error").put("code", -32000).put("message", "tool exploded");
        stream.add(frame(error));
      }
      case SLOW -> {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        delayed.schedule(
            () -> {
              inFlight.decrementAndGet();
              stream.add(frame(result(id, envelope)));
            },
            slowDelayMs,
            TimeUnit.MILLISECONDS);
      }
    }
  }

  private static ObjectNode result(long id, JsonNode envelope) {
    ObjectNode response = JacksonUtility.getJsonMapper().createObjectNode();
    response.put("jsonrpc", "2.0");
    response.put("id", id);
    ObjectNode result = response.putObject("result");
    result.put("tool", envelope.path("params").path("name").asText());
    result.set("arguments", envelope.path("params").path("arguments"));
    return response;
  }

  private static String frame(JsonNode message) {
    return "data: " + JacksonUtility.toJson(message) + "\n\n";
  }

  private class StreamServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      streamsOpened.incrementAndGet();
      String sessionId = UUID.randomUUID().toString();
      BlockingQueue<String> queue = new LinkedBlockingQueue<>();
      resp.setStatus(200);
      resp.setContentType("text/event-stream");
      resp.setCharacterEncoding("UTF-8");
      PrintWriter out = resp.getWriter();
      out.write(": fake provider\n\n");
      if (announceSession) {
        streams.put(sessionId, queue);
        if (announceAsEndpointEvent) {
          out.write("event: endpoint\ndata: /messages/" + sessionId + "\n\n");
        } else {
          out.write("data: {\"sessionId\":\"" + sessionId + "\"}\n\n");
        }
      }
      out.flush();
      resp.flushBuffer();
      try {
        while (running) {
          String frame = queue.poll(50, TimeUnit.MILLISECONDS);
          if (frame == null) continue;
          if (CLOSE_STREAM.equals(frame)) break;
          out.write(frame);
          out.flush();
          if (out.checkError()) break;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        streams.remove(sessionId, queue);
      }
    }
  }

  private class MessageServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String path = req.getPathInfo();
      String sessionId = path == null ? "" : path.substring(1);
      String body = new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
      JsonNode envelope = JacksonUtility.readTree(body);
      calls.add(envelope);
      if (!streams.containsKey(sessionId)) {
        resp.setStatus(404);
        return;
      }
      int status = messageStatus;
      if (status >= 200 && status < 300) {
        respond(sessionId, envelope);
      }
      resp.setStatus(status);
    }
  }

  private class ToolsServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      toolListRequests.incrementAndGet();
      resp.setStatus(toolsStatus);
      resp.setContentType("application/json");
      ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
      ArrayNode list = root.putArray("tools");
      for (String name : tools.keySet()) {
        ObjectNode tool = list.addObject();
        tool.put("name", name);
        tool.put("description", "Fake " + name);
        tool.putObject("inputSchema").put("type", "object");
      }
      resp.getWriter().write(JacksonUtility.toJson(root));
    }
  }

  private class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      healthProbes.incrementAndGet();
      resp.setStatus(healthStatus);
      resp.setContentType("application/json");
      resp.getWriter().write(healthStatus < 300 ? "{\"status\":\"ok\"}" : "{\"status\":\"down\"}");
    }
  }
}
