package com.gentoro.toolbroker.actuator;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.toolbroker.ToolBroker;
import com.gentoro.toolbroker.health.ProviderHealth;
import com.gentoro.toolbroker.session.SessionStats;
import com.gentoro.toolbroker.transport.ProviderConnection;
import com.gentoro.toolbroker.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Operational endpoints in the style of Spring Boot's actuator.
 *
 * <ul>
 *   <li>{@code GET /actuator/health}: {@code {"status":"UP"}}
 *   <li>{@code GET /actuator/broker}: open provider connections, pending requests, cached provider
 *       health, upstream session counts and busy mutex keys
 * </ul>
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(ActuatorService.class);

  private final ToolBroker broker;

  public ActuatorService(ToolBroker broker) {
    this.broker = broker;
  }

  public void register() {
    var context = broker.httpServer().getContextHandler();
    context.addServlet(new ServletHolder(new HealthServlet()), "/actuator/health");
    context.addServlet(new ServletHolder(new BrokerStatusServlet()), "/actuator/broker");
    log.info("Actuator endpoints registered at /actuator/health and /actuator/broker");
  }

  /** Snapshot served by {@code /actuator/broker}. */
  ObjectNode brokerStatus() {
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();

    ArrayNode connections = root.putArray("connections");
    for (ProviderConnection c : broker.connectionManager().activeConnections()) {
      ObjectNode node = connections.addObject();
      node.put("providerId", c.providerId());
      node.put("sessionId", c.sessionId());
      node.put("state", c.state().name());
      node.put("createdAt", c.createdAt().toString());
      node.put("lastUsed", c.lastUsed().toString());
      node.put("errorCount", c.errorCount());
    }

    root.put("pendingRequests", broker.correlator().pendingCount());

    ObjectNode health = root.putObject("providerHealth");
    for (Map.Entry<String, ProviderHealth> e : broker.healthMonitor().snapshot().entrySet()) {
      health.set(e.getKey(), JacksonUtility.valueToTree(e.getValue()));
    }

    SessionStats stats = broker.sessionStore().stats();
    root.set("sessions", JacksonUtility.valueToTree(stats));
    root.put("lockedTenants", broker.tenantMutex().activeKeys());
    return root;
  }

  private static void writeJson(HttpServletResponse resp, String payload) throws IOException {
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    try (PrintWriter out = resp.getWriter()) {
      out.println(payload);
    }
  }

  private static class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      writeJson(resp, "{\"status\":\"UP\"}");
    }
  }

  private class BrokerStatusServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      writeJson(resp, JacksonUtility.toJson(brokerStatus()));
    }
  }
}
