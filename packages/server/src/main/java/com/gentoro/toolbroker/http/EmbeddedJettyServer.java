package com.gentoro.toolbroker.http;

import com.gentoro.toolbroker.exception.ConfigException;
import com.gentoro.toolbroker.exception.ExceptionUtil;
import com.gentoro.toolbroker.exception.TransportException;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}. Components register their
 * servlets on {@link #getContextHandler()} between {@link #prepare()} and {@link #start()}.
 *
 * <p>Port and bind address come from {@code http.port} (default 8080, 0 picks a free port) and
 * {@code http.hostname} (default all interfaces).
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }
      int port;
      String hostname;
      try {
        port = configuration.getInt("http.port", 8080);
        hostname = configuration.getString("http.hostname", "0.0.0.0");
      } catch (RuntimeException e) {
        throw new ConfigException("Failed to resolve http.port / http.hostname configuration", e);
      }
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }

      server = new Server();
      connector = new ServerConnector(server);
      connector.setPort(port);
      if (!"0.0.0.0".equals(hostname.trim())) {
        connector.setHost(hostname.trim());
      }
      server.addConnector(connector);

      contextHandler = new ServletContextHandler();
      contextHandler.setContextPath("/");
      server.setHandler(contextHandler);
      log.trace("Jetty prepared for {}:{}", hostname, port);
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server == null) {
        prepare();
      }
      if (server.isStarted()) {
        return;
      }
      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", connector.getLocalPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new TransportException(
                    "Could not start the HTTP listener; check that the configured port and"
                        + " hostname are available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        if (server.isStarted() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        // keep shutting down the remaining services
        log.error("Error stopping Jetty server", e);
      } finally {
        server = null;
        connector = null;
        contextHandler = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started, the configured port before. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (connector != null && server.isStarted()) {
        return connector.getLocalPort();
      }
      return configuration.getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
