package com.gentoro.toolbroker;

import com.gentoro.toolbroker.actuator.ActuatorService;
import com.gentoro.toolbroker.auth.CredentialCipher;
import com.gentoro.toolbroker.auth.CredentialStore;
import com.gentoro.toolbroker.auth.InMemoryCredentialStore;
import com.gentoro.toolbroker.auth.SessionBroker;
import com.gentoro.toolbroker.concurrency.NamedThreadFactory;
import com.gentoro.toolbroker.concurrency.TenantMutex;
import com.gentoro.toolbroker.exception.ConfigException;
import com.gentoro.toolbroker.exception.StateException;
import com.gentoro.toolbroker.health.HealthMonitor;
import com.gentoro.toolbroker.health.ProviderHealth;
import com.gentoro.toolbroker.http.EmbeddedJettyServer;
import com.gentoro.toolbroker.http.OkHttpFactory;
import com.gentoro.toolbroker.logging.LoggingService;
import com.gentoro.toolbroker.provider.AgentDirectory;
import com.gentoro.toolbroker.provider.ConfigurationAgentDirectory;
import com.gentoro.toolbroker.routing.ToolDiscoveryClient;
import com.gentoro.toolbroker.routing.ToolRouter;
import com.gentoro.toolbroker.session.InMemorySessionRepository;
import com.gentoro.toolbroker.session.UpstreamSessionStore;
import com.gentoro.toolbroker.transport.ConnectionManager;
import com.gentoro.toolbroker.transport.RequestCorrelator;
import com.gentoro.toolbroker.utility.Durations;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Service container of the broker. {@link #initialize()} wires every component from the YAML
 * configuration and, in server mode, starts the actuator HTTP listener; {@link #shutdown()} releases
 * them in reverse order.
 */
public class ToolBroker {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(ToolBroker.class);

  private final StartupParameters startupParameters;
  private final Clock clock;
  private ConfigurationProvider configurationProvider;
  private ScheduledExecutorService scheduler;
  private ExecutorService workers;
  private OkHttpClient httpClient;
  private AgentDirectory agentDirectory;
  private UpstreamSessionStore sessionStore;
  private CredentialStore credentialStore;
  private SessionBroker sessionBroker;
  private TenantMutex tenantMutex;
  private ConnectionManager connectionManager;
  private RequestCorrelator correlator;
  private HealthMonitor healthMonitor;
  private ToolRouter toolRouter;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public ToolBroker(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), Clock.systemUTC());
  }

  public ToolBroker(StartupParameters startupParameters, Clock clock) {
    this.startupParameters = startupParameters;
    this.clock = clock;
  }

  public void initialize() {
    if (!initialized.compareAndSet(false, true)) {
      throw new StateException("ToolBroker already initialized");
    }
    if ("help".equals(startupParameters.mode())) {
      System.out.println(StartupParameters.usage());
      shutdownLatch.countDown();
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    Configuration config = configuration();
    LoggingService.applyConfiguration(config);
    try {
      wireComponents(config);
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }

    switch (startupParameters.mode()) {
      case "server" -> startHttp();
      case "check" -> {
        checkProviders();
        shutdown();
      }
      default -> {
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
      }
    }
    log.info("Tool broker initialized in {} mode", startupParameters.mode());
  }

  private void wireComponents(Configuration config) {

    int workerThreads = config.getInt("broker.worker-threads", 8);
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("broker-timer"));
    this.workers =
        Executors.newFixedThreadPool(workerThreads, new NamedThreadFactory("broker-worker"));
    this.httpClient =
        OkHttpFactory.create(
            Durations.get(config, "http.client.connect-timeout", Duration.ofSeconds(5)),
            Durations.get(config, "http.client.read-timeout", Duration.ofSeconds(30)));

    this.agentDirectory = new ConfigurationAgentDirectory(config);
    this.tenantMutex = new TenantMutex();

    this.sessionStore = new UpstreamSessionStore(new InMemorySessionRepository(), clock);
    sessionStore.startSweeper(
        scheduler,
        Durations.get(
            config, "broker.sessions.sweep-interval", UpstreamSessionStore.DEFAULT_SWEEP_INTERVAL));
    this.credentialStore = new InMemoryCredentialStore();
    this.sessionBroker =
        new SessionBroker(credentialStore, new CredentialCipher(credentialKey(config)), sessionStore);

    this.healthMonitor =
        new HealthMonitor(
            httpClient,
            Durations.get(config, "broker.health.ttl", HealthMonitor.DEFAULT_TTL),
            Durations.get(config, "broker.health.probe-timeout", HealthMonitor.DEFAULT_PROBE_TIMEOUT),
            clock);
    this.connectionManager =
        new ConnectionManager(
            httpClient,
            scheduler,
            Durations.get(
                config, "broker.handshake-timeout", ConnectionManager.DEFAULT_HANDSHAKE_TIMEOUT),
            clock);
    this.correlator = new RequestCorrelator(httpClient, scheduler, clock);
    connectionManager.addListener(correlator);
    connectionManager.addListener(healthMonitor);

    this.toolRouter =
        new ToolRouter(
            agentDirectory,
            healthMonitor,
            new ToolDiscoveryClient(
                httpClient,
                Durations.get(config, "broker.discovery-timeout", Duration.ofSeconds(15))),
            connectionManager,
            correlator,
            sessionBroker,
            tenantMutex,
            workers,
            clock);
  }

  private void startHttp() {
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ActuatorService(this).register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  /** Probe every configured provider and log the outcome. */
  List<ProviderHealth> checkProviders() {
    List<ProviderHealth> report = healthMonitor.checkAll(agentDirectory.providerDefinitions());
    for (ProviderHealth health : report) {
      log.info(
          "{} {} ({}ms){}",
          health.providerId(),
          health.status(),
          health.responseTimeMs(),
          health.error() == null ? "" : ": " + health.error());
    }
    return report;
  }

  private static String credentialKey(Configuration config) {
    String key = config.getString("broker.credentials.key", null);
    if (key == null || key.isBlank() || key.startsWith("${")) {
      throw new ConfigException(
          "broker.credentials.key is not set; define BROKER_CREDENTIALS_KEY or configure the key");
    }
    return key;
  }

  /** Block until {@link #shutdown()} runs, registering a JVM shutdown hook on first use. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "toolbroker-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    try {
      closeLogged("http server", httpServer);
      closeLogged("connection manager", connectionManager);
      closeLogged("request correlator", correlator);
      closeLogged("session store", sessionStore);
      if (scheduler != null) scheduler.shutdownNow();
      if (workers != null) workers.shutdownNow();
      if (httpClient != null) {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
      }
      log.info("Tool broker stopped");
    } finally {
      shutdownLatch.countDown();
    }
  }

  private static void closeLogged(String name, AutoCloseable closeable) {
    if (closeable == null) return;
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("Error while closing {}", name, e);
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("ToolBroker not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ToolRouter toolRouter() {
    return requireInitialized(toolRouter);
  }

  public SessionBroker sessionBroker() {
    return requireInitialized(sessionBroker);
  }

  public UpstreamSessionStore sessionStore() {
    return requireInitialized(sessionStore);
  }

  public ConnectionManager connectionManager() {
    return requireInitialized(connectionManager);
  }

  public RequestCorrelator correlator() {
    return requireInitialized(correlator);
  }

  public HealthMonitor healthMonitor() {
    return requireInitialized(healthMonitor);
  }

  public TenantMutex tenantMutex() {
    return requireInitialized(tenantMutex);
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  private static <T> T requireInitialized(T component) {
    if (component == null) {
      throw new StateException("ToolBroker not initialized. Call initialize() first.");
    }
    return component;
  }
}
