package com.gentoro.toolbroker;

public class ToolBrokerApp {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(ToolBrokerApp.class);

  public static void main(String[] args) {
    ToolBroker broker;
    try {
      broker = new ToolBroker(args);
      broker.initialize();
    } catch (RuntimeException e) {
      log.error("Tool broker failed to start", e);
      System.exit(1);
      return;
    }
    if ("server".equals(broker.startupParameters().mode())) {
      broker.waitShutdownSignal();
    }
  }
}
