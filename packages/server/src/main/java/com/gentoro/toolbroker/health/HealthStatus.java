package com.gentoro.toolbroker.health;

public enum HealthStatus {
  HEALTHY,
  UNHEALTHY,
  UNKNOWN
}
