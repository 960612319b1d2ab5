package com.gentoro.toolbroker.session;

public record SessionStats(long totalSessions, long activeSessions, long expiredSessions) {}
