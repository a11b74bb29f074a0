package com.codeheadsystems.warden.server.event;

import com.codeheadsystems.warden.model.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the {@code warden.security} logger, so audit output can be routed
 * separately from application logs.
 */
public class LoggingSecurityEventSink implements SecurityEventSink {

  private static final Logger log = LoggerFactory.getLogger("warden.security");

  @Override
  public void publish(final SecurityEvent event) {
    switch (event.severity()) {
      case LOW -> log.info("{} identity={} session={} ip={} details={}",
          event.type(), event.identityId(), event.sessionId(), event.ipAddress(), event.details());
      case MEDIUM -> log.warn("{} identity={} session={} ip={} details={}",
          event.type(), event.identityId(), event.sessionId(), event.ipAddress(), event.details());
      default -> log.error("{} [{}] identity={} session={} ip={} details={}",
          event.type(), event.severity(), event.identityId(), event.sessionId(), event.ipAddress(),
          event.details());
    }
  }
}
