package com.codeheadsystems.warden.server.event;

import com.codeheadsystems.warden.model.SecurityEvent;

/**
 * Receives security events. Implementations must be thread safe and must not throw back into the
 * request path.
 */
public interface SecurityEventSink {

  void publish(SecurityEvent event);
}
