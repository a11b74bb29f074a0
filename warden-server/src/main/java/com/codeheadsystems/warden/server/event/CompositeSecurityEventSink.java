package com.codeheadsystems.warden.server.event;

import com.codeheadsystems.warden.model.SecurityEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans an event out to several sinks. A failing sink is logged and skipped so the others still see
 * the event.
 */
public class CompositeSecurityEventSink implements SecurityEventSink {

  private static final Logger log = LoggerFactory.getLogger(CompositeSecurityEventSink.class);

  private final List<SecurityEventSink> sinks;

  public CompositeSecurityEventSink(final List<SecurityEventSink> sinks) {
    this.sinks = List.copyOf(sinks);
  }

  @Override
  public void publish(final SecurityEvent event) {
    for (SecurityEventSink sink : sinks) {
      try {
        sink.publish(event);
      } catch (RuntimeException e) {
        log.error("Security event sink {} failed for {}", sink.getClass().getSimpleName(), event.type(), e);
      }
    }
  }
}
