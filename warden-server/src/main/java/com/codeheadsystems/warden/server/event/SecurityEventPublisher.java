package com.codeheadsystems.warden.server.event;

import com.codeheadsystems.warden.model.SecurityEvent;
import com.codeheadsystems.warden.model.SecurityEventType;
import com.codeheadsystems.warden.model.Severity;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stamps events with the current time and hands them to a sink.
 */
public class SecurityEventPublisher {

  private final SecurityEventSink sink;
  private final Clock clock;

  public SecurityEventPublisher(final SecurityEventSink sink, final Clock clock) {
    this.sink = sink;
    this.clock = clock;
  }

  public Builder event(final SecurityEventType type, final Severity severity) {
    return new Builder(type, severity);
  }

  public class Builder {
    private final SecurityEventType type;
    private final Severity severity;
    private final Map<String, String> details = new LinkedHashMap<>();
    private String identityId;
    private String sessionId;
    private String ipAddress;

    private Builder(final SecurityEventType type, final Severity severity) {
      this.type = type;
      this.severity = severity;
    }

    public Builder identity(final String value) {
      this.identityId = value;
      return this;
    }

    public Builder session(final String value) {
      this.sessionId = value;
      return this;
    }

    public Builder ip(final String value) {
      this.ipAddress = value;
      return this;
    }

    public Builder detail(final String key, final Object value) {
      if (value != null) {
        details.put(key, String.valueOf(value));
      }
      return this;
    }

    public void publish() {
      sink.publish(new SecurityEvent(type, severity, identityId, sessionId, ipAddress, clock.instant(), details));
    }
  }
}
