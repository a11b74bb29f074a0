package com.codeheadsystems.warden.server.manager;

import com.codahale.metrics.MetricRegistry;
import com.codeheadsystems.warden.server.config.ConfigurationException;
import com.codeheadsystems.warden.server.config.WardenConfiguration;
import com.codeheadsystems.warden.server.config.WardenSettings;
import com.codeheadsystems.warden.server.evaluator.SecurityEvaluator;
import com.codeheadsystems.warden.server.event.CompositeSecurityEventSink;
import com.codeheadsystems.warden.server.event.LoggingSecurityEventSink;
import com.codeheadsystems.warden.server.event.RecentSecurityEvents;
import com.codeheadsystems.warden.server.event.SecurityEventPublisher;
import com.codeheadsystems.warden.server.event.SecurityEventSink;
import com.codeheadsystems.warden.server.health.WardenHealthCheck;
import com.codeheadsystems.warden.server.metrics.SecurityMetrics;
import com.codeheadsystems.warden.server.resilience.GuardedRevocationRegistry;
import com.codeheadsystems.warden.server.resilience.GuardedSessionRegistry;
import com.codeheadsystems.warden.server.resilience.OutageTracker;
import com.codeheadsystems.warden.server.resilience.StoreCallGuard;
import com.codeheadsystems.warden.server.secret.RotatingSecretStore;
import com.codeheadsystems.warden.server.secret.SigningAlgorithm;
import com.codeheadsystems.warden.server.store.InMemoryRevocationRegistry;
import com.codeheadsystems.warden.server.store.InMemorySessionRegistry;
import com.codeheadsystems.warden.server.store.RevocationRegistry;
import com.codeheadsystems.warden.server.store.SessionRegistry;
import com.codeheadsystems.warden.server.token.IdGenerator;
import com.codeheadsystems.warden.server.token.SecureRandomIdGenerator;
import com.codeheadsystems.warden.server.token.TokenCodec;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and owns one session security manager with its stores, secrets, sweeper and health check.
 * <p>
 * Construction fails with {@link ConfigurationException} when the configuration is unsafe, before
 * any token can be issued. Close it on shutdown to stop the background threads.
 * <p>
 * Without custom registries the manager keeps sessions and revocations in memory, which only works
 * for a single instance. Custom registries are assumed to be remote and every call to them is put
 * behind a timeout.
 */
public final class Warden implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(Warden.class);

  private static final int MAX_STORE_CALL_THREADS = 64;

  private final SessionSecurityManager manager;
  private final RotatingSecretStore secretStore;
  private final RecentSecurityEvents recentEvents;
  private final MetricRegistry metricRegistry;
  private final WardenHealthCheck healthCheck;
  private final SessionSweeper sweeper;
  private final ExecutorService storeCallExecutor;

  private Warden(final Builder builder,
                 final SessionSecurityManager manager,
                 final RotatingSecretStore secretStore,
                 final RecentSecurityEvents recentEvents,
                 final WardenHealthCheck healthCheck,
                 final SessionSweeper sweeper,
                 final ExecutorService storeCallExecutor) {
    this.manager = manager;
    this.secretStore = secretStore;
    this.recentEvents = recentEvents;
    this.metricRegistry = builder.metricRegistry;
    this.healthCheck = healthCheck;
    this.sweeper = sweeper;
    this.storeCallExecutor = storeCallExecutor;
  }

  /**
   * Builds a manager with in-memory stores.
   *
   * @throws ConfigurationException when the configuration is unsafe
   */
  public static Warden create(final WardenConfiguration configuration) {
    return builder(configuration).build();
  }

  public static Builder builder(final WardenConfiguration configuration) {
    return new Builder(configuration);
  }

  public SessionSecurityManager manager() {
    return manager;
  }

  /**
   * The secret store, for rotating keys at runtime.
   */
  public RotatingSecretStore secretStore() {
    return secretStore;
  }

  public RecentSecurityEvents recentEvents() {
    return recentEvents;
  }

  public MetricRegistry metricRegistry() {
    return metricRegistry;
  }

  public WardenHealthCheck healthCheck() {
    return healthCheck;
  }

  SessionSweeper sweeper() {
    return sweeper;
  }

  @Override
  public void close() {
    sweeper.shutdown();
    if (storeCallExecutor != null) {
      storeCallExecutor.shutdownNow();
    }
    log.info("Session security manager stopped");
  }

  public static class Builder {
    private final WardenConfiguration configuration;
    private Clock clock = Clock.systemUTC();
    private IdGenerator idGenerator = new SecureRandomIdGenerator();
    private SessionRegistry sessionRegistry;
    private RevocationRegistry revocationRegistry;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private final List<SecurityEventSink> eventSinks = new ArrayList<>();
    private boolean startSweeper = true;

    private Builder(final WardenConfiguration configuration) {
      this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public Builder clock(final Clock value) {
      this.clock = Objects.requireNonNull(value);
      return this;
    }

    public Builder idGenerator(final IdGenerator value) {
      this.idGenerator = Objects.requireNonNull(value);
      return this;
    }

    /**
     * A shared session store. Calls to it are guarded by the configured timeout.
     */
    public Builder sessionRegistry(final SessionRegistry value) {
      this.sessionRegistry = value;
      return this;
    }

    /**
     * A shared revocation store. Calls to it are guarded by the configured timeout.
     */
    public Builder revocationRegistry(final RevocationRegistry value) {
      this.revocationRegistry = value;
      return this;
    }

    public Builder metricRegistry(final MetricRegistry value) {
      this.metricRegistry = Objects.requireNonNull(value);
      return this;
    }

    /**
     * An extra destination for security events, alongside the log and the in-memory buffer.
     */
    public Builder eventSink(final SecurityEventSink value) {
      this.eventSinks.add(Objects.requireNonNull(value));
      return this;
    }

    /**
     * Whether to start the background sweeper. Tests that drive sweeps by hand turn it off.
     */
    public Builder startSweeper(final boolean value) {
      this.startSweeper = value;
      return this;
    }

    public Warden build() {
      final WardenSettings settings = WardenSettings.from(configuration);
      final SigningAlgorithm algorithm = SigningAlgorithm.parse(configuration.getTokens().getAlgorithm());

      final RecentSecurityEvents recentEvents = new RecentSecurityEvents(settings.recentEventCapacity());
      final List<SecurityEventSink> sinks = new ArrayList<>();
      sinks.add(new LoggingSecurityEventSink());
      sinks.add(recentEvents);
      sinks.addAll(eventSinks);
      final SecurityEventPublisher events = new SecurityEventPublisher(new CompositeSecurityEventSink(sinks), clock);

      final RotatingSecretStore secretStore =
          RotatingSecretStore.fromConfiguration(configuration.getSecrets(), algorithm, events);
      final TokenCodec codec = new TokenCodec(secretStore, settings.tokens(), clock);
      final SecurityMetrics metrics = new SecurityMetrics(metricRegistry);

      ExecutorService executor = null;
      final List<OutageTracker> trackers = new ArrayList<>();
      final SessionRegistry sessions;
      if (sessionRegistry == null) {
        sessions = new InMemorySessionRegistry(clock, settings.sessions().idleTimeout());
      } else {
        executor = storeCallExecutor();
        final OutageTracker tracker =
            new OutageTracker("session", settings.stores().sustainedFailureThreshold(), clock);
        trackers.add(tracker);
        sessions = new GuardedSessionRegistry(sessionRegistry,
            new StoreCallGuard("session", settings.stores().callTimeout(), executor, tracker, metrics));
      }
      final RevocationRegistry revocations;
      if (revocationRegistry == null) {
        revocations = new InMemoryRevocationRegistry(clock);
      } else {
        executor = executor == null ? storeCallExecutor() : executor;
        final OutageTracker tracker =
            new OutageTracker("revocation", settings.stores().sustainedFailureThreshold(), clock);
        trackers.add(tracker);
        revocations = new GuardedRevocationRegistry(revocationRegistry,
            new StoreCallGuard("revocation", settings.stores().callTimeout(), executor, tracker, metrics));
      }

      final SecurityEvaluator evaluator = new SecurityEvaluator(settings.evaluator(), settings.sessions(), clock);
      final SessionSecurityManager manager = new SessionSecurityManager(codec, sessions, revocations, evaluator,
          events, recentEvents, metrics, idGenerator, clock, settings);

      final SessionSweeper sweeper = new SessionSweeper(sessions, revocations);
      if (startSweeper) {
        sweeper.start(settings.sessions(), settings.stores());
      }
      final WardenHealthCheck healthCheck = new WardenHealthCheck(secretStore, trackers);

      if (settings.stores().strictMode()) {
        log.info("Strict mode on: tokens are refused while the session store is unreachable");
      }
      if (sessionRegistry == null || revocationRegistry == null) {
        log.warn("Using in-memory session or revocation storage; state is lost on restart and not shared");
      }
      log.info("Session security manager ready (issuer={}, algorithm={}, maxConcurrentSessions={})",
          settings.tokens().issuer(), algorithm, settings.sessions().maxConcurrentSessions());
      return new Warden(this, manager, secretStore, recentEvents, healthCheck, sweeper, executor);
    }

    private static ExecutorService storeCallExecutor() {
      final AtomicInteger counter = new AtomicInteger();
      return new ThreadPoolExecutor(0, MAX_STORE_CALL_THREADS, 60, TimeUnit.SECONDS, new SynchronousQueue<>(),
          r -> {
            Thread t = new Thread(r, "warden-store-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
          });
    }
  }
}
