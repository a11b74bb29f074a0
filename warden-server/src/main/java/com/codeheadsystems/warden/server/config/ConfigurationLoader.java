package com.codeheadsystems.warden.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a {@link WardenConfiguration} from YAML, applies {@code WARDEN_*} environment overrides and
 * validates the result.
 * <p>
 * Recognised overrides: {@code WARDEN_ISSUER}, {@code WARDEN_ACCESS_SECRET},
 * {@code WARDEN_REFRESH_SECRET}, {@code WARDEN_VERIFICATION_SECRET},
 * {@code WARDEN_PASSWORD_RESET_SECRET}, {@code WARDEN_ACCESS_TTL}, {@code WARDEN_REFRESH_TTL},
 * {@code WARDEN_MAX_CONCURRENT_SESSIONS}, {@code WARDEN_ENABLE_IP_VALIDATION},
 * {@code WARDEN_STRICT_MODE}.
 */
public class ConfigurationLoader {

  private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

  private final ObjectMapper mapper;
  private final Map<String, String> environment;

  public ConfigurationLoader() {
    this(System.getenv());
  }

  public ConfigurationLoader(final Map<String, String> environment) {
    this.environment = Map.copyOf(environment);
    this.mapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
  }

  public WardenConfiguration load(final Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in, path.toString());
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read configuration " + path, e);
    }
  }

  /**
   * Loads a configuration from the classpath.
   *
   * @param resource resource name, e.g. {@code warden.yml}
   * @return the validated configuration
   */
  public WardenConfiguration loadResource(final String resource) {
    try (InputStream in = ConfigurationLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigurationException("Configuration resource not found: " + resource);
      }
      return load(in, resource);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read configuration " + resource, e);
    }
  }

  WardenConfiguration load(final InputStream in, final String source) throws IOException {
    final WardenConfiguration configuration;
    try {
      configuration = mapper.readValue(in, WardenConfiguration.class);
    } catch (IOException e) {
      throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
    }
    if (configuration == null) {
      throw new ConfigurationException("Configuration " + source + " is empty");
    }
    applyEnvironment(configuration);
    validate(configuration);
    log.info("Loaded configuration from {}", source);
    return configuration;
  }

  /**
   * Builds a configuration from defaults plus environment overrides only.
   */
  public WardenConfiguration fromEnvironment() {
    final WardenConfiguration configuration = new WardenConfiguration();
    applyEnvironment(configuration);
    validate(configuration);
    return configuration;
  }

  void applyEnvironment(final WardenConfiguration configuration) {
    override("WARDEN_ISSUER", v -> configuration.getTokens().setIssuer(v));
    override("WARDEN_ACCESS_SECRET", v -> configuration.getSecrets().getAccess().setSecret(v));
    override("WARDEN_REFRESH_SECRET", v -> configuration.getSecrets().getRefresh().setSecret(v));
    override("WARDEN_VERIFICATION_SECRET", v -> configuration.getSecrets().getEmailVerification().setSecret(v));
    override("WARDEN_PASSWORD_RESET_SECRET", v -> configuration.getSecrets().getPasswordReset().setSecret(v));
    override("WARDEN_ACCESS_TTL", v -> configuration.getTokens().setAccessTtl(v));
    override("WARDEN_REFRESH_TTL", v -> configuration.getTokens().setRefreshTtl(v));
    override("WARDEN_MAX_CONCURRENT_SESSIONS",
        v -> configuration.getSessions().setMaxConcurrentSessions(parseInt("WARDEN_MAX_CONCURRENT_SESSIONS", v)));
    override("WARDEN_ENABLE_IP_VALIDATION",
        v -> configuration.getEvaluator().setIpValidation(parseBoolean("WARDEN_ENABLE_IP_VALIDATION", v)));
    override("WARDEN_STRICT_MODE",
        v -> configuration.getStores().setStrictMode(parseBoolean("WARDEN_STRICT_MODE", v)));
  }

  void validate(final WardenConfiguration configuration) {
    try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
      final Validator validator = factory.getValidator();
      final Set<ConstraintViolation<WardenConfiguration>> violations = validator.validate(configuration);
      if (!violations.isEmpty()) {
        final String detail = violations.stream()
            .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
            .map(v -> v.getPropertyPath() + " " + v.getMessage())
            .collect(Collectors.joining(", "));
        throw new ConfigurationException("Invalid configuration: " + detail);
      }
    }
  }

  private void override(final String variable, final Consumer<String> setter) {
    final String value = environment.get(variable);
    if (value != null && !value.isBlank()) {
      log.debug("Applying override from {}", variable);
      setter.accept(value.trim());
    }
  }

  private static int parseInt(final String variable, final String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(variable + " must be an integer", e);
    }
  }

  private static boolean parseBoolean(final String variable, final String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new ConfigurationException(variable + " must be true or false");
  }
}
