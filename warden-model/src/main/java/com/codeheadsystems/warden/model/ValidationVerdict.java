package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of validating a token. Validation never throws for a bad token; it always produces one of
 * these.
 *
 * @param valid                     whether the token may be trusted
 * @param claims                    decoded claims, only when valid
 * @param error                     rejection reason, only when invalid
 * @param message                   human readable detail
 * @param shouldRefresh             the caller should use its refresh token now
 * @param warnings                  non-fatal observations, never null
 * @param trustScore                0 to 100, only when valid
 * @param reauthenticationSuggested enough warnings piled up that a fresh login is advisable
 */
public record ValidationVerdict(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("claims") ClaimSet claims,
    @JsonProperty("error") VerdictError error,
    @JsonProperty("message") String message,
    @JsonProperty("shouldRefresh") boolean shouldRefresh,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("trustScore") Integer trustScore,
    @JsonProperty("reauthenticationSuggested") boolean reauthenticationSuggested) {

  public ValidationVerdict {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static ValidationVerdict valid(final ClaimSet claims,
                                        final List<String> warnings,
                                        final boolean shouldRefresh,
                                        final int trustScore,
                                        final boolean reauthenticationSuggested) {
    return new ValidationVerdict(true, claims, null, null, shouldRefresh, warnings, trustScore,
        reauthenticationSuggested);
  }

  public static ValidationVerdict invalid(final VerdictError error,
                                          final String message,
                                          final boolean shouldRefresh) {
    return invalid(error, message, shouldRefresh, List.of());
  }

  public static ValidationVerdict invalid(final VerdictError error,
                                          final String message,
                                          final boolean shouldRefresh,
                                          final List<String> warnings) {
    return new ValidationVerdict(false, null, error, message, shouldRefresh, warnings, null, false);
  }
}
