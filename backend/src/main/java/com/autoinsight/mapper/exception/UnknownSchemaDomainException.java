package com.autoinsight.mapper.exception;

import java.util.Collection;
import java.util.List;

import lombok.Getter;

/**
 * Raised when a caller asks for a schema domain no catalog is registered under. This is a
 * configuration error, not a data problem, so it is never converted into a soft result.
 */
@Getter
public class UnknownSchemaDomainException extends RuntimeException {

  private final String requestedDomain;
  private final List<String> availableDomains;

  public UnknownSchemaDomainException(String requestedDomain, Collection<String> availableDomains) {
    super(
        String.format(
            "Unknown schema domain: '%s'. Available domains: %s",
            requestedDomain, String.join(", ", availableDomains)));
    this.requestedDomain = requestedDomain;
    this.availableDomains = List.copyOf(availableDomains);
  }
}
