package io.storefront.toolkit.core.id;

import lombok.experimental.UtilityClass;

import java.util.UUID;

/**
 * Identifiers for stream events, log entries, notifications and metrics.
 */
@UtilityClass
public class EventIds {

  /**
   * @return a new random identifier
   */
  public static String next() {
    return UUID.randomUUID().toString();
  }
}
