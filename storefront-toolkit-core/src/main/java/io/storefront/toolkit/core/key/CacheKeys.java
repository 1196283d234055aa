package io.storefront.toolkit.core.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.storefront.toolkit.core.error.ToolkitException;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.Objects;

/**
 * Builds cache keys from an operation's identity and its arguments.
 * <p>
 * Arguments are rendered as JSON with sorted map keys, so equal argument values produce equal
 * keys regardless of map insertion order.
 *
 * <pre>{@code
 * CacheKeys.of("products", Map.of("page", 1, "category", "Books"))
 * // -> products:[{"category":"Books","page":1}]
 * }</pre>
 */
@UtilityClass
public class CacheKeys {

  private static final ObjectMapper MAPPER = new ObjectMapper()
    .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
    .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

  /**
   * @param operation operation identity (e.g. "product", "orders")
   * @param args      arguments identifying the invocation
   * @return {@code operation:JSON(args)}, or just {@code operation} without arguments
   */
  public static String of(String operation, Object... args) {
    Objects.requireNonNull(operation, "operation cannot be null");
    if (args == null || args.length == 0) {
      return operation;
    }
    try {
      return operation + ":" + MAPPER.writeValueAsString(Arrays.asList(args));
    } catch (JsonProcessingException e) {
      throw new ToolkitException("Cannot build cache key for operation '" + operation + "'", e);
    }
  }
}
