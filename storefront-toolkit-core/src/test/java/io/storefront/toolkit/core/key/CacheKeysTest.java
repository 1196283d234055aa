package io.storefront.toolkit.core.key;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    void shouldUseOperationAloneWithoutArguments() {
        assertThat(CacheKeys.of("products")).isEqualTo("products");
    }

    @Test
    void shouldRenderArgumentsAsJson() {
        assertThat(CacheKeys.of("product", "42")).isEqualTo("product:[\"42\"]");
        assertThat(CacheKeys.of("orders", "user-1", 2)).isEqualTo("orders:[\"user-1\",2]");
    }

    @Test
    void shouldProduceSameKeyForMapsWithDifferentInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("page", 1);
        first.put("category", "Books");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("category", "Books");
        second.put("page", 1);

        assertThat(CacheKeys.of("products", first)).isEqualTo(CacheKeys.of("products", second));
        assertThat(CacheKeys.of("products", first)).isEqualTo("products:[{\"category\":\"Books\",\"page\":1}]");
    }

    @Test
    void shouldDistinguishDifferentArguments() {
        assertThat(CacheKeys.of("products", List.of(1)))
            .isNotEqualTo(CacheKeys.of("products", List.of(2)));
    }
}
