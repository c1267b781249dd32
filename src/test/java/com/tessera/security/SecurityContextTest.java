package com.tessera.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SecurityContext
 */
@DisplayName("SecurityContext Tests")
class SecurityContextTest {

    @Test
    @DisplayName("Should expose attributes")
    void shouldExposeAttributes() {
        SecurityContext context = SecurityContext.of(Map.of("organisationId", 42, "region", "eu"));

        assertThat(context.get("organisationId")).isEqualTo(42);
        assertThat(context.require("region")).isEqualTo("eu");
        assertThat(context.has("region")).isTrue();
        assertThat(context.has("userId")).isFalse();
        assertThat(context.get("userId")).isNull();
    }

    @Test
    @DisplayName("Should throw when a required attribute is missing")
    void shouldThrowWhenRequiredAttributeMissing() {
        SecurityContext context = SecurityContext.of("region", "eu");

        assertThatThrownBy(() -> context.require("organisationId"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("organisationId");
    }

    @Test
    @DisplayName("Should not be affected by later changes to the source map")
    void shouldBeImmutable() {
        Map<String, Object> source = new HashMap<>();
        source.put("organisationId", 1);
        SecurityContext context = SecurityContext.of(source);

        source.put("organisationId", 2);

        assertThat(context.get("organisationId")).isEqualTo(1);
        assertThatThrownBy(() -> context.getAttributes().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should keep attribute values out of toString")
    void shouldNotLeakValues() {
        SecurityContext context = SecurityContext.of("organisationId", "acme-secret");

        assertThat(context.toString()).contains("organisationId").doesNotContain("acme-secret");
    }

    @Test
    @DisplayName("Should compare by attributes")
    void shouldCompareByAttributes() {
        assertThat(SecurityContext.of("organisationId", 7)).isEqualTo(SecurityContext.of(Map.of("organisationId", 7)));
        assertThat(SecurityContext.of("organisationId", 7)).isNotEqualTo(SecurityContext.of("organisationId", 8));
    }
}
