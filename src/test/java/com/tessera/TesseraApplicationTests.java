package com.tessera;

import com.tessera.plan.QueryPlan;
import com.tessera.query.Query;
import com.tessera.query.time.DateRangeResolver;
import com.tessera.schema.CubeDefinition;
import com.tessera.schema.SchemaRegistry;
import com.tessera.service.AnalyticsCompiler;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the application with the test cubes contributed as beans.
 */
@SpringBootTest(properties = {
    "tessera.compiler.timezone=Europe/Berlin",
    "tessera.compiler.row-limit-hint=10000"
})
@DisplayName("Application Context Tests")
class TesseraApplicationTests {

    @TestConfiguration
    static class CubeConfig {

        @Bean
        CubeDefinition ordersCube() {
            return TestCubes.orders();
        }

        @Bean
        CubeDefinition customersCube() {
            return TestCubes.customers();
        }
    }

    @Autowired
    private AnalyticsCompiler compiler;

    @Autowired
    private SchemaRegistry registry;

    @Autowired
    private DateRangeResolver dateRangeResolver;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Should register cube beans and apply compiler settings")
    void shouldWireCompiler() {
        assertThat(registry.size()).isEqualTo(2);
        assertThat(dateRangeResolver.getZone()).isEqualTo(ZoneId.of("Europe/Berlin"));

        QueryPlan plan = compiler.compile(Query.builder()
            .measures("Orders.count")
            .dimensions("Customers.country")
            .build(), TestCubes.tenant(7));

        assertThat(plan.isSecured()).isTrue();
        assertThat(plan.getRowLimitHint()).isEqualTo(10000);
        assertThat(meterRegistry.find("tessera.compile.succeeded").counter().count()).isEqualTo(1.0);
    }
}
