package com.tessera.config;

import com.tessera.query.time.DateRangeResolver;
import com.tessera.schema.CubeDefinition;
import com.tessera.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.stream.Collectors;

/**
 * Compiler-wide settings and the sealed schema registry.
 * Cubes are contributed as {@link CubeDefinition} beans.
 */
@Configuration
public class CompilerConfig {
    private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

    @Value("${tessera.compiler.timezone:UTC}")
    private String timezone;

    @Value("${tessera.compiler.week-start:MONDAY}")
    private String weekStart;

    @Bean
    public ZoneId compilerZone() {
        return ZoneId.of(timezone);
    }

    /**
     * Source of "now" for relative date ranges when callers do not pass one
     */
    @Bean
    public Clock compilerClock(ZoneId compilerZone) {
        return Clock.system(compilerZone);
    }

    @Bean
    public DateRangeResolver dateRangeResolver(ZoneId compilerZone) {
        DayOfWeek firstDay = DayOfWeek.valueOf(weekStart.trim().toUpperCase());
        logger.info("Date ranges resolve in zone {} with weeks starting on {}", compilerZone, firstDay);
        return new DateRangeResolver(compilerZone, firstDay);
    }

    @Bean
    public SchemaRegistry schemaRegistry(ObjectProvider<CubeDefinition> cubes) {
        return SchemaRegistry.builder()
            .registerAll(cubes.orderedStream().collect(Collectors.toList()))
            .build();
    }
}
