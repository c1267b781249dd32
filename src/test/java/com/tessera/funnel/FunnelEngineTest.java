package com.tessera.funnel;

import com.tessera.TestCubes;
import com.tessera.error.FunnelNotSupportedException;
import com.tessera.error.FunnelStepOrderException;
import com.tessera.error.InvalidFunnelException;
import com.tessera.plan.JoinPathResolver;
import com.tessera.plan.JoinStep;
import com.tessera.query.DateRangeExpression;
import com.tessera.query.FilterOperator;
import com.tessera.query.LogicalFilter;
import com.tessera.query.MemberFilter;
import com.tessera.query.predicate.ColumnRef;
import com.tessera.query.predicate.PredicateBuilder;
import com.tessera.query.predicate.Predicates;
import com.tessera.query.time.DateRangeResolver;
import com.tessera.schema.SchemaRegistry;
import com.tessera.security.MissingSecurityContextException;
import com.tessera.security.SecurityInjector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for FunnelEngine
 */
@DisplayName("FunnelEngine Tests")
class FunnelEngineTest {

    private static final Instant DAY_0 = Instant.parse("2025-01-01T00:00:00Z");

    private SchemaRegistry registry;
    private FunnelEngine engine;

    @BeforeEach
    void setUp() {
        DateRangeResolver dateRangeResolver = new DateRangeResolver();
        registry = TestCubes.registry();
        engine = new FunnelEngine(new PredicateBuilder(dateRangeResolver), new JoinPathResolver(),
            new SecurityInjector(), dateRangeResolver);
    }

    private static FunnelStep signUp() {
        return new FunnelStep("SignUp", MemberFilter.of("Events.eventType", FilterOperator.EQUALS, "signup"));
    }

    private static FunnelStep purchase() {
        return new FunnelStep("Purchase", MemberFilter.of("Events.eventType", FilterOperator.EQUALS, "purchase"),
            ConversionWindow.parse("P7D"));
    }

    private static FunnelDefinition.Builder signUpToPurchase() {
        return FunnelDefinition.builder("Events.userId", "Events.timestamp")
            .step(signUp())
            .step(purchase());
    }

    private static Instant day(int days) {
        return DAY_0.plus(Duration.ofDays(days));
    }

    @Test
    @DisplayName("Should plan a funnel on an event stream cube")
    void shouldPlanFunnel() {
        // Given
        FunnelDefinition definition = signUpToPurchase()
            .dateRange(DateRangeExpression.of("last 30 days"))
            .build();

        // When
        FunnelPlan plan = engine.plan(definition, registry, TestCubes.tenant(42), TestCubes.NOW);

        // Then
        ColumnRef userId = ColumnRef.of("Events", "user_id");
        ColumnRef occurredAt = ColumnRef.of("Events", "occurred_at");
        assertThat(plan.getCube()).isEqualTo("Events");
        assertThat(plan.getBindingKeyColumn()).isEqualTo(userId);
        assertThat(plan.getTimeColumn()).isEqualTo(occurredAt);
        assertThat(plan.getJoins()).isEmpty();
        assertThat(plan.getStepPredicates()).containsExactly(
            Predicates.equalTo(ColumnRef.of("Events", "event_type"), "signup"),
            Predicates.equalTo(ColumnRef.of("Events", "event_type"), "purchase"));
        assertThat(plan.getTenantPredicates()).containsOnlyKeys("Events");
        assertThat(plan.getDateRange().getStart()).isEqualTo(TestCubes.NOW.minus(Duration.ofDays(30)));
        assertThat(plan.getDateRange().getEnd()).isEqualTo(TestCubes.NOW);
        assertThat(plan.getOrderBy()).containsExactly(userId, occurredAt);
        assertThat(plan.getFilterPredicate().getReferencedCubes()).containsExactly("Events");
    }

    @Test
    @DisplayName("Should join and secure cubes referenced by step filters")
    void shouldJoinStepFilterCubes() {
        FunnelDefinition definition = FunnelDefinition.builder("Events.userId", "Events.timestamp")
            .step(signUp())
            .step(new FunnelStep("GermanPurchase", LogicalFilter.and(List.of(
                MemberFilter.of("Events.eventType", FilterOperator.EQUALS, "purchase"),
                MemberFilter.of("Customers.country", FilterOperator.EQUALS, "DE")))))
            .build();

        FunnelPlan plan = engine.plan(definition, registry, TestCubes.tenant(42), TestCubes.NOW);

        assertThat(plan.getJoins()).extracting(JoinStep::getToCube).containsExactly("Customers");
        assertThat(plan.getTenantPredicates()).containsOnlyKeys("Events", "Customers");
        assertThat(plan.getDateRange()).isNull();
    }

    @Test
    @DisplayName("Should require at least two uniquely named steps")
    void shouldValidateSteps() {
        FunnelDefinition single = FunnelDefinition.builder("Events.userId", "Events.timestamp")
            .step(signUp())
            .build();
        FunnelDefinition duplicate = FunnelDefinition.builder("Events.userId", "Events.timestamp")
            .step(signUp())
            .step(signUp())
            .build();

        assertThatThrownBy(() -> engine.plan(single, registry, TestCubes.tenant(1), TestCubes.NOW))
            .isInstanceOf(InvalidFunnelException.class)
            .hasMessageContaining("at least two steps");
        assertThatThrownBy(() -> engine.plan(duplicate, registry, TestCubes.tenant(1), TestCubes.NOW))
            .isInstanceOf(InvalidFunnelException.class)
            .hasMessageContaining("used twice");
    }

    @Test
    @DisplayName("Should reject a conversion window on the first step")
    void shouldRejectWindowOnFirstStep() {
        FunnelDefinition definition = FunnelDefinition.builder("Events.userId", "Events.timestamp")
            .step(new FunnelStep("SignUp", MemberFilter.of("Events.eventType", FilterOperator.EQUALS, "signup"),
                ConversionWindow.parse("P1D")))
            .step(purchase())
            .build();

        assertThatThrownBy(() -> engine.plan(definition, registry, TestCubes.tenant(1), TestCubes.NOW))
            .isInstanceOf(FunnelStepOrderException.class);
    }

    @Test
    @DisplayName("Should reject funnels on cubes without event stream metadata")
    void shouldRejectNonEventStreamCube() {
        FunnelDefinition definition = FunnelDefinition.builder("Orders.id", "Orders.createdAt")
            .step(new FunnelStep("Placed", MemberFilter.of("Orders.status", FilterOperator.EQUALS, "placed")))
            .step(new FunnelStep("Paid", MemberFilter.of("Orders.paid", FilterOperator.EQUALS, true)))
            .build();

        assertThatThrownBy(() -> engine.plan(definition, registry, TestCubes.tenant(1), TestCubes.NOW))
            .isInstanceOf(FunnelNotSupportedException.class)
            .hasMessageContaining("Orders");
    }

    @Test
    @DisplayName("Should require the time dimension to belong to the event stream cube")
    void shouldRejectForeignTimeDimension() {
        FunnelDefinition definition = FunnelDefinition.builder("Events.userId", "Customers.createdAt")
            .step(signUp())
            .step(purchase())
            .build();

        assertThatThrownBy(() -> engine.plan(definition, registry, TestCubes.tenant(1), TestCubes.NOW))
            .isInstanceOf(InvalidFunnelException.class)
            .hasMessageContaining("Customers.createdAt");
    }

    @Test
    @DisplayName("Should reject step filters on measures")
    void shouldRejectMeasureStepFilter() {
        FunnelDefinition definition = FunnelDefinition.builder("Events.userId", "Events.timestamp")
            .step(signUp())
            .step(new FunnelStep("Busy", MemberFilter.of("Events.count", FilterOperator.GT, 10)))
            .build();

        assertThatThrownBy(() -> engine.plan(definition, registry, TestCubes.tenant(1), TestCubes.NOW))
            .isInstanceOf(InvalidFunnelException.class)
            .hasMessageContaining("only filter on dimensions");
    }

    @Test
    @DisplayName("Should require a security context")
    void shouldRequireSecurityContext() {
        assertThatThrownBy(() -> engine.plan(signUpToPurchase().build(), registry, null, TestCubes.NOW))
            .isInstanceOf(MissingSecurityContextException.class);
    }

    @Test
    @DisplayName("Should count conversions and drop entities that never entered")
    void shouldEvaluateSignUpToPurchase() {
        // Given: A converts on day 3, B purchases on day 10 (outside P7D), C never signs up
        FunnelPlan plan = engine.plan(signUpToPurchase().build(), registry, TestCubes.tenant(42), TestCubes.NOW);
        List<FunnelEvent> rows = List.of(
            FunnelEvent.of("A", day(0), 0),
            FunnelEvent.of("A", day(3), 1),
            FunnelEvent.of("B", day(0), 0),
            FunnelEvent.of("B", day(10), 1),
            FunnelEvent.of("C", day(2), 1));

        // When
        FunnelResult result = engine.evaluate(plan, rows);

        // Then
        FunnelStepResult signUp = result.getStep("SignUp");
        FunnelStepResult purchase = result.getStep("Purchase");
        assertThat(signUp.getEnteredCount()).isEqualTo(2);
        assertThat(signUp.getConvertedCount()).isEqualTo(1);
        assertThat(signUp.getConversionRate()).isCloseTo(0.5, within(1e-9));
        assertThat(purchase.getEnteredCount()).isEqualTo(1);
        assertThat(purchase.getConvertedCount()).isEqualTo(1);
        assertThat(result.getCompletedCount()).isEqualTo(1);
        assertThat(result.getOverallConversionRate()).isCloseTo(0.5, within(1e-9));
        assertThat(signUp.getTimeToConvert()).isNull();
        assertThat(purchase.getTimeToConvert()).isNull();
    }

    @Test
    @DisplayName("Should complete a funnel that repeats a step filter")
    void shouldEvaluateRepeatedStepFilter() {
        // Given: View, AddToCart, View again; each view row is emitted for steps 0 and 2
        FunnelDefinition definition = FunnelDefinition.builder("Events.userId", "Events.timestamp")
            .step(new FunnelStep("View", MemberFilter.of("Events.eventType", FilterOperator.EQUALS, "view")))
            .step(new FunnelStep("AddToCart", MemberFilter.of("Events.eventType", FilterOperator.EQUALS, "cart")))
            .step(new FunnelStep("ViewAgain", MemberFilter.of("Events.eventType", FilterOperator.EQUALS, "view")))
            .build();
        FunnelPlan plan = engine.plan(definition, registry, TestCubes.tenant(42), TestCubes.NOW);
        List<FunnelEvent> rows = List.of(
            FunnelEvent.of("u", day(0), 0),
            FunnelEvent.of("u", day(0), 2),
            FunnelEvent.of("u", day(1), 1),
            FunnelEvent.of("u", day(2), 0),
            FunnelEvent.of("u", day(2), 2));

        // When
        FunnelResult result = engine.evaluate(plan, rows);

        // Then
        assertThat(plan.getStepPredicates().get(0)).isEqualTo(plan.getStepPredicates().get(2));
        assertThat(result.getCompletedCount()).isEqualTo(1);
        assertThat(result.getStep("ViewAgain").getEnteredCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should attach time-to-convert statistics when requested")
    void shouldAttachTimeMetrics() {
        FunnelDefinition definition = signUpToPurchase().includeTimeMetrics(true).build();
        List<FunnelEvent> rows = List.of(
            FunnelEvent.of("A", day(0), 0),
            FunnelEvent.of("A", day(1), 1),
            FunnelEvent.of("B", day(0), 0),
            FunnelEvent.of("B", day(3), 1),
            FunnelEvent.of("C", day(0), 0));

        FunnelResult result = engine.evaluate(definition, rows);

        assertThat(result.getStep("SignUp").getTimeToConvert()).isNull();
        TimeToConvertStats stats = result.getStep("Purchase").getTimeToConvert();
        assertThat(stats.getSampleSize()).isEqualTo(2);
        assertThat(stats.getAverage()).isEqualTo(Duration.ofDays(2));
        assertThat(stats.getMedian()).isEqualTo(Duration.ofDays(2));
        assertThat(stats.getP90()).isEqualTo(Duration.ofDays(3));
    }

    @Test
    @DisplayName("Should report zero rates for an empty result")
    void shouldHandleNoRows() {
        FunnelResult result = engine.evaluate(signUpToPurchase().build(), List.of());

        assertThat(result.getSteps()).hasSize(2);
        assertThat(result.getStep("SignUp").getEnteredCount()).isZero();
        assertThat(result.getStep("SignUp").getConversionRate()).isZero();
        assertThat(result.getOverallConversionRate()).isZero();
    }
}
