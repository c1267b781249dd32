package com.tessera.query;

import com.tessera.error.DuplicateMemberException;
import com.tessera.error.EmptyQueryException;
import com.tessera.error.InvalidMemberUsageException;
import com.tessera.error.UnknownMemberException;
import com.tessera.query.time.DateRangeResolver;
import com.tessera.query.time.ResolvedDateRange;
import com.tessera.schema.Dimension;
import com.tessera.schema.Measure;
import com.tessera.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates a query against the schema registry and produces its canonical
 * {@link NormalizedQuery}.
 *
 * Every time-dimension date range is resolved here; a range that does not
 * parse fails the whole query. Date ranges on filters are resolved by the
 * planner against the same {@code resolvedAt} instant.
 */
@Component
public class QueryNormalizer {

    private static final Logger log = LoggerFactory.getLogger(QueryNormalizer.class);

    private final DateRangeResolver dateRangeResolver;

    public QueryNormalizer(DateRangeResolver dateRangeResolver) {
        this.dateRangeResolver = dateRangeResolver;
    }

    /**
     * Normalize a query.
     *
     * @param query the caller's query
     * @param registry the sealed schema registry
     * @param now reference instant for relative date ranges
     * @return the canonical query
     * @throws EmptyQueryException if the query has no measures and no dimensions
     * @throws UnknownMemberException if any member is not registered
     * @throws DuplicateMemberException if a measure or dimension is listed twice
     * @throws InvalidMemberUsageException if a time dimension is not of time type
     *         or an order key is not selected
     * @throws com.tessera.error.InvalidDateRangeException if a date range does not resolve
     */
    public NormalizedQuery normalize(Query query, SchemaRegistry registry, Instant now) {
        if (query.getMeasures().isEmpty() && query.getDimensions().isEmpty()) {
            throw new EmptyQueryException("Query must request at least one measure or dimension");
        }

        List<Measure> measures = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String reference : query.getMeasures()) {
            requireUnique(seen, reference, "measure");
            measures.add(registry.getMeasure(reference));
        }

        List<Dimension> dimensions = new ArrayList<>();
        seen.clear();
        for (String reference : query.getDimensions()) {
            requireUnique(seen, reference, "dimension");
            dimensions.add(registry.getDimension(reference));
        }

        List<ResolvedTimeDimension> timeDimensions = new ArrayList<>();
        seen.clear();
        for (TimeDimension timeDimension : query.getTimeDimensions()) {
            String key = timeDimension.getDimension() + "|" + timeDimension.getGranularity();
            requireUnique(seen, key, "time dimension", timeDimension.getDimension());
            timeDimensions.add(resolveTimeDimension(timeDimension, registry, now));
        }

        for (Filter filter : query.getFilters()) {
            for (String member : filter.getMembers()) {
                registry.getMember(member);
            }
        }
        Set<String> selected = new HashSet<>();
        measures.forEach(m -> selected.add(m.getFullName()));
        dimensions.forEach(d -> selected.add(d.getFullName()));
        timeDimensions.stream()
            .filter(t -> t.getGranularity() != null)
            .forEach(t -> selected.add(t.getDimension().getFullName()));
        for (String member : query.getOrder().keySet()) {
            String fullName = registry.getMember(member).getFullName();
            if (!selected.contains(fullName)) {
                throw new InvalidMemberUsageException("Cannot order by a member that is not selected in the query",
                    member);
            }
        }

        NormalizedQuery normalized = new NormalizedQuery(measures, dimensions, timeDimensions,
            query.getFilters(), query.getOrder(), query.getLimit(), query.getOffset(), now);
        log.debug("Normalized query with {} measure(s), {} dimension(s), time dimensions {}",
            measures.size(), dimensions.size(), timeDimensions);
        return normalized;
    }

    private ResolvedTimeDimension resolveTimeDimension(TimeDimension timeDimension, SchemaRegistry registry,
                                                       Instant now) {
        Dimension dimension = registry.getDimension(timeDimension.getDimension());
        if (!dimension.isTime()) {
            throw new InvalidMemberUsageException("Member is not a time dimension", dimension.getFullName());
        }
        ResolvedDateRange range = null;
        if (timeDimension.getDateRange() != null) {
            range = dateRangeResolver.resolve(timeDimension.getDateRange(), now, timeDimension.getGranularity());
        }
        return new ResolvedTimeDimension(dimension, timeDimension.getGranularity(), range);
    }

    private static void requireUnique(Set<String> seen, String reference, String kind) {
        requireUnique(seen, reference, kind, reference);
    }

    private static void requireUnique(Set<String> seen, String key, String kind, String member) {
        if (!seen.add(key)) {
            throw new DuplicateMemberException("Duplicate " + kind + " in query", member);
        }
    }
}
