package com.tessera.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.error.InvalidDateRangeException;
import com.tessera.error.InvalidDescriptorException;
import com.tessera.error.InvalidFilterException;
import com.tessera.funnel.ConversionWindow;
import com.tessera.funnel.FunnelDefinition;
import com.tessera.funnel.FunnelStep;
import com.tessera.query.DateRangeExpression;
import com.tessera.query.Filter;
import com.tessera.query.FilterOperator;
import com.tessera.query.LogicalFilter;
import com.tessera.query.MemberFilter;
import com.tessera.query.Query;
import com.tessera.query.SortDirection;
import com.tessera.query.TimeDimension;
import com.tessera.query.TimeGranularity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps JSON request descriptors onto the typed query and funnel model.
 *
 * Structural problems (malformed JSON, wrong field types, bad order
 * directions, negative limits) raise {@link InvalidDescriptorException};
 * problems with a specific clause raise the error of that clause, for
 * example an unknown operator raises {@link InvalidFilterException}.
 */
@Component
public class DescriptorMapper {

    private final ObjectMapper objectMapper;

    public DescriptorMapper() {
        this(new ObjectMapper());
    }

    @Autowired
    public DescriptorMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Query readQuery(String json) {
        return toQuery(read(json, QueryDescriptor.class));
    }

    public Query readQuery(JsonNode json) {
        return toQuery(convert(json, QueryDescriptor.class));
    }

    /**
     * Reads a funnel request, either wrapped as {@code {"funnel": {...}}} or bare.
     */
    public FunnelDefinition readFunnel(String json) {
        JsonNode tree = read(json, JsonNode.class);
        return readFunnel(tree);
    }

    public FunnelDefinition readFunnel(JsonNode json) {
        JsonNode body = json != null && json.has("funnel") ? json.get("funnel") : json;
        return toFunnel(convert(body, FunnelDescriptor.class));
    }

    public Query toQuery(QueryDescriptor descriptor) {
        if (descriptor == null) {
            throw new InvalidDescriptorException("Query descriptor is empty");
        }
        try {
            Query.Builder builder = Query.builder()
                .measures(nonNull(descriptor.getMeasures()))
                .dimensions(nonNull(descriptor.getDimensions()));

            for (TimeDimensionDescriptor timeDimension : nonNull(descriptor.getTimeDimensions())) {
                builder.timeDimension(toTimeDimension(timeDimension));
            }
            for (FilterDescriptor filter : nonNull(descriptor.getFilters())) {
                builder.filter(toFilter(filter));
            }
            if (descriptor.getOrder() != null) {
                for (Map.Entry<String, String> entry : descriptor.getOrder().entrySet()) {
                    builder.order(entry.getKey(), SortDirection.fromValue(entry.getValue()));
                }
            }
            return builder
                .limit(descriptor.getLimit())
                .offset(descriptor.getOffset())
                .build();
        } catch (IllegalArgumentException e) {
            throw new InvalidDescriptorException("Invalid query descriptor: " + e.getMessage(), e);
        }
    }

    public FunnelDefinition toFunnel(FunnelDescriptor descriptor) {
        if (descriptor == null) {
            throw new InvalidDescriptorException("Funnel descriptor is empty");
        }
        if (descriptor.getBindingKey() == null || descriptor.getTimeDimension() == null) {
            throw new InvalidDescriptorException("Funnel descriptor needs 'bindingKey' and 'timeDimension'");
        }

        FunnelDefinition.Builder builder = FunnelDefinition.builder(
                descriptor.getBindingKey(), descriptor.getTimeDimension())
            .includeTimeMetrics(descriptor.isIncludeTimeMetrics())
            .dateRange(toDateRange(descriptor.getDateRange()));
        if (descriptor.getGlobalTimeWindow() != null) {
            builder.globalTimeWindow(ConversionWindow.parse(descriptor.getGlobalTimeWindow()));
        }

        for (FunnelStepDescriptor step : nonNull(descriptor.getSteps())) {
            if (step.getFilter() == null) {
                throw new InvalidDescriptorException("Funnel step '" + step.getName() + "' has no filter");
            }
            ConversionWindow timeToConvert = step.getTimeToConvert() != null
                ? ConversionWindow.parse(step.getTimeToConvert())
                : null;
            builder.step(new FunnelStep(step.getName(), toFilter(step.getFilter()), timeToConvert));
        }
        return builder.build();
    }

    private TimeDimension toTimeDimension(TimeDimensionDescriptor descriptor) {
        if (descriptor.getDimension() == null) {
            throw new InvalidDescriptorException("Time dimension entry needs a 'dimension'");
        }
        TimeGranularity granularity = descriptor.getGranularity() != null
            ? TimeGranularity.fromValue(descriptor.getGranularity())
            : null;
        return new TimeDimension(descriptor.getDimension(), granularity, toDateRange(descriptor.getDateRange()));
    }

    private DateRangeExpression toDateRange(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return DateRangeExpression.of(node.asText());
        }
        if (node.isArray() && node.size() == 2 && node.get(0).isTextual() && node.get(1).isTextual()) {
            return DateRangeExpression.between(node.get(0).asText(), node.get(1).asText());
        }
        throw new InvalidDateRangeException(
            "dateRange must be a string or a two-element array of date strings", node.toString());
    }

    private Filter toFilter(FilterDescriptor descriptor) {
        boolean group = descriptor.getAnd() != null || descriptor.getOr() != null;
        if (group) {
            if (descriptor.getMember() != null || (descriptor.getAnd() != null && descriptor.getOr() != null)) {
                throw new InvalidFilterException("A filter is either a member condition or a single 'and'/'or' group");
            }
            List<Filter> nested = new ArrayList<>();
            List<FilterDescriptor> children = descriptor.getAnd() != null ? descriptor.getAnd() : descriptor.getOr();
            for (FilterDescriptor child : children) {
                nested.add(toFilter(child));
            }
            return descriptor.getAnd() != null ? LogicalFilter.and(nested) : LogicalFilter.or(nested);
        }

        if (descriptor.getMember() == null) {
            throw new InvalidFilterException("Filter needs a 'member'");
        }
        if (descriptor.getOperator() == null) {
            throw new InvalidFilterException("Filter needs an 'operator'", descriptor.getMember());
        }
        return new MemberFilter(descriptor.getMember(), FilterOperator.fromValue(descriptor.getOperator()),
            descriptor.getValues(), toDateRange(descriptor.getDateRange()));
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null || json.trim().isEmpty()) {
            throw new InvalidDescriptorException("Request body is empty");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new InvalidDescriptorException("Malformed request: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T convert(JsonNode json, Class<T> type) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(json, type);
        } catch (JsonProcessingException e) {
            throw new InvalidDescriptorException("Malformed request: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? list : List.of();
    }
}
