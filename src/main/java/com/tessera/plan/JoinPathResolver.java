package com.tessera.plan;

import com.tessera.error.UnreachableCubeException;
import com.tessera.query.predicate.ColumnRef;
import com.tessera.schema.CubeDefinition;
import com.tessera.schema.CubeJoin;
import com.tessera.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the joins needed to reach every referenced cube from a primary cube.
 *
 * Joins are walked in both directions: a join declared on A towards B can
 * also be used to reach A from B. Search is breadth-first from every cube
 * already in the plan, so each additional cube is reached by the shortest
 * available path and shared prefixes are joined once.
 */
@Component
public class JoinPathResolver {

    private static final Logger log = LoggerFactory.getLogger(JoinPathResolver.class);

    /**
     * Resolve the ordered join list for a set of cubes.
     *
     * @param registry the schema registry
     * @param primaryCube the cube the plan starts from
     * @param cubes every cube the plan references (may include the primary)
     * @return joins in an order where each step's {@code fromCube} is already joined
     * @throws UnreachableCubeException if some cube cannot be reached
     */
    public List<JoinStep> resolve(SchemaRegistry registry, String primaryCube, Collection<String> cubes) {
        Set<String> joined = new LinkedHashSet<>();
        joined.add(primaryCube);
        List<JoinStep> steps = new ArrayList<>();

        for (String cube : cubes) {
            if (joined.contains(cube)) {
                continue;
            }
            List<JoinStep> path = findPath(registry, joined, cube);
            for (JoinStep step : path) {
                if (joined.add(step.getToCube())) {
                    steps.add(step);
                }
            }
        }

        if (!steps.isEmpty()) {
            log.debug("Resolved joins from '{}': {}", primaryCube, steps);
        }
        return steps;
    }

    /**
     * Shortest path from any of the given cubes to the target.
     *
     * @throws UnreachableCubeException if no path exists
     */
    public List<JoinStep> findPath(SchemaRegistry registry, Collection<String> from, String target) {
        registry.getCube(target);
        Deque<String> queue = new ArrayDeque<>(from);
        Set<String> visited = new LinkedHashSet<>(from);
        Map<String, JoinStep> reachedBy = new HashMap<>();

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target)) {
                return backtrack(reachedBy, target);
            }
            for (JoinStep edge : edges(registry, current)) {
                if (visited.add(edge.getToCube())) {
                    reachedBy.put(edge.getToCube(), edge);
                    queue.add(edge.getToCube());
                }
            }
        }
        throw new UnreachableCubeException("No join path from " + from + " to cube '" + target + "'");
    }

    private List<JoinStep> edges(SchemaRegistry registry, String cubeName) {
        List<JoinStep> edges = new ArrayList<>();
        CubeDefinition cube = registry.getCube(cubeName);
        for (CubeJoin join : cube.getJoins().values()) {
            edges.add(new JoinStep(cubeName, join.getTargetCube(), join.getRelationship(),
                ColumnRef.of(cubeName, join.getSourceColumn()),
                ColumnRef.of(join.getTargetCube(), join.getTargetColumn())));
        }
        for (CubeDefinition other : registry.getCubes()) {
            CubeJoin reverse = other.getJoins().get(cubeName);
            if (reverse != null && !other.getName().equals(cubeName)) {
                edges.add(new JoinStep(cubeName, other.getName(), reverse.getRelationship().reverse(),
                    ColumnRef.of(cubeName, reverse.getTargetColumn()),
                    ColumnRef.of(other.getName(), reverse.getSourceColumn())));
            }
        }
        return edges;
    }

    private static List<JoinStep> backtrack(Map<String, JoinStep> reachedBy, String target) {
        List<JoinStep> path = new ArrayList<>();
        JoinStep step = reachedBy.get(target);
        while (step != null) {
            path.add(0, step);
            step = reachedBy.get(step.getFromCube());
        }
        return path;
    }
}
