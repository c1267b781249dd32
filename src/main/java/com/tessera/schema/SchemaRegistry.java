package com.tessera.schema;

import com.tessera.error.SchemaDefinitionException;
import com.tessera.error.UnknownMemberException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Sealed registry of cube definitions.
 *
 * A registry is assembled once through {@link Builder} and is immutable from
 * then on: there is no way to register a cube into an existing registry, so
 * compilations running in parallel only ever read it. The registry is passed
 * explicitly to the compiler components; it is never looked up globally.
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, CubeDefinition> cubes;

    private SchemaRegistry(Map<String, CubeDefinition> cubes) {
        this.cubes = Collections.unmodifiableMap(new LinkedHashMap<>(cubes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<CubeDefinition> getCubes() {
        return cubes.values();
    }

    public Optional<CubeDefinition> findCube(String name) {
        return Optional.ofNullable(cubes.get(name));
    }

    /**
     * Gets a cube by name.
     *
     * @throws UnknownMemberException if no such cube is registered
     */
    public CubeDefinition getCube(String name) {
        CubeDefinition cube = cubes.get(name);
        if (cube == null) {
            throw new UnknownMemberException("Cube '" + name + "' is not registered", name);
        }
        return cube;
    }

    public Optional<Measure> findMeasure(String reference) {
        MemberReference ref = MemberReference.parse(reference);
        return findCube(ref.getCubeName()).flatMap(cube -> cube.findMeasure(ref.getMemberName()));
    }

    public Optional<Dimension> findDimension(String reference) {
        MemberReference ref = MemberReference.parse(reference);
        return findCube(ref.getCubeName()).flatMap(cube -> cube.findDimension(ref.getMemberName()));
    }

    /**
     * Resolves a qualified reference to a measure.
     *
     * @throws UnknownMemberException if the reference names no registered measure
     */
    public Measure getMeasure(String reference) {
        return findMeasure(reference).orElseThrow(() ->
            new UnknownMemberException("Unknown measure", reference));
    }

    /**
     * Resolves a qualified reference to a dimension.
     *
     * @throws UnknownMemberException if the reference names no registered dimension
     */
    public Dimension getDimension(String reference) {
        return findDimension(reference).orElseThrow(() ->
            new UnknownMemberException("Unknown dimension", reference));
    }

    /**
     * Resolves a qualified reference to either kind of member.
     *
     * @throws UnknownMemberException if the reference names no registered member
     */
    public CubeMember getMember(String reference) {
        Optional<Measure> measure = findMeasure(reference);
        if (measure.isPresent()) {
            return measure.get();
        }
        return findDimension(reference).orElseThrow(() ->
            new UnknownMemberException("Unknown member", reference));
    }

    public int size() {
        return cubes.size();
    }

    /**
     * Single-use builder; {@link #build()} seals the registry.
     */
    public static final class Builder {
        private final Map<String, CubeDefinition> cubes = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        public Builder register(CubeDefinition cube) {
            if (built) {
                throw new IllegalStateException("Schema registry has already been built");
            }
            if (cubes.containsKey(cube.getName())) {
                throw new SchemaDefinitionException("Cube '" + cube.getName() + "' is registered twice");
            }
            cubes.put(cube.getName(), cube);
            return this;
        }

        public Builder registerAll(Iterable<CubeDefinition> definitions) {
            for (CubeDefinition cube : definitions) {
                register(cube);
            }
            return this;
        }

        public SchemaRegistry build() {
            if (built) {
                throw new IllegalStateException("Schema registry has already been built");
            }
            for (CubeDefinition cube : cubes.values()) {
                for (CubeJoin join : cube.getJoins().values()) {
                    if (!cubes.containsKey(join.getTargetCube())) {
                        throw new SchemaDefinitionException(
                            "Cube '" + cube.getName() + "' joins unknown cube '" + join.getTargetCube() + "'");
                    }
                }
                if (cube.getTenantFilter() == null) {
                    log.warn("Cube '{}' declares no tenant filter and cannot be used in compiled plans",
                        cube.getName());
                }
            }
            built = true;
            log.info("Schema registry sealed with {} cube(s): {}", cubes.size(), cubes.keySet());
            return new SchemaRegistry(cubes);
        }
    }
}
