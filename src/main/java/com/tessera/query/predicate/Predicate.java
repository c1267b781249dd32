package com.tessera.query.predicate;

import java.util.Set;

/**
 * A node in the abstract boolean predicate tree handed to the execution
 * collaborator. Predicates are immutable and dialect-neutral.
 */
public interface Predicate {

    /**
     * Names of the cubes whose columns this predicate reads.
     */
    Set<String> getReferencedCubes();
}
