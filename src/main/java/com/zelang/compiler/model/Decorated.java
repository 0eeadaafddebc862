package com.zelang.compiler.model;

import java.util.List;
import java.util.Optional;

/**
 * Shared lookups for nodes that carry decorators.
 */
public interface Decorated {

    List<Decorator> getDecorators();

    default boolean hasDecorator(String name) {
        return findDecorator(name).isPresent();
    }

    default Optional<Decorator> findDecorator(String name) {
        return getDecorators().stream()
                .filter(d -> d.getName().equals(name))
                .findFirst();
    }
}
