package com.pale.script.parser;

import java.util.List;
import java.util.Optional;

/**
 * Anything that can sit in operator position.
 *
 * Arguments arrive unresolved: an implementation decides which of them to
 * force with {@link Var#resolve()}.
 */
@FunctionalInterface
public interface Callable {

    Var call(List<Var> args, Location calledAt);

    /** An independent copy, or empty when this callable cannot be copied. */
    default Optional<Callable> tryClone() {
        return Optional.empty();
    }
}
