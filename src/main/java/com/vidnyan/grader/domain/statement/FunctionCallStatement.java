package com.vidnyan.grader.domain.statement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A call expression: rendered callee, rendered positional arguments and
 * keyword arguments in source order. A {@code **mapping} argument is stored
 * under the key {@link #DOUBLE_STAR_KEY}.
 */
public record FunctionCallStatement(
    String function,
    List<String> args,
    Map<String, String> kwargs
) implements Statement, AssignedValue {

    public static final String DOUBLE_STAR_KEY = "**";

    public FunctionCallStatement {
        args = List.copyOf(args);
        kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public boolean hasKeywordArguments() {
        return !kwargs.isEmpty();
    }
}
