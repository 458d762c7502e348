package com.vidnyan.grader.domain.verification;

import com.vidnyan.grader.domain.query.SearchScope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exercise author's expectation for one function call.
 * Arguments are compared as canonical rendered text, e.g. {@code 'data.csv'} or {@code x + 1}.
 */
public record FunctionCallSpec(
    String functionName,
    List<String> expectedArgs,
    Map<String, String> expectedKwargs,
    Integer expectedVariableCount,
    boolean allowAssignment,
    int maxCalls,
    SearchScope scope
) {

    public FunctionCallSpec {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("functionName must not be blank");
        }
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be >= 1: " + maxCalls);
        }
        expectedArgs = expectedArgs != null ? List.copyOf(expectedArgs) : List.of();
        expectedKwargs = expectedKwargs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(expectedKwargs))
                : Map.of();
        scope = scope != null ? scope : SearchScope.TOP_LEVEL;
    }

    public boolean expectsVariables() {
        return expectedVariableCount != null;
    }

    public static Builder builder(String functionName) {
        return new Builder(functionName);
    }

    public static class Builder {
        private final String functionName;
        private List<String> expectedArgs = List.of();
        private Map<String, String> expectedKwargs = Map.of();
        private Integer expectedVariableCount;
        private boolean allowAssignment = true;
        private int maxCalls = 1;
        private SearchScope scope = SearchScope.TOP_LEVEL;

        private Builder(String functionName) {
            this.functionName = functionName;
        }

        public Builder args(String... args) { this.expectedArgs = List.of(args); return this; }
        public Builder args(List<String> args) { this.expectedArgs = args; return this; }
        public Builder kwargs(Map<String, String> kwargs) { this.expectedKwargs = kwargs; return this; }
        public Builder variableCount(Integer count) { this.expectedVariableCount = count; return this; }
        public Builder allowAssignment(boolean allow) { this.allowAssignment = allow; return this; }
        public Builder maxCalls(int max) { this.maxCalls = max; return this; }
        public Builder scope(SearchScope scope) { this.scope = scope; return this; }

        public FunctionCallSpec build() {
            return new FunctionCallSpec(functionName, expectedArgs, expectedKwargs,
                    expectedVariableCount, allowAssignment, maxCalls, scope);
        }
    }
}
