package com.vidnyan.grader.domain.verification;

import com.vidnyan.grader.domain.statement.ParsedSource;
import com.vidnyan.grader.domain.statement.Statement;
import com.vidnyan.grader.domain.variable.VariableTable;

import java.util.List;
import java.util.function.Supplier;

/**
 * Everything a step may read during one run. The resolved variable table is
 * computed on first use only.
 */
public final class VerificationContext {

    private final ParsedSource source;
    private final UserVariableTable userVariables;
    private final Supplier<VariableTable> resolver;
    private VariableTable resolved;

    public VerificationContext(ParsedSource source, UserVariableTable userVariables,
                               Supplier<VariableTable> resolver) {
        this.source = source;
        this.userVariables = userVariables;
        this.resolver = resolver;
    }

    public ParsedSource source() {
        return source;
    }

    public List<Statement> statements() {
        return source.statements();
    }

    public UserVariableTable userVariables() {
        return userVariables;
    }

    public VariableTable variables() {
        if (resolved == null) {
            resolved = resolver.get();
        }
        return resolved;
    }
}
