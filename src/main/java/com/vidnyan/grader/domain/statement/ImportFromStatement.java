package com.vidnyan.grader.domain.statement;

import java.util.List;

/**
 * {@code from module import a, b}. Level 0 is an absolute import, each leading
 * dot adds one level. Module is empty for {@code from . import x}.
 */
public record ImportFromStatement(
    String module,
    List<String> names,
    String alias,
    int level
) implements Statement {

    public ImportFromStatement {
        module = module != null ? module : "";
        names = List.copyOf(names);
        if (level < 0) {
            throw new IllegalArgumentException("level must be >= 0: " + level);
        }
    }

    public boolean isRelative() {
        return level > 0;
    }
}
