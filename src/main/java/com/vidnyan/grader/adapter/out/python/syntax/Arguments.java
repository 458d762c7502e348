package com.vidnyan.grader.adapter.out.python.syntax;

import java.util.List;

/**
 * Parameter list of a {@code def} or {@code lambda}.
 */
public record Arguments(
    List<Param> posonlyargs,
    List<Param> args,
    Param vararg,
    List<Param> kwonlyargs,
    Param kwarg
) {

    public static final Arguments EMPTY = new Arguments(List.of(), List.of(), null, List.of(), null);

    public Arguments {
        posonlyargs = List.copyOf(posonlyargs);
        args = List.copyOf(args);
        kwonlyargs = List.copyOf(kwonlyargs);
    }

    public boolean isEmpty() {
        return posonlyargs.isEmpty() && args.isEmpty() && vararg == null && kwonlyargs.isEmpty() && kwarg == null;
    }

    /**
     * A parameter; {@code annotation} and {@code defaultValue} may be null.
     */
    public record Param(String name, PyExpr annotation, PyExpr defaultValue) {
    }
}
