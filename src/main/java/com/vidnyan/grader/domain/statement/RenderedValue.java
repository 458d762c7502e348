package com.vidnyan.grader.domain.statement;

public record RenderedValue(String text) implements AssignedValue {

    @Override
    public String toString() {
        return text;
    }
}
