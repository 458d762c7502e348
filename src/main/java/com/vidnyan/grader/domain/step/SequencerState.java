package com.vidnyan.grader.domain.step;

public enum SequencerState {
    NOT_STARTED,
    RUNNING,
    PASSED,
    FAILED
}
