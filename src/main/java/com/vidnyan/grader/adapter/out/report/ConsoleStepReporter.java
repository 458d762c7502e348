package com.vidnyan.grader.adapter.out.report;

import com.vidnyan.grader.domain.step.StepListener;
import lombok.RequiredArgsConstructor;

import java.io.PrintStream;

/**
 * Learner-facing output: one line per executed step, the diagnostic of a
 * failing step, and the success banner with the released artifact.
 */
@RequiredArgsConstructor
public class ConsoleStepReporter implements StepListener {

    static final String SUCCESS_BANNER = "Congratulations! You have passed this challenge! Here is your flag:";

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    private final PrintStream out;
    private final boolean colorOutput;

    @Override
    public void stepPassed(String label) {
        out.println(colored(label + " Passed", GREEN));
    }

    @Override
    public void stepFailed(String label, String message) {
        out.println(colored(label + " Failed", RED));
        out.println(message);
    }

    @Override
    public void completed(String artifact) {
        out.println(SUCCESS_BANNER);
        out.println(artifact);
    }

    private String colored(String text, String color) {
        return colorOutput ? color + text + RESET : text;
    }
}
