package com.vidnyan.grader.adapter.out.report;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleStepReporterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    @Test
    void plainOutput_ShouldPrintOneLinePerStep() {
        ConsoleStepReporter reporter = new ConsoleStepReporter(out, false);

        reporter.stepPassed("Step 1");
        reporter.stepFailed("Step 2", "fit() is not called in Step 2.");

        assertEquals("Step 1 Passed\nStep 2 Failed\nfit() is not called in Step 2.\n", output());
    }

    @Test
    void coloredOutput_ShouldWrapStepLinesOnly() {
        ConsoleStepReporter reporter = new ConsoleStepReporter(out, true);

        reporter.stepPassed("Step 1");
        reporter.stepFailed("Step 2", "oops");

        assertEquals("\u001B[32mStep 1 Passed\u001B[0m\n\u001B[31mStep 2 Failed\u001B[0m\noops\n", output());
    }

    @Test
    void completed_ShouldPrintBannerAndArtifact() {
        new ConsoleStepReporter(out, true).completed("flag{ok}");

        assertEquals(ConsoleStepReporter.SUCCESS_BANNER + "\nflag{ok}\n", output());
    }
}
