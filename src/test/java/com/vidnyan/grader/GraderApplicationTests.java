package com.vidnyan.grader;

import com.vidnyan.grader.adapter.in.cli.VerificationCliRunner;
import com.vidnyan.grader.application.port.in.VerifySubmissionUseCase;
import com.vidnyan.grader.application.port.out.ExerciseRepository;
import com.vidnyan.grader.domain.step.StepListener;
import com.vidnyan.grader.domain.step.SuccessArtifactSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class GraderApplicationTests {

    @Autowired
    ApplicationContext context;

    @Autowired
    GraderProperties properties;

    @Test
    void contextLoads_WithEveryPortWired() {
        assertNotNull(context.getBean(VerifySubmissionUseCase.class));
        assertNotNull(context.getBean(ExerciseRepository.class));
        assertNotNull(context.getBean(StepListener.class));
        assertNotNull(context.getBean(SuccessArtifactSource.class));
        assertNotNull(context.getBean(VerificationCliRunner.class));
    }

    @Test
    void properties_ShouldBindTestOverrides() {
        assertFalse(properties.isExitOnCompletion());
        assertFalse(properties.isColorOutput());
        assertEquals("/flag", properties.getSuccessArtifactPath());
        assertTrue(properties.getSubmissionPath().isBlank());
    }
}
