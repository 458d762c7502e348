package com.vidnyan.grader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Grader - static verification of Python exercise submissions.
 */
@SpringBootApplication
public class GraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraderApplication.class, args);
    }
}
