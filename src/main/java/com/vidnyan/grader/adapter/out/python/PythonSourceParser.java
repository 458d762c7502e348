package com.vidnyan.grader.adapter.out.python;

import com.vidnyan.grader.adapter.out.python.syntax.PythonSyntaxTree;
import com.vidnyan.grader.application.port.out.SourceCodeParser;
import com.vidnyan.grader.application.port.out.SourceNotFoundException;
import com.vidnyan.grader.domain.statement.ParsedSource;
import com.vidnyan.grader.domain.statement.Statement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Python grammar adapter: reads a submission, parses it with tree-sitter and
 * normalizes the top-level statements into a statement forest.
 */
@Slf4j
@Component
public class PythonSourceParser implements SourceCodeParser {

    @Override
    public ParsedSource parse(Path sourcePath) {
        long startTime = System.currentTimeMillis();
        ParsedSource source = parseText(readSource(sourcePath), sourcePath);
        log.debug("Parsed {} statements from {} in {}ms",
                source.size(), sourcePath, System.currentTimeMillis() - startTime);
        return source;
    }

    @Override
    public ParsedSource parseText(String sourceText, Path origin) {
        PythonSyntaxTree tree = PythonSyntaxTree.parse(sourceText, String.valueOf(origin));
        List<Statement> statements = StatementNormalizer.normalize(tree);
        return new ParsedSource(origin, sourceText, statements);
    }

    static String readSource(Path sourcePath) {
        try {
            return Files.readString(sourcePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read submission {}: {}", sourcePath, e.getMessage());
            throw new SourceNotFoundException(sourcePath, e);
        }
    }
}
