package com.graphid.adapter.static_analysis;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Wrapper around JavaParser.
 * Parses one source file at a time; symbol resolution is not needed for ID assignment.
 */
public class JavaSourceParser {

    public static class SourceParseException extends RuntimeException {
        public SourceParseException(String message) { super(message); }
    }

    private final ParserConfiguration.LanguageLevel languageLevel;

    public JavaSourceParser() {
        this(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    public JavaSourceParser(ParserConfiguration.LanguageLevel languageLevel) {
        this.languageLevel = languageLevel;
    }

    /**
     * Parse source text. {@code displayPath} only appears in error messages.
     *
     * @throws SourceParseException if the text is not valid Java at the configured level
     */
    public CompilationUnit parse(String source, String displayPath) {
        // JavaParser instances keep per-parse state, so each call gets its own
        JavaParser parser = new JavaParser(new ParserConfiguration().setLanguageLevel(languageLevel));
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
            throw new SourceParseException("Cannot parse " + displayPath + ": " + problems);
        }
        return result.getResult().get();
    }

    /**
     * All .java files under the source root, sorted by path.
     *
     * @param include path prefixes relative to the source root; empty means everything
     */
    public List<Path> collectSourceFiles(Path sourceRoot, List<String> include) {
        if (!Files.isDirectory(sourceRoot)) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(sourceRoot)) {
            return walk
                .filter(p -> p.toString().endsWith(".java"))
                .filter(Files::isRegularFile)
                .filter(p -> isIncluded(sourceRoot.relativize(p), include))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[graphid] Warning: could not walk source tree: " + e.getMessage());
            return Collections.emptyList();
        }
    }

    private boolean isIncluded(Path relative, List<String> include) {
        if (include == null || include.isEmpty()) return true;
        String path = relative.toString().replace('\\', '/');
        for (String prefix : include) {
            if (path.startsWith(prefix)) return true;
        }
        return false;
    }
}
