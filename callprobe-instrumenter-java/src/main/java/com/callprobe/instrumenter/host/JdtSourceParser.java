package com.callprobe.instrumenter.host;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wrapper around Eclipse JDT's ASTParser.
 * Parses one Java source file at Java 17 compliance, without binding resolution.
 */
public class JdtSourceParser {

    public static class SourceParseException extends RuntimeException {
        public SourceParseException(String message) { super(message); }
        public SourceParseException(String message, Throwable cause) { super(message, cause); }
    }

    /** A parsed unit together with the text it was parsed from. */
    public record ParsedUnit(String unitName, String source, CompilationUnit unit) {}

    public ParsedUnit parse(Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException("Could not read source file: " + file, e);
        }
        return parse(file.getFileName().toString(), source);
    }

    /**
     * @throws SourceParseException if the source has syntax errors
     */
    public ParsedUnit parse(String unitName, String source) {
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(false);

        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        parser.setCompilerOptions(options);

        parser.setUnitName(unitName);
        parser.setSource(source.toCharArray());
        CompilationUnit unit = (CompilationUnit) parser.createAST(null);

        List<String> errors = new ArrayList<>();
        for (IProblem problem : unit.getProblems()) {
            if (problem.isError()) {
                errors.add("line " + problem.getSourceLineNumber() + ": " + problem.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new SourceParseException("Syntax errors in " + unitName + ": " + String.join("; ", errors));
        }
        return new ParsedUnit(unitName, source, unit);
    }
}
