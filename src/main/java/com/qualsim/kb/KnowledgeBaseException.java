package com.qualsim.kb;

import com.qualsim.core.error.SimulationException;

import java.util.List;

/**
 * A knowledge base that cannot be read or does not validate. Carries the offending file.
 */
public class KnowledgeBaseException extends SimulationException {

    private final String source;
    private final List<String> problems;

    public KnowledgeBaseException(String source, String problem) {
        this(source, List.of(problem));
    }

    public KnowledgeBaseException(String source, String problem, Throwable cause) {
        super(format(source, List.of(problem)), cause);
        this.source = source;
        this.problems = List.of(problem);
    }

    public KnowledgeBaseException(String source, List<String> problems) {
        super(format(source, problems));
        this.source = source;
        this.problems = List.copyOf(problems);
    }

    public String getSource() {
        return source;
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String format(String source, List<String> problems) {
        return "Invalid knowledge base (" + source + "): " + String.join("; ", problems);
    }
}
