package com.qualsim.dispatch.cli;

import com.qualsim.config.SimulationProperties;
import com.qualsim.core.model.KnowledgeBase;
import com.qualsim.kb.KnowledgeBaseException;
import com.qualsim.kb.KnowledgeBaseLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: qualsim validate --kb DIR
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Load and validate a knowledge base")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Option(names = {"--kb", "-k"}, description = "Knowledge-base file or directory (default: qualsim.kb-path)")
    private Path kbPath;

    private final KnowledgeBaseLoader loader;
    private final SimulationProperties properties;

    public ValidateCommand(KnowledgeBaseLoader loader, SimulationProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path kb = kbPath != null ? kbPath : Path.of(properties.getKbPath());
        try {
            KnowledgeBase knowledgeBase = loader.load(kb);
            ConsoleOutput.success("Knowledge base " + kb + " is valid");
            System.out.printf("  %-14s %d%n", "Spaces:", knowledgeBase.spaces().size());
            System.out.printf("  %-14s %d%n", "Object types:", knowledgeBase.objectTypes().size());
            System.out.printf("  %-14s %d%n", "Actions:", knowledgeBase.actions().size());
            return 0;
        } catch (KnowledgeBaseException e) {
            ConsoleOutput.error("Invalid knowledge base: " + e.getSource());
            for (String problem : e.getProblems()) {
                System.out.println("    - " + problem);
            }
            return 1;
        }
    }
}
