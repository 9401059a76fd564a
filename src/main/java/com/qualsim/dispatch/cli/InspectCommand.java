package com.qualsim.dispatch.cli;

import com.qualsim.config.SimulationProperties;
import com.qualsim.history.EdgeRecord;
import com.qualsim.history.HistoryReader;
import com.qualsim.history.NodeRecord;
import com.qualsim.history.SimulationHistory;
import com.qualsim.history.ValueRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: qualsim inspect FILE [--node ID]
 * <p>
 * Reads a history file and lists its nodes, or shows one node's full reconstructed state.
 * A relative path missing from the working directory is looked up under {@code qualsim.history-dir}.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a simulation history file")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "History file (.json, .yaml or .yml)")
    private Path file;

    @Option(names = {"--node", "-n"}, description = "Show the full state of this node")
    private String nodeId;

    private final HistoryReader historyReader;
    private final SimulationProperties properties;

    public InspectCommand(HistoryReader historyReader, SimulationProperties properties) {
        this.historyReader = historyReader;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path source = locate(file);
        SimulationHistory history;
        try {
            history = historyReader.read(source);
        } catch (UncheckedIOException e) {
            ConsoleOutput.error("Cannot read " + source + ": " + e.getCause().getMessage());
            return 1;
        }

        if (nodeId != null) {
            Map<String, ValueRecord> state = historyReader.reconstruct(history).get(nodeId);
            if (state == null) {
                ConsoleOutput.error("Node " + nodeId + " not found in " + history.simulationId());
                return 1;
            }
            System.out.println("NODE " + nodeId);
            System.out.println("──────────────────────────────────");
            state.forEach((path, value) -> System.out.printf("  %-24s %s%s%n", path, render(value),
                    value.trend() == null || "none".equals(value.trend().id()) ? "" : " (" + value.trend().id() + ")"));
            return 0;
        }

        ConsoleOutput.info("Simulation " + history.simulationId() + " on " + history.objectType()
                + ": " + String.join(" -> ", history.actions()));
        if (history.haltReason() != null) {
            ConsoleOutput.warn("Halted: " + history.haltReason());
        }
        System.out.println();
        System.out.printf("  %-10s %-6s %-20s %-12s %s%n", "NODE", "LAYER", "STATUS", "PARENTS", "BRANCH");
        System.out.println("  " + "-".repeat(76));
        System.out.printf("  %-10s %-6d %-20s %-12s %s%n", history.rootId(), 0, "ok", "-", "-");
        for (NodeRecord node : history.nodes()) {
            EdgeRecord primary = node.edges().isEmpty() ? null : node.edges().get(0);
            String branch = primary == null || primary.branchConditions().isEmpty()
                    ? "-" : primary.branchConditions().get(primary.branchConditions().size() - 1).describe();
            System.out.printf("  %-10s %-6d %-20s %-12s %s%n", node.id(), node.layer(), node.status().id(),
                    String.join(",", node.parentIds()), branch);
        }
        if (history.statistics() != null) {
            ConsoleOutput.statistics(history.statistics());
        }
        return 0;
    }

    private Path locate(Path path) {
        if (path.isAbsolute() || Files.exists(path)) {
            return path;
        }
        Path underHistoryDir = Path.of(properties.getHistoryDir()).resolve(path);
        return Files.exists(underHistoryDir) ? underHistoryDir : path;
    }

    private static String render(ValueRecord value) {
        return value.levels().size() == 1 ? value.levels().get(0) : "{" + String.join(", ", value.levels()) + "}";
    }
}
