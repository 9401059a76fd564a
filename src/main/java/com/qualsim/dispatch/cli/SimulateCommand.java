package com.qualsim.dispatch.cli;

import com.qualsim.config.SimulationProperties;
import com.qualsim.core.error.SimulationException;
import com.qualsim.core.events.EventBus;
import com.qualsim.core.events.SimulationEvent;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.KnowledgeBase;
import com.qualsim.core.tree.ActionRequest;
import com.qualsim.core.tree.IncomingEdge;
import com.qualsim.core.tree.SimulationGraph;
import com.qualsim.core.tree.SimulationRequest;
import com.qualsim.core.tree.SimulationRunner;
import com.qualsim.core.tree.TreeNode;
import com.qualsim.history.HistoryWriter;
import com.qualsim.kb.KnowledgeBaseLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: qualsim simulate --object TYPE --action NAME[:k=v,...] ...
 * <p>
 * Loads the knowledge base, runs the action sequence and prints the resulting graph.
 * A relative {@code --out} path is placed under {@code qualsim.history-dir}.
 * Exits with 1 when loading fails or the run halts.
 */
@Command(name = "simulate", mixinStandardHelpOptions = true, description = "Run an action sequence")
@Component
public class SimulateCommand implements Callable<Integer> {

    @Option(names = {"--kb", "-k"}, description = "Knowledge-base file or directory (default: qualsim.kb-path)")
    private Path kbPath;

    @Option(names = {"--object", "-o"}, required = true, description = "Object type to simulate")
    private String objectType;

    @Option(names = {"--action", "-a"}, required = true,
            description = "Action to apply, NAME or NAME:key=value,...; repeat for a sequence")
    private List<String> actions = new ArrayList<>();

    @Option(names = {"--set", "-s"}, description = "Initial value, path=level or path=level1,level2 or path=unknown")
    private List<String> initialValues = new ArrayList<>();

    @Option(names = "--out", description = "Write the history to this file (.json, .yaml or .yml); "
            + "relative paths are resolved against qualsim.history-dir")
    private Path out;

    @Option(names = {"--verbose", "-v"}, description = "Print layer progress and the change log of every node")
    private boolean verbose;

    private final KnowledgeBaseLoader loader;
    private final SimulationRunner runner;
    private final HistoryWriter historyWriter;
    private final EventBus eventBus;
    private final SimulationProperties properties;

    public SimulateCommand(KnowledgeBaseLoader loader, SimulationRunner runner, HistoryWriter historyWriter,
                           EventBus eventBus, SimulationProperties properties) {
        this.loader = loader;
        this.runner = runner;
        this.historyWriter = historyWriter;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String simulationId = SimulationRunner.newSimulationId();
        EventBus.Subscription progress = verbose
                ? eventBus.subscribe(simulationId, EnumSet.of(SimulationEvent.Type.LAYER_COMPLETED,
                        SimulationEvent.Type.NODE_MERGED, SimulationEvent.Type.SIMULATION_HALTED),
                        ConsoleOutput::progress)
                : null;
        SimulationGraph graph;
        try {
            Path kb = kbPath != null ? kbPath : Path.of(properties.getKbPath());
            KnowledgeBase knowledgeBase = loader.load(kb);
            List<ActionRequest> steps = actions.stream().map(ActionRequest::parse).toList();
            ConsoleOutput.info("Simulating " + objectType + " through " + steps.size() + " action(s)");
            graph = runner.run(knowledgeBase,
                    new SimulationRequest(simulationId, objectType, steps, parseInitialValues()));
        } catch (SimulationException | IllegalArgumentException e) {
            ConsoleOutput.error("Simulation failed: " + e.getMessage());
            return 1;
        } finally {
            if (progress != null) {
                progress.unsubscribe();
            }
        }

        System.out.println();
        for (TreeNode node : graph.nodes()) {
            ConsoleOutput.node(node.id(), node.layer(), node.status(), String.join(",", node.parentIds()),
                    node.actionName(), node.branchCondition());
            if (verbose) {
                System.out.println("      " + node.snapshot());
                if (node.isMerged()) {
                    for (IncomingEdge edge : node.incomingEdges()) {
                        ConsoleOutput.edge(edge);
                        edge.changes().forEach(ConsoleOutput::change);
                    }
                } else {
                    node.changes().forEach(ConsoleOutput::change);
                }
                if (node.error() != null) {
                    ConsoleOutput.error(node.error());
                }
            }
        }
        ConsoleOutput.statistics(graph.statistics());

        if (out != null) {
            Path target = historyFile(out);
            historyWriter.write(graph, target);
            ConsoleOutput.success("History written to " + target);
        }
        if (graph.isHalted()) {
            ConsoleOutput.warn("Halted: " + graph.haltReason().orElse("unknown reason"));
            return 1;
        }
        ConsoleOutput.success("Simulation " + graph.simulationId() + " completed");
        return 0;
    }

    private Path historyFile(Path file) {
        return file.isAbsolute() ? file : Path.of(properties.getHistoryDir()).resolve(file);
    }

    private Map<AttributePath, List<String>> parseInitialValues() {
        Map<AttributePath, List<String>> result = new LinkedHashMap<>();
        for (String assignment : initialValues) {
            int eq = assignment.indexOf('=');
            if (eq <= 0 || eq == assignment.length() - 1) {
                throw new IllegalArgumentException("Expected path=value, got '" + assignment + "'");
            }
            List<String> levels = Arrays.stream(assignment.substring(eq + 1).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
            result.put(AttributePath.parse(assignment.substring(0, eq)), levels);
        }
        return result;
    }
}
