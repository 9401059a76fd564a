package com.qualsim.dispatch.cli;

import com.qualsim.core.branching.BranchCondition;
import com.qualsim.core.effect.Change;
import com.qualsim.core.engine.NodeStatus;
import com.qualsim.core.events.SimulationEvent;
import com.qualsim.core.tree.GraphStatistics;
import com.qualsim.core.tree.IncomingEdge;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Qualsim CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) QUALSIM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [QUALSIM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void node(String id, int layer, NodeStatus status, String parents, String action,
                            BranchCondition condition) {
        String branch = condition == null ? "" : "  [" + condition.describe() + "]";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + id + "|@ L" + layer + " " + status(status)
                        + (parents.isEmpty() ? "" : " <- " + parents + " " + action) + branch));
    }

    public static void change(Change change) {
        System.out.println("      " + change.attribute() + ": " + change.before() + " -> " + change.after()
                + " (" + change.kind().id() + ")");
    }

    public static void edge(IncomingEdge edge) {
        String branch = edge.branchCondition() == null ? "" : " [" + edge.branchCondition().describe() + "]";
        System.out.println("      via " + edge.parentId() + " " + edge.action() + branch);
    }

    public static void progress(SimulationEvent event) {
        String line = switch (event.type()) {
            case LAYER_COMPLETED -> "layer " + event.get("layer") + " (" + event.get("action") + "): "
                    + event.get("created") + " new, " + event.get("merged") + " merged";
            case NODE_MERGED -> event.nodeId() + " merged from " + event.get("parentId");
            case SIMULATION_HALTED -> "halting: " + event.get("reason");
            default -> event.toString();
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|faint ~|@ " + line));
    }

    public static void statistics(GraphStatistics stats) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Simulation Statistics|@"));
        System.out.println("  Nodes:         " + stats.totalNodes()
                + " (" + stats.leafNodes() + " leaves, " + stats.mergedNodes() + " merged)");
        System.out.println("  Depth / Width: " + stats.depth() + " / " + stats.width());
        System.out.println("  Branch points: " + stats.branchPoints());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Outcomes:      @|fg(green) " + stats.successfulNodes() + " ok|@, @|fg(red) "
                        + stats.failedNodes() + " failed|@"));
        System.out.println("  Edges:         " + stats.edges());
    }

    private static String status(NodeStatus status) {
        return switch (status) {
            case OK -> "@|fg(green) ok|@";
            case REJECTED -> "@|fg(yellow) rejected|@";
            case CONSTRAINT_VIOLATED -> "@|fg(magenta) constraint_violated|@";
            case ERROR -> "@|fg(red),bold error|@";
        };
    }
}
