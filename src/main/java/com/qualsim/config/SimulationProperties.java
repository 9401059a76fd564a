package com.qualsim.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "qualsim")
public class SimulationProperties {

    private String kbPath = "kb";
    private String historyDir = "history";
    private Engine engine = new Engine();

    // -- Engine accessors (delegate to nested) --
    public int getParallelism() { return engine.parallelism; }
    public int getMaxNodes() { return engine.maxNodes; }

    public String getKbPath() { return kbPath; }
    public void setKbPath(String kbPath) { this.kbPath = kbPath; }
    public String getHistoryDir() { return historyDir; }
    public void setHistoryDir(String historyDir) { this.historyDir = historyDir; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }

    public static class Engine {
        /** Worker threads used to expand the leaves of one layer; 1 expands inline. */
        private int parallelism = 1;
        /** Run halts once the graph holds more nodes than this. */
        private int maxNodes = 10000;

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
        public int getMaxNodes() { return maxNodes; }
        public void setMaxNodes(int maxNodes) { this.maxNodes = maxNodes; }
    }
}
