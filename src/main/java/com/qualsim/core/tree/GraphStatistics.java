package com.qualsim.core.tree;

/**
 * @param totalNodes      nodes in the graph, root included
 * @param depth           number of layers, root layer included
 * @param width           largest number of nodes in one layer
 * @param leafNodes       nodes without children
 * @param branchPoints    nodes with more than one child
 * @param successfulNodes nodes with status ok, root included
 * @param failedNodes     nodes with status rejected, constraint_violated or error
 * @param mergedNodes     nodes reached through more than one edge
 * @param edges           incoming edges over all nodes
 */
public record GraphStatistics(int totalNodes,
                              int depth,
                              int width,
                              int leafNodes,
                              int branchPoints,
                              int successfulNodes,
                              int failedNodes,
                              int mergedNodes,
                              int edges) {}
