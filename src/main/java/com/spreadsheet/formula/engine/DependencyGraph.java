package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph from a formula cell to the cells it reads.
 * Built from scratch for every recalculation pass; insertion order is kept
 * so the resulting order is deterministic for a given sheet.
 */
public class DependencyGraph {

    // Forward adjacency: "reader" -> cells it reads
    private final Map<CellAddress, Set<CellAddress>> edges = new LinkedHashMap<>();

    public void addNode(CellAddress node) {
        edges.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    /**
     * Records that the formula in 'from' reads 'to'.
     */
    public void addEdge(CellAddress from, CellAddress to) {
        edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        edges.computeIfAbsent(to, k -> new LinkedHashSet<>());
    }

    public Set<CellAddress> dependenciesOf(CellAddress node) {
        return Collections.unmodifiableSet(edges.getOrDefault(node, Collections.emptySet()));
    }

    public boolean contains(CellAddress node) {
        return edges.containsKey(node);
    }

    public int size() {
        return edges.size();
    }

    /**
     * Nodes ordered so that each one comes after everything it depends on.
     * Depth-first from every node, tracking the nodes on the current path
     * ("visiting") and the finished ones ("done"); the finishing order is the
     * result. Reaching a node that is still on the path means a cycle, and no
     * order is returned at all.
     */
    public List<CellAddress> topologicalOrder() {
        Set<CellAddress> visiting = new HashSet<>();
        Set<CellAddress> done = new HashSet<>();
        List<CellAddress> order = new ArrayList<>(edges.size());

        for (CellAddress start : edges.keySet()) {
            if (done.contains(start)) {
                continue;
            }
            // Explicit stack so long reference chains cannot overflow the call stack
            Deque<Frame> path = new ArrayDeque<>();
            visiting.add(start);
            path.push(new Frame(start, edges.get(start).iterator()));

            while (!path.isEmpty()) {
                Frame top = path.peek();
                if (top.pending.hasNext()) {
                    CellAddress dep = top.pending.next();
                    if (done.contains(dep)) {
                        continue;
                    }
                    if (visiting.contains(dep)) {
                        throw new CircularReferenceException(dep.toText());
                    }
                    visiting.add(dep);
                    path.push(new Frame(dep, edges.getOrDefault(dep, Collections.emptySet()).iterator()));
                } else {
                    path.pop();
                    visiting.remove(top.node);
                    done.add(top.node);
                    order.add(top.node);
                }
            }
        }
        return order;
    }

    /**
     * Forward adjacency as text: "A3" -> ["A1", "A2"].
     */
    public Map<String, Set<String>> getEdges() {
        Map<String, Set<String>> view = new LinkedHashMap<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : edges.entrySet()) {
            Set<String> targets = view.computeIfAbsent(entry.getKey().toText(), k -> new LinkedHashSet<>());
            for (CellAddress target : entry.getValue()) {
                targets.add(target.toText());
            }
        }
        return view;
    }

    /**
     * Reverse adjacency as text: "A1" -> ["A3"], i.e. who reads each cell.
     */
    public Map<String, Set<String>> reverse() {
        Map<String, Set<String>> view = new LinkedHashMap<>();
        for (CellAddress node : edges.keySet()) {
            view.put(node.toText(), new LinkedHashSet<>());
        }
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : edges.entrySet()) {
            for (CellAddress target : entry.getValue()) {
                view.get(target.toText()).add(entry.getKey().toText());
            }
        }
        return view;
    }

    public void clear() {
        edges.clear();
    }

    private static final class Frame {
        private final CellAddress node;
        private final Iterator<CellAddress> pending;

        Frame(CellAddress node, Iterator<CellAddress> pending) {
            this.node = node;
            this.pending = pending;
        }
    }
}
