/*
 * This file is part of JOBDD.
 * Copyright (c) 2024 Tobias Meggendorfer.
 *
 * JOBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JOBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JOBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.obdd;

import static de.tum.in.obdd.Util.checkState;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The unique table of internal nodes. Each structural key {@code (variable, low, high)} maps to at
 * most one live node. Entries only weakly refer to their node, so a node vanishes from the table
 * once neither a diagram nor a parent node holds it. Requesting the same key afterwards builds a
 * fresh node, which is then the canonical one.
 */
@SuppressWarnings("ObjectEquality")
final class NodeTable {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    private final Map<NodeKey, NodeReference> table;
    private final ReferenceQueue<Node> queue = new ReferenceQueue<>();
    private final Lock lock;

    private long createdNodes = 0;
    private long reclaimedNodes = 0;
    private long lookups = 0;
    private long hits = 0;

    NodeTable(int initialSize, boolean synchronize) {
        this.table = new HashMap<>(initialSize);
        this.lock = Locks.create(synchronize);
    }

    /**
     * Returns the canonical node with the given variable and children. If both children are the
     * same node, that node is returned.
     */
    Node makeNode(Variable variable, Node low, Node high) {
        assert low.isLeaf() || variable.uniqueId() < low.root();
        assert high.isLeaf() || variable.uniqueId() < high.root();

        if (low == high) {
            return low;
        }

        NodeKey key = new NodeKey(variable.uniqueId(), low, high);
        lock.lock();
        try {
            lookups += 1;
            NodeReference reference = table.get(key);
            if (reference != null) {
                Node node = reference.get();
                if (node != null) {
                    hits += 1;
                    assert node.variable == variable;
                    return node;
                }
                // The node was collected, but the reference may not be queued yet.
                reference.enqueue();
            }
            processReferenceQueue();

            Node node = new Node(variable, low, high, key.hash);
            table.put(key, new NodeReference(node, key, queue));
            createdNodes += 1;
            return node;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries whose node has been collected and returns the number of live entries.
     */
    int purge() {
        lock.lock();
        try {
            processReferenceQueue();
            return table.size();
        } finally {
            lock.unlock();
        }
    }

    private void processReferenceQueue() {
        Reference<? extends Node> reference = queue.poll();
        if (reference == null) {
            return;
        }

        int count = 0;
        do {
            NodeReference nodeReference = (NodeReference) reference;
            // The key might have been re-assigned to a new node in the meantime
            if (table.remove(nodeReference.key, nodeReference)) {
                count += 1;
            }
            reference = queue.poll();
        } while (reference != null);

        reclaimedNodes += count;
        logger.log(Level.FINEST, "Cleared {0} references", count);
    }

    /**
     * Performs integrity checks on all live nodes.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check() {
        logger.log(Level.FINER, "Running node table integrity check");
        lock.lock();
        try {
            for (Map.Entry<NodeKey, NodeReference> entry : table.entrySet()) {
                NodeKey key = entry.getKey();
                Node node = entry.getValue().get();
                if (node == null) {
                    continue;
                }
                checkState(node.variable != null, "Terminal %s stored in node table", node);
                checkState(node.low != null && node.high != null, "Node (%s) is missing a child", node);
                checkState(node.low != node.high, "Node (%s) has identical children", node);
                checkState(key.variable == node.root() && key.low == node.low && key.high == node.high,
                        "Key (%s) maps to mismatched node (%s)", key, node);
                checkState(node.low.isLeaf() || node.root() < node.low.root(),
                        "(%s) -> (%s) does not descend tree", node, node.low);
                checkState(node.high.isLeaf() || node.root() < node.high.root(),
                        "(%s) -> (%s) does not descend tree", node, node.high);
            }
        } finally {
            lock.unlock();
        }
        return true;
    }

    String getStatistics() {
        int liveNodes = purge();
        return String.format(
                "Node table statistics:%n"
                        + "%d live nodes, %d created, %d reclaimed%n"
                        + "%d lookups, %d hits (%.2f hit rate)",
                liveNodes,
                createdNodes,
                reclaimedNodes,
                lookups,
                hits,
                lookups == 0 ? 0.0d : (double) hits / lookups);
    }

    private static final class NodeKey {
        final int variable;
        final Node low;
        final Node high;
        final int hash;

        NodeKey(int variable, Node low, Node high) {
            this.variable = variable;
            this.low = low;
            this.high = high;
            this.hash = HashUtil.hash(variable, low.hashCode(), high.hashCode());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof NodeKey)) {
                return false;
            }
            NodeKey other = (NodeKey) o;
            return variable == other.variable && low == other.low && high == other.high;
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return String.format("%d, %s, %s", variable, low, high);
        }
    }

    private static final class NodeReference extends WeakReference<Node> {
        private final NodeKey key;

        private NodeReference(Node node, NodeKey key, ReferenceQueue<? super Node> queue) {
            super(node, queue);
            this.key = key;
        }
    }
}
