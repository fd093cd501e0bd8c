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

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps exactly one container per live node. Containers are weakly referenced and collected once the
 * last caller drops them, independently of whether their node is still reachable from elsewhere.
 * Terminals and variables are held strongly for the lifetime of the manager.
 */
public abstract class DiagramReferenceManager<V extends DiagramReferenceManager.DiagramContainer> {
    private static final Logger logger = Logger.getLogger(DiagramReferenceManager.class.getName());

    private final Map<Node, DiagramReference<V>> gcObjects;
    private final Map<Node, V> nonGcObjects = new HashMap<>();
    private final ReferenceQueue<V> queue = new ReferenceQueue<>();
    private final Lock lock;

    private long createdContainers = 0;
    private long clearedContainers = 0;

    protected DiagramReferenceManager(int initialSize, boolean synchronize) {
        this.gcObjects = new HashMap<>(initialSize);
        this.lock = Locks.create(synchronize);
    }

    protected abstract V construct(Node node);

    V make(Node node) {
        lock.lock();
        try {
            // Terminals and variables are exempt from GC but still canonical
            if (node.isLeaf() || isVariableNode(node)) {
                return nonGcObjects.computeIfAbsent(node, this::constructCounted);
            }

            DiagramReference<V> canonicalReference = gcObjects.get(node);
            if (canonicalReference != null) {
                V canonicalContainer = canonicalReference.get();
                if (canonicalContainer != null) {
                    assert node == canonicalContainer.node();
                    return canonicalContainer;
                }
                // This object was GC'ed since the last run of processReferenceQueue(), but potentially
                // wasn't added to the ReferenceQueue by the GC yet. Make sure that the reference is
                // queued and cleared to avoid inconsistencies.
                canonicalReference.enqueue();
            }

            // Remove queued containers from the mapping.
            processReferenceQueue();

            V container = constructCounted(node);
            gcObjects.put(node, new DiagramReference<>(container, queue));
            return container;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries whose container has been collected and returns the number of live
     * entries, including terminals and variables.
     */
    int purge() {
        lock.lock();
        try {
            processReferenceQueue();
            return gcObjects.size() + nonGcObjects.size();
        } finally {
            lock.unlock();
        }
    }

    String getReferenceStatistics() {
        int live = purge();
        return String.format("Diagram table statistics:%n%d live diagrams, %d created, %d cleared",
                live, createdContainers, clearedContainers);
    }

    static boolean isVariableNode(Node node) {
        return !node.isLeaf() && node.low == Node.FALSE && node.high == Node.TRUE;
    }

    private V constructCounted(Node node) {
        createdContainers += 1;
        return construct(node);
    }

    private void processReferenceQueue() {
        Reference<? extends V> reference = queue.poll();
        if (reference == null) {
            // Queue is empty
            return;
        }

        int count = 0;
        do {
            DiagramReference<?> diagramReference = (DiagramReference<?>) reference;
            if (gcObjects.remove(diagramReference.node, diagramReference)) {
                count += 1;
            }
            reference = queue.poll();
        } while (reference != null);

        clearedContainers += count;
        logger.log(Level.FINEST, "Cleared {0} references", count);
    }

    private static final class DiagramReference<V extends DiagramContainer> extends WeakReference<V> {
        private final Node node;

        private DiagramReference(V container, ReferenceQueue<? super V> queue) {
            super(container, queue);
            this.node = container.node();
        }
    }

    @SuppressWarnings("InterfaceMayBeAnnotatedFunctional")
    public interface DiagramContainer {
        Node node();
    }
}
