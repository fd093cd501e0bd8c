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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Assigns unique ids to variable identities. Ids start at 1 and are never reused; re-requesting an
 * identity yields the same {@link Variable} instance for the lifetime of the registry.
 */
final class VariableRegistry {
    private static final Logger logger = Logger.getLogger(VariableRegistry.class.getName());
    private static final int FIRST_ID = 1;

    private final Map<Identity, Variable> variables = new ConcurrentHashMap<>();
    private final Lock lock = new ReentrantLock();
    private int nextId = FIRST_ID;

    Variable resolve(List<String> names, List<Integer> indices) {
        Identity identity = validate(names, indices);

        Variable existing = variables.get(identity);
        if (existing != null) {
            return existing;
        }

        // Concurrent first requests of one identity must obtain the same id
        lock.lock();
        try {
            existing = variables.get(identity);
            if (existing != null) {
                return existing;
            }
            Variable variable = new Variable(identity.names, identity.indices, nextId);
            nextId += 1;
            variables.put(identity, variable);
            logger.log(Level.FINE, "Registered variable {0} with id {1}", new Object[] {variable, variable.uniqueId()});
            return variable;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the registered variable with the given identity, without registering it.
     */
    @Nullable
    Variable find(List<String> names, List<Integer> indices) {
        return variables.get(validate(names, indices));
    }

    int size() {
        return variables.size();
    }

    private static Identity validate(@Nullable List<String> names, @Nullable List<Integer> indices) {
        if (names == null || names.isEmpty()) {
            throw new InvalidIdentifierException("names", "expected at least one name");
        }
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i) == null) {
                throw new InvalidIdentifierException("names", String.format("name at position %d is null", i));
            }
        }
        if (indices == null) {
            throw new InvalidIdentifierException("indices", "expected a (possibly empty) list of indices");
        }
        for (int i = 0; i < indices.size(); i++) {
            Integer index = indices.get(i);
            if (index == null) {
                throw new InvalidIdentifierException("indices", String.format("index at position %d is null", i));
            }
            if (index < 0) {
                throw new InvalidIdentifierException("indices", String.format("expected index >= 0, got %d", index));
            }
        }
        return new Identity(List.copyOf(names), List.copyOf(indices));
    }

    private static final class Identity {
        private final List<String> names;
        private final List<Integer> indices;
        private final int hash;

        Identity(List<String> names, List<Integer> indices) {
            this.names = names;
            this.indices = indices;
            this.hash = Objects.hash(names, indices);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Identity)) {
                return false;
            }
            Identity other = (Identity) o;
            return hash == other.hash && names.equals(other.names) && indices.equals(other.indices);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
