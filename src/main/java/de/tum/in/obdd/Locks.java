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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

final class Locks {
    private Locks() {}

    static Lock create(boolean synchronize) {
        return synchronize ? new ReentrantLock() : UnsynchronizedLock.INSTANCE;
    }

    /* Used by tables confined to a single thread. */
    private static final class UnsynchronizedLock implements Lock {
        static final Lock INSTANCE = new UnsynchronizedLock();

        @Override
        public void lock() {
            // empty
        }

        @Override
        public void lockInterruptibly() {
            // empty
        }

        @Override
        public boolean tryLock() {
            return true;
        }

        @Override
        public boolean tryLock(long time, TimeUnit unit) {
            return true;
        }

        @Override
        public void unlock() {
            // empty
        }

        @Override
        public Condition newCondition() {
            throw new UnsupportedOperationException("Unsynchronized tables have no conditions");
        }
    }
}
