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

final class HashUtil {
    // Note: Node keys are hashed on every makeNode call, so these are kept deliberately simple. The
    // children contribute their own (structural) hash, which already mixes the variable below them.

    static final int PRIME = 0x1000193;
    static final int FALSE_HASH = 0x2f3b_a91d;
    static final int TRUE_HASH = 0x6c1e_5b07;

    private HashUtil() {}

    static int hash(int variable, int lowHash, int highHash) {
        int hash = variable * PRIME;
        hash = (hash ^ lowHash) * PRIME;
        hash = (hash ^ Integer.rotateLeft(highHash, 16)) * PRIME;
        return hash ^ (hash >>> 15);
    }
}
