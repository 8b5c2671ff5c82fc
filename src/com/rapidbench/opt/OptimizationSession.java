/*
 * Copyright (c) 2026, RapidBench contributors.
 * All rights reserved.
 *
 * This file is part of RapidBench.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.rapidbench.opt;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.jetbrains.annotations.Nullable;

import com.rapidbench.netlist.GateNetlist;

/**
 * Holds the state an optimizer works on: the current netlist. Transforms
 * within one session are serialized by {@link #runExclusive(Supplier)};
 * separate sessions are independent and may be used from different threads.
 */
public class OptimizationSession {

    private final String name;

    private final ReentrantLock lock = new ReentrantLock();

    private GateNetlist currentNetlist;

    public OptimizationSession(String name) {
        this.name = name;
    }

    public OptimizationSession() {
        this("session");
    }

    public String getName() {
        return name;
    }

    /**
     * Runs an action while holding this session's lock.
     * @param action The action.
     * @param <T> Result type.
     * @return The result of the action.
     */
    public <T> T runExclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    @Nullable
    public GateNetlist getCurrentNetlist() {
        return currentNetlist;
    }

    /**
     * Replaces the current netlist. Must be called from within {@link #runExclusive(Supplier)}.
     * @param netlist The new current netlist.
     */
    public void setCurrentNetlist(GateNetlist netlist) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("ERROR: Session " + name
                    + " must be locked with runExclusive() before changing its netlist");
        }
        currentNetlist = netlist;
    }
}
