/*
* Copyright 2016 Samsung Research America. All rights reserved.
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
*/
package com.samsung.sra.anomaly.context;

import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Slides a fixed-size window over [0, n). Windows start at 0, step, 2*step, ... for as long as they fit. Under
 * {@link Coverage#FULL} one extra window [n - window, n) is added when the stride windows stop short of n, so every
 * index is covered; this requires step <= window.
 *
 * Stateless: every call to {@link #generate} returns the same freshly built sequence for the same n.
 */
public class ContextGenerator {
    private final int window, step;
    private final Coverage coverage;

    public ContextGenerator(int window, int step, Coverage coverage) throws ConfigurationException {
        if (window <= 0) {
            throw new ConfigurationException("context window must be positive, got " + window);
        }
        if (step <= 0) {
            throw new ConfigurationException("context step must be positive, got " + step);
        }
        if (coverage == Coverage.FULL && step > window) {
            throw new ConfigurationException(String.format(
                    "context step %d exceeds window %d, which leaves gaps; use coverage = partial to allow that",
                    step, window));
        }
        this.window = window;
        this.step = step;
        this.coverage = coverage;
    }

    /**
     * Options: window (required), step (default window), coverage (default full)
     */
    public static ContextGenerator fromConfiguration(Configuration config) throws ConfigurationException {
        String section = Configuration.CONTEXT;
        int window = config.getPositiveInt(section, "window");
        int step = config.getPositiveInt(section, "step", window);
        Coverage coverage = config.getEnum(section, "coverage", Coverage.class, Coverage.FULL);
        return new ContextGenerator(window, step, coverage);
    }

    public int getWindow() {
        return window;
    }

    public int getStep() {
        return step;
    }

    public Coverage getCoverage() {
        return coverage;
    }

    public List<Context> generate(int n) throws ConfigurationException {
        if (window > n) {
            throw new ConfigurationException(String.format("context window %d exceeds series length %d", window, n));
        }
        List<Context> contexts = new ArrayList<>(count(n));
        int start = 0;
        for (; start + window <= n; start += step) {
            contexts.add(new Context(contexts.size(), start, start + window));
        }
        if (coverage == Coverage.FULL) {
            int lastEnd = contexts.get(contexts.size() - 1).end;
            if (lastEnd < n) {
                contexts.add(new Context(contexts.size(), n - window, n));
            }
        }
        return Collections.unmodifiableList(contexts);
    }

    /** Number of contexts {@link #generate} produces for a series of length n (0 if the window does not fit) */
    public int count(int n) {
        if (window > n) {
            return 0;
        }
        int strided = (n - window) / step + 1;
        int lastEnd = (strided - 1) * step + window;
        return coverage == Coverage.FULL && lastEnd < n ? strided + 1 : strided;
    }

    @Override
    public String toString() {
        return String.format("window %d, step %d, coverage %s", window, step, Configuration.nameOf(coverage));
    }
}
