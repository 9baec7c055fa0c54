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
package com.samsung.sra.anomaly.discretization;

import java.util.Arrays;

/** Bin symbols in [0, numBins), one per representation value, in the same order */
public class DiscretizedRepresentation {
    private final int[] symbols;
    private final int numBins;

    public DiscretizedRepresentation(int[] symbols, int numBins) {
        for (int symbol : symbols) {
            if (symbol < 0 || symbol >= numBins) {
                throw new IllegalArgumentException("symbol " + symbol + " outside [0, " + numBins + ")");
            }
        }
        this.symbols = symbols.clone();
        this.numBins = numBins;
    }

    public int size() {
        return symbols.length;
    }

    public int get(int i) {
        return symbols[i];
    }

    public int getNumBins() {
        return numBins;
    }

    public int[] getSymbols() {
        return symbols.clone();
    }

    @Override
    public String toString() {
        return String.format("<discretized: %d bins, %s>", numBins, Arrays.toString(symbols));
    }
}
