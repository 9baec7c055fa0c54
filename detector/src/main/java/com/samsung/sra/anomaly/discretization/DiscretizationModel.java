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

import it.unimi.dsi.fastutil.doubles.Double2IntOpenHashMap;

import java.util.Arrays;

/**
 * Fitted bin boundaries: bins - 1 non-decreasing cut points. A value falls into the bin numbered by how many cut
 * points lie strictly below it, so anything below the first cut point is bin 0 and anything above the last is
 * bin (bins - 1). Values outside the fitted range are clamped into the edge bins rather than rejected.
 *
 * A value equal to a cut point is split by that cut's tie quota: the first quota occurrences of the value (in the
 * order they are discretized) stay below the cut, later ones go above it. Equal cut points may repeat, each with its
 * own quota, which is how one heavily tied value can span several bins. A model without quotas keeps every tied
 * value in the lower bin.
 *
 * Immutable. Only {@link Discretizer#fit} creates models.
 */
public class DiscretizationModel {
    private static final int ALL_BELOW = Integer.MAX_VALUE;

    private final double[] cutPoints;
    private final int[] tieQuotas;

    DiscretizationModel(double[] cutPoints) {
        this(cutPoints, filled(cutPoints.length, ALL_BELOW));
    }

    DiscretizationModel(double[] cutPoints, int[] tieQuotas) {
        assert cutPoints.length == tieQuotas.length;
        for (int i = 1; i < cutPoints.length; ++i) {
            assert cutPoints[i - 1] <= cutPoints[i] : "cut points not sorted";
        }
        for (double cut : cutPoints) {
            assert !Double.isNaN(cut) : "NaN cut point";
        }
        this.cutPoints = cutPoints.clone();
        this.tieQuotas = tieQuotas.clone();
    }

    private static int[] filled(int length, int value) {
        int[] array = new int[length];
        Arrays.fill(array, value);
        return array;
    }

    public int getNumBins() {
        return cutPoints.length + 1;
    }

    public double[] getCutPoints() {
        return cutPoints.clone();
    }

    public int[] getTieQuotas() {
        return tieQuotas.clone();
    }

    /** Bin of every value, handing out tied values in array order */
    public int[] binsOf(double[] values) {
        int[] bins = new int[values.length];
        // occurrences so far of each value that sits on a cut point
        Double2IntOpenHashMap tiesSeen = new Double2IntOpenHashMap();
        for (int i = 0; i < values.length; ++i) {
            double value = values[i];
            int bin = countBelow(value);
            if (bin < cutPoints.length && cutPoints[bin] == value) {
                // + 0.0 folds -0.0 into 0.0, which compare equal
                int seen = tiesSeen.addTo(value + 0.0, 1);
                for (int k = bin; k < cutPoints.length && cutPoints[k] == value && seen >= tieQuotas[k]; ++k) {
                    ++bin;
                }
            }
            bins[i] = bin;
        }
        return bins;
    }

    /** Number of cut points strictly below value */
    private int countBelow(double value) {
        int lo = 0, hi = cutPoints.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cutPoints[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    @Override
    public String toString() {
        return String.format("<discretization-model: %d bins, cut points %s>", getNumBins(), Arrays.toString(cutPoints));
    }
}
