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
package com.samsung.sra.anomaly.evaluation;

import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;
import com.samsung.sra.anomaly.discretization.DiscretizationModel;
import com.samsung.sra.anomaly.discretization.DiscretizedRepresentation;
import com.samsung.sra.anomaly.discretization.EqualWidthDiscretizer;
import com.samsung.sra.anomaly.representation.Representation;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EvaluatorsTest {
    private static final double delta = 1e-9;

    private static DiscretizationModel model;

    private static DiscretizedRepresentation symbols(int... symbols) {
        return new DiscretizedRepresentation(symbols, 4);
    }

    private static DiscretizationModel fourBins() throws Exception {
        if (model == null) {
            model = new EqualWidthDiscretizer(4).fit(new Representation(new double[]{0, 4}));
        }
        return model;
    }

    private static Evaluator[] allEvaluators(double smoothing) throws ConfigurationException {
        return new Evaluator[]{
                new KullbackLeiblerEvaluator(smoothing),
                new JensenShannonEvaluator(smoothing),
                new HellingerEvaluator(smoothing),
                new TotalVariationEvaluator(smoothing)
        };
    }

    @Test
    public void histogram() {
        Histogram h = new Histogram(symbols(0, 0, 3, 1));
        assertEquals(4, h.getTotal());
        assertEquals(2, h.getCount(0));
        assertEquals(0, h.getCount(2));
        assertArrayEquals(new double[]{0.5, 0.25, 0, 0.25}, h.getProbabilities(0), delta);
        assertArrayEquals(new double[]{2.5 / 6, 1.5 / 6, 0.5 / 6, 1.5 / 6}, h.getProbabilities(0.5), delta);
    }

    @Test
    public void identicalDistributionsScoreZero() throws Exception {
        for (double smoothing : new double[]{0, 0.5, 1}) {
            for (Evaluator e : allEvaluators(smoothing)) {
                assertEquals(e.toString(), 0, e.score(fourBins(), symbols(0, 1, 1, 2), symbols(2, 1, 0, 1)), 0);
            }
        }
    }

    @Test
    public void kullbackLeibler() throws Exception {
        // expected [2.5, .5, .5, .5] / 4, observed [1.5, .5, .5, 1.5] / 4
        double expected = 0.375 * Math.log(1.5 / 2.5) + 0.375 * Math.log(3);
        assertEquals(expected, new KullbackLeiblerEvaluator(0.5).score(fourBins(), symbols(0, 0), symbols(0, 3)), delta);
    }

    @Test
    public void zeroSmoothingStaysFinite() throws Exception {
        for (Evaluator e : allEvaluators(0)) {
            double score = e.score(fourBins(), symbols(0, 0, 0), symbols(3, 3, 3));
            assertTrue(e.toString(), Double.isFinite(score));
            assertTrue(e.toString(), score > 0);
        }
        assertEquals(Math.log(1 / KullbackLeiblerEvaluator.FLOOR),
                new KullbackLeiblerEvaluator(0).score(fourBins(), symbols(0, 0, 0), symbols(3, 3, 3)), delta);
    }

    @Test
    public void boundedEvaluatorsReachOneOnDisjointSupport() throws Exception {
        assertEquals(1, new TotalVariationEvaluator(0).score(fourBins(), symbols(0, 0), symbols(3, 3)), delta);
        assertEquals(1, new HellingerEvaluator(0).score(fourBins(), symbols(0, 0), symbols(3, 3)), delta);
        assertEquals(1, new JensenShannonEvaluator(0).score(fourBins(), symbols(0, 0), symbols(3, 3)), delta);
    }

    @Test
    public void moreDifferentScoresHigher() throws Exception {
        for (Evaluator e : allEvaluators(0.5)) {
            double near = e.score(fourBins(), symbols(0, 0, 1, 1), symbols(0, 1, 1, 1));
            double far = e.score(fourBins(), symbols(0, 0, 1, 1), symbols(3, 3, 3, 3));
            assertTrue(e.toString(), far > near);
        }
    }

    @Test
    public void fromConfiguration() throws Exception {
        assertThat(Evaluators.fromConfiguration(new Configuration()), instanceOf(KullbackLeiblerEvaluator.class));
        Evaluator hellinger = Evaluators.fromConfiguration(new Configuration()
                .set("evaluator", "type", "hellinger")
                .set("evaluator", "smoothing", "0"));
        assertThat(hellinger, instanceOf(HellingerEvaluator.class));
        assertEquals(0, ((HistogramEvaluator) hellinger).getSmoothing(), 0);
    }

    @Test
    public void rejectsNegativeSmoothing() {
        try {
            Evaluators.fromConfiguration(new Configuration().set("evaluator", "smoothing", "-0.1"));
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString("non-negative"));
        }
    }
}
