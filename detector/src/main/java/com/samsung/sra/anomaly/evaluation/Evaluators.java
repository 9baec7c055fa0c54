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

public class Evaluators {
    public static final double DEFAULT_SMOOTHING = 0.5;

    private Evaluators() {}

    /** type: kl (default), jensen_shannon, hellinger or total_variation; smoothing (default 0.5) */
    public static Evaluator fromConfiguration(Configuration config) throws ConfigurationException {
        String section = Configuration.EVALUATOR;
        EvaluatorType type = config.getEnum(section, "type", EvaluatorType.class, EvaluatorType.KL);
        double smoothing = config.getDouble(section, "smoothing", DEFAULT_SMOOTHING);
        switch (type) {
            case KL:
                return new KullbackLeiblerEvaluator(smoothing);
            case JENSEN_SHANNON:
                return new JensenShannonEvaluator(smoothing);
            case HELLINGER:
                return new HellingerEvaluator(smoothing);
            case TOTAL_VARIATION:
                return new TotalVariationEvaluator(smoothing);
            default:
                throw new IllegalStateException("unhandled evaluator type " + type);
        }
    }
}
