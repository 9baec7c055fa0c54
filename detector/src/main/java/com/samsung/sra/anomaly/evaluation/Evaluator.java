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

import com.samsung.sra.anomaly.discretization.DiscretizationModel;
import com.samsung.sra.anomaly.discretization.DiscretizedRepresentation;

/**
 * Scores how far the evaluation sample strays from the reference. Both representations were discretized with the
 * same model, the one fitted on the reference. Scores are finite and non-negative; higher means more anomalous.
 */
public interface Evaluator {
    double score(DiscretizationModel model, DiscretizedRepresentation reference, DiscretizedRepresentation evaluation);
}
