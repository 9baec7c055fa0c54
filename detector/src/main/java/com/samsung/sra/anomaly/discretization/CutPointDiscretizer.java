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

import com.samsung.sra.anomaly.ConfigurationException;
import com.samsung.sra.anomaly.InsufficientDataException;
import com.samsung.sra.anomaly.representation.Representation;

/**
 * Shared apply step for discretizers whose model is a set of cut points. Subclasses only decide where the cut points
 * go.
 */
public abstract class CutPointDiscretizer implements Discretizer {
    protected final int bins;

    protected CutPointDiscretizer(int bins) throws ConfigurationException {
        if (bins <= 0) {
            throw new ConfigurationException("discretization bin count must be positive, got " + bins);
        }
        this.bins = bins;
    }

    /** Model with bins - 1 sorted cut points for a non-empty reference */
    protected abstract DiscretizationModel fitValues(double[] reference) throws InsufficientDataException;

    @Override
    public final DiscretizationModel fit(Representation reference) throws InsufficientDataException {
        if (reference.size() == 0) {
            throw new InsufficientDataException("cannot fit discretization on an empty reference");
        }
        DiscretizationModel model = fitValues(reference.getValues());
        assert model.getNumBins() == bins;
        return model;
    }

    @Override
    public DiscretizedRepresentation apply(DiscretizationModel model, Representation representation) {
        return new DiscretizedRepresentation(model.binsOf(representation.getValues()), model.getNumBins());
    }

    @Override
    public int getNumBins() {
        return bins;
    }
}
