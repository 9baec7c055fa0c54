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
package com.samsung.sra.anomaly.representation;

import java.util.Arrays;

/** Feature values derived from one sample, in sample order */
public class Representation {
    private final double[] values;

    public Representation(double[] values) {
        this.values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    public double[] getValues() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "<representation: " + Arrays.toString(values) + ">";
    }
}
