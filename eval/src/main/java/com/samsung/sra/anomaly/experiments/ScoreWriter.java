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
package com.samsung.sra.anomaly.experiments;

import com.samsung.sra.anomaly.TimeSeries;

import java.io.PrintWriter;

/** Writes one "index TAB value TAB score" line per series element */
public class ScoreWriter {
    private ScoreWriter() {}

    public static void write(PrintWriter out, TimeSeries series, double[] scores) {
        if (scores.length != series.size()) {
            throw new IllegalArgumentException(String.format(
                    "%d scores for a series of %d values", scores.length, series.size()));
        }
        for (int i = 0; i < scores.length; ++i) {
            out.print(i);
            out.print('\t');
            out.print(series.get(i));
            out.print('\t');
            out.println(scores[i]);
        }
        out.flush();
    }
}
