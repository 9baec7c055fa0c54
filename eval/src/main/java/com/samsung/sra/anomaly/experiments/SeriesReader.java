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

import com.samsung.sra.anomaly.InvalidInputException;
import com.samsung.sra.anomaly.TimeSeries;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Parses a series from text: numbers separated by whitespace, commas or newlines, in series order. Anything after a
 * '#' on a line is a comment.
 */
public class SeriesReader {
    private SeriesReader() {}

    public static TimeSeries read(Reader input) throws IOException, InvalidInputException {
        BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        DoubleArrayList values = new DoubleArrayList();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            ++lineNumber;
            String content = StringUtils.substringBefore(line, "#").trim();
            if (content.isEmpty()) {
                continue;
            }
            for (String token : content.split("[\\s,]+")) {
                if (token.isEmpty()) {
                    continue;
                }
                try {
                    values.add(Double.parseDouble(token));
                } catch (NumberFormatException e) {
                    throw new InvalidInputException(String.format("line %d: cannot parse \"%s\" as a number",
                            lineNumber, token), e);
                }
            }
        }
        return new TimeSeries(values.toDoubleArray());
    }
}
