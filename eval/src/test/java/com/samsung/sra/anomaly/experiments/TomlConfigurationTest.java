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

import com.samsung.sra.anomaly.AnomalyDetector;
import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;
import com.samsung.sra.anomaly.context.Coverage;
import org.junit.Test;

import java.io.File;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class TomlConfigurationTest {
    @Test
    public void tablesBecomeSections() throws Exception {
        Configuration config = TomlConfiguration.parse(
                "[context]\n" +
                "window = 12\n" +
                "coverage = \"partial\"\n" +
                "\n" +
                "[evaluator]\n" +
                "type = \"hellinger\"\n" +
                "smoothing = 0.25\n");
        assertEquals(12, config.getInt("context", "window"));
        assertThat(config.getString("context", "coverage"), is("partial"));
        assertEquals(0.25, config.getDouble("evaluator", "smoothing"), 0);
        assertFalse(config.hasSection("aggregator"));
    }

    @Test
    public void exampleConfigurationIsValid() throws Exception {
        Configuration config = TomlConfiguration.load(new File(getClass().getResource("/example.toml").toURI()));
        AnomalyDetector detector = new AnomalyDetector(config);
        assertEquals(40, detector.getMinimumLength());
        assertEquals(10, detector.getContextGenerator().getStep());
        assertSame(Coverage.FULL, detector.getContextGenerator().getCoverage());
    }

    @Test
    public void rejectsTopLevelOptions() {
        assertRejected("window = 4\n", "inside a [section]");
    }

    @Test
    public void rejectsArraysAndNestedTables() {
        assertRejected("[context]\nwindow = [4, 8]\n", "context.window");
        assertRejected("[context.inner]\nwindow = 4\n", "context.inner");
    }

    @Test
    public void rejectsMalformedToml() {
        assertRejected("[context\nwindow = 4\n", "could not parse");
    }

    @Test
    public void missingFile() {
        try {
            TomlConfiguration.load(new File("does/not/exist.toml"));
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString("exist.toml"));
        }
    }

    private static void assertRejected(String toml, String messagePart) {
        try {
            TomlConfiguration.parse(toml);
            fail("expected ConfigurationException for " + toml);
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString(messagePart));
        }
    }
}
