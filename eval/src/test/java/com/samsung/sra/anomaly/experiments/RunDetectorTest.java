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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class RunDetectorTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderrBytes = new ByteArrayOutputStream();
    private final PrintStream stderr = new PrintStream(stderrBytes, true);

    private File write(String name, String content) throws Exception {
        File file = folder.newFile(name);
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private int run(String stdin, String... args) {
        return RunDetector.run(args, new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                stdout, stderr);
    }

    private String stderrText() {
        return new String(stderrBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void scoresStdinToStdout() throws Exception {
        File conf = write("conf.toml", "[context]\nwindow = 4\nstep = 2\n");
        int status = run("0 0 0 0 10 0 0 0 0 0\n", conf.getPath(), "-progress");
        assertEquals(RunDetector.OK, status);

        String[] lines = new String(stdout.toByteArray(), StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(10, lines.length);
        double max = Double.NEGATIVE_INFINITY;
        int argmax = -1;
        for (int i = 0; i < lines.length; ++i) {
            String[] fields = lines[i].split("\t");
            assertEquals(3, fields.length);
            assertEquals(i, Integer.parseInt(fields[0]));
            double score = Double.parseDouble(fields[2]);
            if (score > max) {
                max = score;
                argmax = i;
            }
        }
        assertEquals(4, argmax);
        assertThat(lines[4], containsString("\t10.0\t"));
        assertThat(stderrText(), containsString("100.0%"));
    }

    @Test
    public void fileInputAndOutput() throws Exception {
        File conf = write("conf.toml", "[context]\nwindow = 3\n\n[aggregator]\ntype = \"mean\"\n");
        File input = write("series.txt", "1,1,1\n1,1,1\n");
        File output = new File(folder.getRoot(), "scores.tsv");
        int status = run("", conf.getPath(), "-input", input.getPath(), "-output", output.getPath());
        assertEquals(RunDetector.OK, status);
        List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
        assertEquals(6, lines.size());
        assertThat(lines.get(0), is("0\t1.0\t0.0"));
        assertEquals(0, stdout.size());
    }

    @Test
    public void detectorErrorsExitWithOne() throws Exception {
        File conf = write("conf.toml", "[context]\nwindow = 4\n\n[discretization]\nbins = 0\n");
        assertEquals(RunDetector.DETECTION_FAILED, run("1 2 3 4", conf.getPath()));
        assertThat(stderrText(), containsString("bin count"));
    }

    @Test
    public void shortSeriesExitsWithOne() throws Exception {
        File conf = write("conf.toml", "[context]\nwindow = 4\n");
        assertEquals(RunDetector.DETECTION_FAILED, run("1 2", conf.getPath()));
        assertThat(stderrText(), containsString("shorter than context window"));
    }

    @Test
    public void badArgumentsExitWithTwo() throws Exception {
        assertEquals(RunDetector.BAD_ARGUMENTS, run(""));
        assertEquals(RunDetector.BAD_ARGUMENTS, run("", new File(folder.getRoot(), "missing.toml").getPath()));
        File conf = write("conf.toml", "[context]\nwindow = 4\n");
        assertEquals(RunDetector.BAD_ARGUMENTS, run("", conf.getPath(), "-input", "no-such-series.txt"));
        assertEquals(RunDetector.BAD_ARGUMENTS, run("", conf.getPath(), "-bogus"));
        assertTrue(stderrText().contains("ERROR"));
    }
}
