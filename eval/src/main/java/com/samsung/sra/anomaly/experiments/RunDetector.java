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

import com.samsung.sra.anomaly.AnomalyDetectionException;
import com.samsung.sra.anomaly.AnomalyDetector;
import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.TimeSeries;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.function.DoubleConsumer;

/**
 * Score a series read from a file (or stdin) with a detector configured by a TOML file. See example.toml for the
 * configuration format.
 *
 * Exit status: 0 on success, 1 if the detector rejects its configuration or input, 2 on bad arguments.
 */
public class RunDetector {
    private static final Logger logger = LoggerFactory.getLogger(RunDetector.class);

    static final int OK = 0, DETECTION_FAILED = 1, BAD_ARGUMENTS = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    private static ArgumentParser parser() {
        ArgumentParser parser = ArgumentParsers.newFor("RunDetector").addHelp(false).build()
                .description("score every value of a series by how much its context deviates from the " +
                        "context's reference");
        parser.addArgument("conf").help("detector config file").type(File.class);
        parser.addArgument("-input").help("series file (default: stdin)").type(File.class);
        parser.addArgument("-output").help("score file (default: stdout)").type(File.class);
        parser.addArgument("-progress").help("report progress on stderr").action(Arguments.storeTrue());
        return parser;
    }

    static int run(String[] args, InputStream stdin, OutputStream stdout, PrintStream stderr) {
        ArgumentParser parser = parser();
        File confFile, inputFile, outputFile;
        boolean showProgress;
        try {
            Namespace parsed = parser.parseArgs(args);
            confFile = parsed.get("conf");
            inputFile = parsed.get("input");
            outputFile = parsed.get("output");
            showProgress = parsed.getBoolean("progress");
            if (!confFile.isFile()) {
                throw new IllegalArgumentException("invalid or non-existent config file " + confFile);
            }
            if (inputFile != null && !inputFile.isFile()) {
                throw new IllegalArgumentException("invalid or non-existent input file " + inputFile);
            }
        } catch (ArgumentParserException | IllegalArgumentException e) {
            stderr.println("ERROR: " + e.getMessage());
            parser.printHelp(new PrintWriter(stderr, true));
            return BAD_ARGUMENTS;
        }

        try {
            Configuration config = TomlConfiguration.load(confFile);
            logger.debug("Configuration: {}", config);
            AnomalyDetector detector = new AnomalyDetector(config);

            TimeSeries series;
            try (Reader reader = inputFile != null
                    ? Files.newBufferedReader(inputFile.toPath(), StandardCharsets.UTF_8)
                    : new InputStreamReader(stdin, StandardCharsets.UTF_8)) {
                series = SeriesReader.read(reader);
            }
            logger.info("Read {} values from {}", series.size(), inputFile != null ? inputFile : "stdin");

            DoubleConsumer progress = showProgress
                    ? fraction -> stderr.println(String.format(Locale.ROOT, "%.1f%%", 100 * fraction))
                    : null;
            double[] scores = detector.evaluate(series, progress);

            if (outputFile != null) {
                try (Writer writer = Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8)) {
                    ScoreWriter.write(new PrintWriter(writer), series, scores);
                }
                logger.info("Wrote {} scores to {}", scores.length, outputFile);
            } else {
                // not closed, stdout belongs to the caller
                ScoreWriter.write(new PrintWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8)),
                        series, scores);
            }
            return OK;
        } catch (AnomalyDetectionException e) {
            logger.error("Detection failed: {}", e.getMessage());
            stderr.println("ERROR: " + e.getMessage());
            return DETECTION_FAILED;
        } catch (IOException e) {
            logger.error("I/O error", e);
            stderr.println("ERROR: " + e.getMessage());
            return DETECTION_FAILED;
        }
    }
}
