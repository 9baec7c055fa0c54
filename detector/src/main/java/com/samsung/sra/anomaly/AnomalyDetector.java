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
package com.samsung.sra.anomaly;

import com.samsung.sra.anomaly.aggregation.AggregationMethod;
import com.samsung.sra.anomaly.aggregation.ScoreAggregator;
import com.samsung.sra.anomaly.context.Context;
import com.samsung.sra.anomaly.context.ContextGenerator;
import com.samsung.sra.anomaly.discretization.DiscretizationModel;
import com.samsung.sra.anomaly.discretization.DiscretizedRepresentation;
import com.samsung.sra.anomaly.discretization.Discretizer;
import com.samsung.sra.anomaly.discretization.Discretizers;
import com.samsung.sra.anomaly.evaluation.Evaluator;
import com.samsung.sra.anomaly.evaluation.Evaluators;
import com.samsung.sra.anomaly.filter.FilterType;
import com.samsung.sra.anomaly.filter.Sample;
import com.samsung.sra.anomaly.filter.SampleFilter;
import com.samsung.sra.anomaly.filter.SampleFilters;
import com.samsung.sra.anomaly.representation.Representation;
import com.samsung.sra.anomaly.representation.Representer;
import com.samsung.sra.anomaly.representation.Representers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.DoubleConsumer;

/**
 * <p>Scores every index of a series for anomalousness. The series is cut into contexts; in each context a reference
 * sample and an evaluation sample are selected, represented, discretized with a model fitted on the reference only,
 * and the evaluation sample is scored by how far its bin distribution strays from the reference's. Per-context scores
 * are then combined into one score per index.</p>
 *
 * <p>All stages are built and validated by the constructor, so a bad configuration fails before any data is seen.
 * A detector can be reused for any number of {@link #evaluate} calls; each call is an independent run. Not thread
 * safe.</p>
 */
public class AnomalyDetector {
    private static final Logger logger = LoggerFactory.getLogger(AnomalyDetector.class);

    public enum State {
        INIT, GENERATING_CONTEXTS, PROCESSING_CONTEXT, AGGREGATING, DONE, FAILED
    }

    /** Steps within one context, in execution order */
    public enum ContextStage {
        FILTER_REFERENCE, FILTER_EVALUATION, REPRESENT_BOTH, FIT_DISCRETIZER, APPLY_DISCRETIZER, EVALUATE, RECORD_SCORE
    }

    /** What to do when a single context cannot be scored */
    public enum InsufficientDataPolicy {
        /** abort the run and rethrow */
        FAIL,
        /** record the default score at the context's evaluation indices and carry on */
        SKIP
    }

    private final ContextGenerator contextGenerator;
    private final SampleFilter referenceFilter, evaluationFilter;
    private final Representer representer;
    private final Discretizer discretizer;
    private final Evaluator evaluator;
    private final AggregationMethod aggregationMethod;
    private final InsufficientDataPolicy insufficientDataPolicy;

    private State state = State.INIT;

    public AnomalyDetector(Configuration config) throws ConfigurationException {
        contextGenerator = ContextGenerator.fromConfiguration(config);
        int window = contextGenerator.getWindow();
        referenceFilter = SampleFilters.fromConfiguration(config, Configuration.REFERENCE_FILTER, FilterType.LEADING,
                window);
        evaluationFilter = SampleFilters.fromConfiguration(config, Configuration.EVALUATION_FILTER, FilterType.TRAILING,
                window);
        representer = Representers.fromConfiguration(config);
        discretizer = Discretizers.fromConfiguration(config);
        evaluator = Evaluators.fromConfiguration(config);
        aggregationMethod = AggregationMethod.fromConfiguration(config);
        insufficientDataPolicy = config.getEnum(Configuration.DETECTOR, "on_insufficient_data",
                InsufficientDataPolicy.class, InsufficientDataPolicy.FAIL);
        config.checkAllOptionsUsed();

        checkSampleSize(Configuration.REFERENCE_FILTER, referenceFilter, window);
        checkSampleSize(Configuration.EVALUATION_FILTER, evaluationFilter, window);

        logger.info("Detector: contexts [{}], reference [{}], evaluation [{}], representation [{}], " +
                        "discretization [{}], evaluator [{}], aggregation [{}], on insufficient data [{}]",
                contextGenerator, referenceFilter, evaluationFilter, representer, discretizer, evaluator,
                Configuration.nameOf(aggregationMethod), Configuration.nameOf(insufficientDataPolicy));
    }

    /** Reject filter/representation combinations that can never produce a usable sample */
    private void checkSampleSize(String section, SampleFilter filter, int window) throws ConfigurationException {
        int available = filter.maxSampleSize(window);
        if (available < representer.minimumSampleSize()) {
            throw new ConfigurationException(String.format(
                    "%s [%s] selects at most %d values per context, representation [%s] needs %d",
                    section, filter, available, representer, representer.minimumSampleSize()));
        }
    }

    public double[] evaluate(double[] values) throws AnomalyDetectionException {
        return evaluate(values, null);
    }

    public double[] evaluate(TimeSeries series) throws AnomalyDetectionException {
        return evaluate(series, null);
    }

    public double[] evaluate(double[] values, DoubleConsumer progress) throws AnomalyDetectionException {
        TimeSeries series;
        try {
            series = new TimeSeries(values);
        } catch (InvalidInputException e) {
            state = State.FAILED;
            throw e;
        }
        return evaluate(series, progress);
    }

    /**
     * Score the series. progress, if non-null, is called once after each context with the fraction of contexts done
     * so far; the last call passes exactly 1.0. Returns one score per series index; indices that no evaluation sample
     * touched score {@link ScoreAggregator#DEFAULT_SCORE}.
     *
     * @throws InvalidInputException if the series is shorter than the context window
     * @throws InsufficientDataException if a context cannot be scored and the policy is FAIL
     */
    public double[] evaluate(TimeSeries series, DoubleConsumer progress) throws AnomalyDetectionException {
        state = State.INIT;
        try {
            if (series == null) {
                throw new InvalidInputException("no input series");
            }
            int n = series.size();
            if (n < contextGenerator.getWindow()) {
                throw new InvalidInputException(String.format("series of length %d is shorter than context window %d",
                        n, contextGenerator.getWindow()));
            }

            state = State.GENERATING_CONTEXTS;
            List<Context> contexts = contextGenerator.generate(n);
            logger.info("Scoring {} values in {} contexts", n, contexts.size());
            ScoreAggregator aggregator = aggregationMethod.create(n);

            state = State.PROCESSING_CONTEXT;
            int total = contexts.size();
            for (int i = 0; i < total; ++i) {
                processContext(series, contexts.get(i), aggregator);
                if (progress != null) {
                    progress.accept((double) (i + 1) / total);
                }
            }

            state = State.AGGREGATING;
            double[] scores = aggregator.finish();
            state = State.DONE;
            logger.info("Scored {} values", n);
            return scores;
        } catch (AnomalyDetectionException | RuntimeException e) {
            state = State.FAILED;
            throw e;
        }
    }

    private void processContext(TimeSeries series, Context context, ScoreAggregator aggregator)
            throws InsufficientDataException {
        ContextStage stage = ContextStage.FILTER_REFERENCE;
        Sample evaluation = null;
        try {
            Sample reference = nonEmpty(referenceFilter.select(context, series), "reference");

            stage = ContextStage.FILTER_EVALUATION;
            evaluation = nonEmpty(evaluationFilter.select(context, series), "evaluation");

            stage = ContextStage.REPRESENT_BOTH;
            Representation referenceRep = representer.represent(reference);
            Representation evaluationRep = representer.represent(evaluation);

            stage = ContextStage.FIT_DISCRETIZER;
            DiscretizationModel model = discretizer.fit(referenceRep);

            stage = ContextStage.APPLY_DISCRETIZER;
            DiscretizedRepresentation referenceSymbols = discretizer.apply(model, referenceRep);
            DiscretizedRepresentation evaluationSymbols = discretizer.apply(model, evaluationRep);
            logger.trace("Context {}: model {}, reference {}, evaluation {}",
                    context, model, referenceSymbols, evaluationSymbols);

            stage = ContextStage.EVALUATE;
            double score = evaluator.score(model, referenceSymbols, evaluationSymbols);

            stage = ContextStage.RECORD_SCORE;
            aggregator.add(context, evaluation, score);
            logger.debug("Context {} scored {}", context, score);
        } catch (InsufficientDataException e) {
            InsufficientDataException located = new InsufficientDataException(e, context,
                    "stage " + Configuration.nameOf(stage));
            if (insufficientDataPolicy == InsufficientDataPolicy.FAIL) {
                throw located;
            }
            logger.warn("Skipping context: {}", located.getMessage());
            if (evaluation == null) {
                evaluation = evaluationFilter.select(context, series);
            }
            if (!evaluation.isEmpty()) {
                aggregator.add(context, evaluation, ScoreAggregator.DEFAULT_SCORE);
            }
        }
    }

    private static Sample nonEmpty(Sample sample, String role) throws InsufficientDataException {
        if (sample.isEmpty()) {
            throw new InsufficientDataException(role + " sample is empty");
        }
        return sample;
    }

    public State getState() {
        return state;
    }

    /** Shortest series this detector accepts */
    public int getMinimumLength() {
        return contextGenerator.getWindow();
    }

    public ContextGenerator getContextGenerator() {
        return contextGenerator;
    }

    public InsufficientDataPolicy getInsufficientDataPolicy() {
        return insufficientDataPolicy;
    }
}
