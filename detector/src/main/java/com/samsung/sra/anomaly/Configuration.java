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

import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * Detector configuration: a mapping from stage name to a mapping of option name to string value. Every option is
 * parsed and range-checked here, and every read is recorded so that {@link #checkAllOptionsUsed} can reject options
 * no stage understands (misspellings, or options belonging to a different variant of the stage).
 *
 * Sections that are absent fall back to the defaults documented on each getter's caller.
 */
public class Configuration {
    public static final String CONTEXT = "context";
    public static final String REFERENCE_FILTER = "reference_filter";
    public static final String EVALUATION_FILTER = "evaluation_filter";
    public static final String REPRESENTATION = "representation";
    public static final String DISCRETIZATION = "discretization";
    public static final String EVALUATOR = "evaluator";
    public static final String AGGREGATOR = "aggregator";
    public static final String DETECTOR = "detector";

    public static final List<String> SECTIONS = Collections.unmodifiableList(Arrays.asList(
            CONTEXT, REFERENCE_FILTER, EVALUATION_FILTER, REPRESENTATION, DISCRETIZATION, EVALUATOR, AGGREGATOR,
            DETECTOR));

    // insertion-ordered so that error messages and logging follow the caller's order
    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    private final Set<String> used = new HashSet<>();

    public Configuration() {
    }

    public Configuration(Map<String, ? extends Map<String, String>> sections) {
        sections.forEach((section, options) -> options.forEach((option, value) -> set(section, option, value)));
    }

    /** Set one option, replacing any previous value. Returns this for chaining */
    public Configuration set(String section, String option, String value) {
        sections.computeIfAbsent(section, s -> new LinkedHashMap<>()).put(option, value);
        return this;
    }

    public boolean hasSection(String section) {
        return sections.containsKey(section);
    }

    public boolean hasOption(String section, String option) {
        Map<String, String> options = sections.get(section);
        return options != null && options.containsKey(option);
    }

    /** Raw value, or null if unset. Marks the option as used */
    private String lookup(String section, String option) {
        used.add(key(section, option));
        Map<String, String> options = sections.get(section);
        if (options == null) {
            return null;
        }
        String value = options.get(option);
        return value == null ? null : value.trim();
    }

    public String getString(String section, String option) throws ConfigurationException {
        String value = lookup(section, option);
        if (StringUtils.isEmpty(value)) {
            throw new ConfigurationException("missing required option " + key(section, option));
        }
        return value;
    }

    public String getString(String section, String option, String defaultValue) {
        String value = lookup(section, option);
        return StringUtils.isEmpty(value) ? defaultValue : value;
    }

    public int getInt(String section, String option) throws ConfigurationException {
        return parseInt(section, option, getString(section, option));
    }

    public int getInt(String section, String option, int defaultValue) throws ConfigurationException {
        String value = lookup(section, option);
        return StringUtils.isEmpty(value) ? defaultValue : parseInt(section, option, value);
    }

    /** Integer that must be strictly positive */
    public int getPositiveInt(String section, String option, int defaultValue) throws ConfigurationException {
        int value = getInt(section, option, defaultValue);
        if (value <= 0) {
            throw new ConfigurationException(String.format("%s must be positive, got %d", key(section, option), value));
        }
        return value;
    }

    public int getPositiveInt(String section, String option) throws ConfigurationException {
        int value = getInt(section, option);
        if (value <= 0) {
            throw new ConfigurationException(String.format("%s must be positive, got %d", key(section, option), value));
        }
        return value;
    }

    public double getDouble(String section, String option) throws ConfigurationException {
        return parseDouble(section, option, getString(section, option));
    }

    public double getDouble(String section, String option, double defaultValue) throws ConfigurationException {
        String value = lookup(section, option);
        return StringUtils.isEmpty(value) ? defaultValue : parseDouble(section, option, value);
    }

    public <E extends Enum<E>> E getEnum(String section, String option, Class<E> type) throws ConfigurationException {
        getString(section, option);
        return getEnum(section, option, type, null);
    }

    /**
     * Parse a variant name into an enum constant. Names are the lower-case constant names, e.g. "equal_width" for
     * EQUAL_WIDTH.
     */
    public <E extends Enum<E>> E getEnum(String section, String option, Class<E> type, E defaultValue)
            throws ConfigurationException {
        String value = lookup(section, option);
        if (StringUtils.isEmpty(value)) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format("unknown %s \"%s\", expected one of %s",
                    key(section, option), value, namesOf(type)), e);
        }
    }

    /** Lower-case variant name of an enum constant, the inverse of {@link #getEnum} */
    public static String nameOf(Enum<?> constant) {
        return constant.name().toLowerCase(Locale.ROOT);
    }

    private static <E extends Enum<E>> List<String> namesOf(Class<E> type) {
        List<String> names = new ArrayList<>();
        for (E constant : type.getEnumConstants()) {
            names.add(nameOf(constant));
        }
        return names;
    }

    /**
     * Reject unknown sections, and any option that was never read while building the detector.
     */
    public void checkAllOptionsUsed() throws ConfigurationException {
        for (Map.Entry<String, Map<String, String>> section : sections.entrySet()) {
            if (!SECTIONS.contains(section.getKey())) {
                throw new ConfigurationException(String.format("unknown section \"%s\", expected one of %s",
                        section.getKey(), SECTIONS));
            }
            for (String option : section.getValue().keySet()) {
                if (!used.contains(key(section.getKey(), option))) {
                    throw new ConfigurationException("unknown or inapplicable option " + key(section.getKey(), option));
                }
            }
        }
    }

    /** Copy of the raw string values */
    public Map<String, Map<String, String>> toMap() {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        sections.forEach((section, options) -> copy.put(section, new LinkedHashMap<>(options)));
        return copy;
    }

    private static int parseInt(String section, String option, String value) throws ConfigurationException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(String.format("%s: expected an integer, got \"%s\"",
                    key(section, option), value), e);
        }
    }

    private static double parseDouble(String section, String option, String value) throws ConfigurationException {
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(String.format("%s: expected a number, got \"%s\"",
                    key(section, option), value), e);
        }
        if (!Double.isFinite(parsed)) {
            throw new ConfigurationException(String.format("%s: expected a finite number, got \"%s\"",
                    key(section, option), value));
        }
        return parsed;
    }

    private static String key(String section, String option) {
        return section + "." + option;
    }

    @Override
    public String toString() {
        return sections.toString();
    }
}
