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

import com.moandjiezana.toml.Toml;
import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;

import java.io.File;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a detector configuration from a TOML file. Each TOML table becomes a section and each key/value pair in it an
 * option, e.g.
 * <pre>
 * [context]
 * window = 40
 * step = 10
 *
 * [discretization]
 * type = "equal_frequency"
 * bins = 5
 * </pre>
 * Only scalar values are allowed inside a table; top-level keys, nested tables and arrays are rejected. Whether the
 * sections and options make sense is left to {@link com.samsung.sra.anomaly.AnomalyDetector}.
 */
public class TomlConfiguration {
    private TomlConfiguration() {}

    public static Configuration load(File file) throws ConfigurationException {
        if (!file.isFile()) {
            throw new ConfigurationException("invalid or non-existent config file " + file);
        }
        Toml toml;
        try {
            toml = new Toml().read(file);
        } catch (RuntimeException e) {
            throw new ConfigurationException("could not parse config file " + file + ": " + e.getMessage(), e);
        }
        return convert(toml);
    }

    public static Configuration parse(String text) throws ConfigurationException {
        Toml toml;
        try {
            toml = new Toml().read(text);
        } catch (RuntimeException e) {
            throw new ConfigurationException("could not parse config: " + e.getMessage(), e);
        }
        return convert(toml);
    }

    private static Configuration convert(Toml toml) throws ConfigurationException {
        Configuration config = new Configuration();
        // sorted so that error messages do not depend on hash order
        for (Map.Entry<String, Object> section : new TreeMap<>(toml.toMap()).entrySet()) {
            if (!(section.getValue() instanceof Map)) {
                throw new ConfigurationException(String.format(
                        "top-level option \"%s\" must be placed inside a [section]", section.getKey()));
            }
            Map<?, ?> options = (Map<?, ?>) section.getValue();
            for (Map.Entry<?, ?> option : options.entrySet()) {
                String name = section.getKey() + "." + option.getKey();
                Object value = option.getValue();
                if (value instanceof Map || value instanceof Iterable) {
                    throw new ConfigurationException("option " + name + " must be a single value");
                }
                config.set(section.getKey(), String.valueOf(option.getKey()), String.valueOf(value));
            }
        }
        return config;
    }
}
