/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat;

import graphSat.encoding.CardinalityEncoder;
import graphSat.theories.BruteForceOracle;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunables of the engine. Defaults can be overridden from a {@code graphsat.properties} file on the classpath.
 */
public class EngineSettings {

    public final static String RESOURCE = "graphsat.properties";

    public final static String MAX_SOLUTIONS = "graphsat.maxSolutions",
            ORACLE_TIMEOUT = "graphsat.oracle.timeout",
            DIRECT_CARDINALITY_LIMIT = "graphsat.cardinality.directLimit",
            BRUTE_FORCE_MAX_VARIABLES = "graphsat.bruteforce.maxVariables";

    // -1 enumerates everything
    private int maxSolutions = -1;

    // seconds, 0 means no limit
    private int oracleTimeout = 0;

    private int directCardinalityLimit = CardinalityEncoder.DEFAULT_DIRECT_LIMIT;

    private int bruteForceMaxVariables = BruteForceOracle.DEFAULT_MAX_VARIABLES;

    /**
     * Settings from the classpath resource, or the built-in defaults if there is none.
     */
    public static EngineSettings load(){
        EngineSettings settings = new EngineSettings();
        InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null){
            return settings;
        }
        Properties properties = new Properties();
        try {
            try {
                properties.load(in);
            } finally {
                in.close();
            }
        } catch (IOException e){
            throw new IllegalStateException("Could not read " + RESOURCE, e);
        }
        return settings.apply(properties);
    }

    /**
     * Overrides the settings present in the given properties; absent keys keep their current values.
     *
     * @throws IllegalArgumentException if a value is not a valid integer for its key
     */
    public EngineSettings apply(Properties properties){
        setMaxSolutions(intValue(properties, MAX_SOLUTIONS, this.maxSolutions));
        setOracleTimeout(intValue(properties, ORACLE_TIMEOUT, this.oracleTimeout));
        setDirectCardinalityLimit(intValue(properties, DIRECT_CARDINALITY_LIMIT, this.directCardinalityLimit));
        setBruteForceMaxVariables(intValue(properties, BRUTE_FORCE_MAX_VARIABLES, this.bruteForceMaxVariables));
        return this;
    }

    private static int intValue(Properties properties, String key, int defaultValue){
        String value = properties.getProperty(key);
        if (value == null){
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e){
            throw new IllegalArgumentException("Property " + key + " is not an integer: '" + value + "'", e);
        }
    }

    public int getMaxSolutions() {
        return maxSolutions;
    }

    public void setMaxSolutions(int maxSolutions) {
        if (maxSolutions < -1){
            throw new IllegalArgumentException(MAX_SOLUTIONS + " must be -1 or non-negative, got " + maxSolutions);
        }
        this.maxSolutions = maxSolutions;
    }

    public int getOracleTimeout() {
        return oracleTimeout;
    }

    public void setOracleTimeout(int oracleTimeout) {
        if (oracleTimeout < 0){
            throw new IllegalArgumentException(ORACLE_TIMEOUT + " must be non-negative, got " + oracleTimeout);
        }
        this.oracleTimeout = oracleTimeout;
    }

    public int getDirectCardinalityLimit() {
        return directCardinalityLimit;
    }

    public void setDirectCardinalityLimit(int directCardinalityLimit) {
        if (directCardinalityLimit < 0){
            throw new IllegalArgumentException(DIRECT_CARDINALITY_LIMIT + " must be non-negative, got " + directCardinalityLimit);
        }
        this.directCardinalityLimit = directCardinalityLimit;
    }

    public int getBruteForceMaxVariables() {
        return bruteForceMaxVariables;
    }

    public void setBruteForceMaxVariables(int bruteForceMaxVariables) {
        if (bruteForceMaxVariables < 0 || bruteForceMaxVariables > 62){
            throw new IllegalArgumentException(BRUTE_FORCE_MAX_VARIABLES + " must be within 0..62, got " + bruteForceMaxVariables);
        }
        this.bruteForceMaxVariables = bruteForceMaxVariables;
    }
}
