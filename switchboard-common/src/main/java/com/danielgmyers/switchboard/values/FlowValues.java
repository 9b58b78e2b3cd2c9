/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */


package com.danielgmyers.switchboard.values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.danielgmyers.switchboard.ex.FlowUsageException;

/**
 * Utility class for converting case values and parameter values into the string form the flow runtime expects.
 *
 * The rules are:
 * - Booleans become "True" or "False".
 * - Integral numbers (Byte, Short, Integer, Long, BigInteger) use their plain decimal form.
 * - Floating point and BigDecimal values use plain (non-scientific) notation with trailing zeros stripped,
 *   so 2.50 becomes "2.5" and 3.0 becomes "3". The output never depends on the default locale.
 * - Strings are passed through unchanged.
 * Anything else, including null, NaN and the infinities, is rejected.
 */
public final class FlowValues {

    // Visible for testing.
    static final Set<Class<?>> INTEGRAL_TYPES
            = Set.of(Byte.class, Short.class, Integer.class, Long.class, BigInteger.class);

    private FlowValues() {}

    /**
     * Converts a single value. Throws FlowUsageException if the value's type is not supported.
     */
    public static String toRuntimeString(Object value) {
        if (value == null) {
            throw new FlowUsageException("Flow values must not be null.");
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "True" : "False";
        }
        if (INTEGRAL_TYPES.contains(value.getClass())) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new FlowUsageException("Flow values must be finite numbers. Was: " + value);
            }
            // Float.toString gives the shortest decimal that reads back as the same float.
            if (value instanceof Float) {
                return plain(new BigDecimal(Float.toString((Float) value)));
            }
            return plain(BigDecimal.valueOf(d));
        }
        if (value instanceof BigDecimal) {
            return plain((BigDecimal) value);
        }
        String message = String.format("Flow values can be Boolean, a number, or String. Was: %s",
                                       value.getClass().getSimpleName());
        throw new FlowUsageException(message);
    }

    /**
     * Converts every value of the map, keeping the map's iteration order.
     */
    public static Map<String, String> toRuntimeStrings(Map<String, ?> rawParameters) {
        Map<String, String> converted = new LinkedHashMap<>();
        for (Entry<String, ?> entry : rawParameters.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                throw new FlowUsageException("Parameter names must not be blank.");
            }
            try {
                converted.put(entry.getKey(), toRuntimeString(entry.getValue()));
            } catch (FlowUsageException e) {
                throw new FlowUsageException("Invalid value for parameter " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        return converted;
    }

    private static String plain(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
