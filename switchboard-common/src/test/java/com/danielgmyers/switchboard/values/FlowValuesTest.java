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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.switchboard.ex.FlowUsageException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FlowValuesTest {

    @Test
    public void testBooleansUseRuntimeCapitalization() {
        Assertions.assertEquals("True", FlowValues.toRuntimeString(true));
        Assertions.assertEquals("False", FlowValues.toRuntimeString(Boolean.FALSE));
    }

    @Test
    public void testIntegralTypes() {
        Assertions.assertEquals("42", FlowValues.toRuntimeString(42));
        Assertions.assertEquals("-7", FlowValues.toRuntimeString(-7L));
        Assertions.assertEquals("3", FlowValues.toRuntimeString((short) 3));
        Assertions.assertEquals("12", FlowValues.toRuntimeString((byte) 12));
        Assertions.assertEquals("123456789012345678901234567890",
                                FlowValues.toRuntimeString(new BigInteger("123456789012345678901234567890")));
    }

    @Test
    public void testDecimalsUsePlainNotation() {
        Assertions.assertEquals("2.5", FlowValues.toRuntimeString(2.50));
        Assertions.assertEquals("3", FlowValues.toRuntimeString(3.0));
        Assertions.assertEquals("0", FlowValues.toRuntimeString(0.0));
        Assertions.assertEquals("0", FlowValues.toRuntimeString(-0.0));
        Assertions.assertEquals("10000000000", FlowValues.toRuntimeString(1e10));
        Assertions.assertEquals("0.0001", FlowValues.toRuntimeString(1e-4));
        Assertions.assertEquals("1.5", FlowValues.toRuntimeString(1.5f));
        Assertions.assertEquals("100", FlowValues.toRuntimeString(new BigDecimal("1.00E+2")));
        Assertions.assertEquals("0", FlowValues.toRuntimeString(new BigDecimal("0.000")));
    }

    @Test
    public void testFloatsUseTheirOwnDecimalForm() {
        Assertions.assertEquals("0.1", FlowValues.toRuntimeString(0.1f));
        Assertions.assertEquals("1.1", FlowValues.toRuntimeString(1.1f));
        Assertions.assertEquals("100", FlowValues.toRuntimeString(100.0f));
        Assertions.assertEquals("0", FlowValues.toRuntimeString(-0.0f));
        Assertions.assertThrows(FlowUsageException.class, () -> FlowValues.toRuntimeString(Float.NaN));
    }

    @Test
    public void testStringsPassThrough() {
        Assertions.assertEquals("Sales", FlowValues.toRuntimeString("Sales"));
        Assertions.assertEquals("", FlowValues.toRuntimeString(""));
    }

    @Test
    public void testUnsupportedValuesAreRejected() {
        Assertions.assertThrows(FlowUsageException.class, () -> FlowValues.toRuntimeString(null));
        Assertions.assertThrows(FlowUsageException.class, () -> FlowValues.toRuntimeString(Double.NaN));
        Assertions.assertThrows(FlowUsageException.class, () -> FlowValues.toRuntimeString(Double.POSITIVE_INFINITY));
        Assertions.assertThrows(FlowUsageException.class, () -> FlowValues.toRuntimeString(Float.NEGATIVE_INFINITY));
        Assertions.assertThrows(FlowUsageException.class, () -> FlowValues.toRuntimeString(List.of("a")));
        Assertions.assertThrows(FlowUsageException.class, () -> FlowValues.toRuntimeString('c'));
    }

    @Test
    public void testAllIntegralTypesAreHandled() {
        for (Class<?> t : FlowValues.INTEGRAL_TYPES) {
            Assertions.assertTrue(Number.class.isAssignableFrom(t), t.getSimpleName());
        }
    }

    @Test
    public void testMapConversionKeepsOrder() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("Zeta", 1);
        raw.put("Alpha", true);
        raw.put("Mid", "text");

        Map<String, String> converted = FlowValues.toRuntimeStrings(raw);
        Assertions.assertEquals(List.of("Zeta", "Alpha", "Mid"), List.copyOf(converted.keySet()));
        Assertions.assertEquals("1", converted.get("Zeta"));
        Assertions.assertEquals("True", converted.get("Alpha"));
        Assertions.assertEquals("text", converted.get("Mid"));
    }

    @Test
    public void testMapConversionNamesTheBadParameter() {
        FlowUsageException e = Assertions.assertThrows(FlowUsageException.class,
                () -> FlowValues.toRuntimeStrings(Collections.singletonMap("Timeout", Double.NaN)));
        Assertions.assertTrue(e.getMessage().contains("Timeout"), e.getMessage());
        Assertions.assertTrue(e.getCause() instanceof FlowUsageException);
    }

    @Test
    public void testMapConversionRejectsBlankNames() {
        Assertions.assertThrows(FlowUsageException.class,
                                () -> FlowValues.toRuntimeStrings(Collections.singletonMap("", "x")));
        Assertions.assertThrows(FlowUsageException.class,
                                () -> FlowValues.toRuntimeStrings(Collections.singletonMap(null, "x")));
    }
}
