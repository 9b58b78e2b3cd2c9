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

import com.danielgmyers.switchboard.ex.FlowUsageException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AttributeReferencesTest {

    @Test
    public void testWellFormedReferences() {
        Assertions.assertTrue(AttributeReferences.isWellFormed("$.Attributes.CustomerTier"));
        Assertions.assertTrue(AttributeReferences.isWellFormed("$.Lex.IntentName"));
        Assertions.assertTrue(AttributeReferences.isWellFormed("$.Channel"));
        Assertions.assertTrue(AttributeReferences.isWellFormed("$.External.result-code"));
        Assertions.assertEquals("$.Attributes.X", AttributeReferences.validate("$.Attributes.X"));
    }

    @Test
    public void testMalformedReferences() {
        Assertions.assertFalse(AttributeReferences.isWellFormed(null));
        Assertions.assertFalse(AttributeReferences.isWellFormed(""));
        Assertions.assertFalse(AttributeReferences.isWellFormed("Attributes.Tier"));
        Assertions.assertFalse(AttributeReferences.isWellFormed("$."));
        Assertions.assertFalse(AttributeReferences.isWellFormed("$.Attributes."));
        Assertions.assertFalse(AttributeReferences.isWellFormed("$.1Attributes"));
        Assertions.assertFalse(AttributeReferences.isWellFormed("$.Attributes.Customer Tier"));
        Assertions.assertThrows(FlowUsageException.class, () -> AttributeReferences.validate("tier"));
    }
}
