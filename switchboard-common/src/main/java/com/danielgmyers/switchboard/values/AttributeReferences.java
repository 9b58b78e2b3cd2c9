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

import java.util.regex.Pattern;

import com.danielgmyers.switchboard.ex.FlowUsageException;

/**
 * Syntax check for the attribute references a branch compares against, e.g. "$.Attributes.CustomerTier"
 * or "$.Lex.IntentName". Only the shape of the reference is checked; whether the attribute exists at runtime
 * is up to the flow runtime.
 */
public final class AttributeReferences {

    private static final Pattern REFERENCE
            = Pattern.compile("^\\$\\.[A-Za-z][A-Za-z0-9_]*(\\.[A-Za-z0-9_-]+)*$");

    private AttributeReferences() {}

    public static boolean isWellFormed(String reference) {
        return reference != null && REFERENCE.matcher(reference).matches();
    }

    public static String validate(String reference) {
        if (!isWellFormed(reference)) {
            throw new FlowUsageException("Attribute references must look like $.Namespace.Name, was: " + reference);
        }
        return reference;
    }
}
