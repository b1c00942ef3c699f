/*
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
package io.planbridge.filter;

import io.airlift.slice.Slice;

/**
 * Predicate over the values of a single column, pushed into a table scan.
 * Filters are immutable. A filter only answers tests for the value kind it
 * was built for; other tests fail with {@link UnsupportedOperationException}.
 */
public abstract class Filter
{
    private final boolean nullAllowed;

    protected Filter(boolean nullAllowed)
    {
        this.nullAllowed = nullAllowed;
    }

    public boolean isNullAllowed()
    {
        return nullAllowed;
    }

    public boolean testNull()
    {
        return nullAllowed;
    }

    public boolean testLong(long value)
    {
        throw unsupportedTest("long");
    }

    public boolean testDouble(double value)
    {
        throw unsupportedTest("double");
    }

    public boolean testFloat(float value)
    {
        throw unsupportedTest("float");
    }

    public boolean testBytes(Slice value)
    {
        throw unsupportedTest("bytes");
    }

    public boolean testBoolean(boolean value)
    {
        throw unsupportedTest("boolean");
    }

    private UnsupportedOperationException unsupportedTest(String valueKind)
    {
        return new UnsupportedOperationException(getClass().getSimpleName() + " does not support testing " + valueKind + " values");
    }
}
