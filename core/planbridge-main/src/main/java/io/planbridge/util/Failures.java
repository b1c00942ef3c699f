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
package io.planbridge.util;

import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import io.planbridge.spi.ErrorCodeSupplier;
import io.planbridge.spi.PlanBridgeException;

import static io.planbridge.spi.StandardErrorCode.INVARIANT_VIOLATION;
import static io.planbridge.spi.StandardErrorCode.UNSUPPORTED_CONSTRUCT;
import static java.lang.String.format;

public final class Failures
{
    private Failures() {}

    public static void checkCondition(boolean condition, ErrorCodeSupplier errorCode, String message)
    {
        if (!condition) {
            throw new PlanBridgeException(errorCode, message);
        }
    }

    @FormatMethod
    public static void checkCondition(boolean condition, ErrorCodeSupplier errorCode, @FormatString String formatString, Object... arguments)
    {
        if (!condition) {
            throw new PlanBridgeException(errorCode, format(formatString, arguments));
        }
    }

    @FormatMethod
    public static void checkInvariant(boolean condition, @FormatString String formatString, Object... arguments)
    {
        if (!condition) {
            throw invariantViolation(formatString, arguments);
        }
    }

    @FormatMethod
    public static void checkSupported(boolean condition, @FormatString String formatString, Object... arguments)
    {
        if (!condition) {
            throw unsupported(formatString, arguments);
        }
    }

    @FormatMethod
    public static PlanBridgeException unsupported(@FormatString String formatString, Object... arguments)
    {
        return new PlanBridgeException(UNSUPPORTED_CONSTRUCT, format(formatString, arguments));
    }

    @FormatMethod
    public static PlanBridgeException invariantViolation(@FormatString String formatString, Object... arguments)
    {
        return new PlanBridgeException(INVARIANT_VIOLATION, format(formatString, arguments));
    }
}
