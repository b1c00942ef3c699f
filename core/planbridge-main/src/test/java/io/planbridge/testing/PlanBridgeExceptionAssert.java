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
package io.planbridge.testing;

import io.planbridge.spi.ErrorCodeSupplier;
import io.planbridge.spi.PlanBridgeException;
import org.assertj.core.api.AbstractThrowableAssert;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

public final class PlanBridgeExceptionAssert
        extends AbstractThrowableAssert<PlanBridgeExceptionAssert, PlanBridgeException>
{
    public static PlanBridgeExceptionAssert assertPlanBridgeExceptionThrownBy(ThrowingCallable throwingCallable)
    {
        Throwable throwable = catchThrowable(throwingCallable);
        assertThat(throwable)
                .as("expected PlanBridgeException to be thrown")
                .isInstanceOf(PlanBridgeException.class);
        return new PlanBridgeExceptionAssert((PlanBridgeException) throwable);
    }

    private PlanBridgeExceptionAssert(PlanBridgeException actual)
    {
        super(actual, PlanBridgeExceptionAssert.class);
    }

    public PlanBridgeExceptionAssert hasErrorCode(ErrorCodeSupplier errorCodeSupplier)
    {
        assertThat(actual.getErrorCode())
                .as("error code of: %s", actual.getMessage())
                .isEqualTo(errorCodeSupplier.toErrorCode());
        return myself;
    }
}
