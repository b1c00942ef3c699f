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
package io.planbridge.spi;

import static io.planbridge.spi.ErrorType.INTERNAL_ERROR;
import static io.planbridge.spi.ErrorType.USER_ERROR;

public enum StandardErrorCode
        implements ErrorCodeSupplier
{
    /**
     * The plan uses a node, value set, partitioning or execution strategy that this worker
     * cannot execute.
     */
    UNSUPPORTED_CONSTRUCT(0, USER_ERROR),
    /**
     * The plan breaks a contract the coordinator is expected to uphold.
     */
    INVARIANT_VIOLATION(1, INTERNAL_ERROR),
    INVALID_PLAN_ARGUMENT(2, USER_ERROR),
    /**/;

    private final ErrorCode errorCode;

    StandardErrorCode(int code, ErrorType type)
    {
        errorCode = new ErrorCode(code + 0x0700_0000, name(), type);
    }

    @Override
    public ErrorCode toErrorCode()
    {
        return errorCode;
    }
}
