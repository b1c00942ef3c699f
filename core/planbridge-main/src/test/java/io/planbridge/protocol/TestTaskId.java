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
package io.planbridge.protocol;

import org.junit.jupiter.api.Test;

import static io.planbridge.spi.StandardErrorCode.INVALID_PLAN_ARGUMENT;
import static io.planbridge.testing.PlanBridgeExceptionAssert.assertPlanBridgeExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

public class TestTaskId
{
    @Test
    public void testParse()
    {
        TaskId taskId = TaskId.valueOf("20231017_101010_00001_abcde.3.0.12.1");
        assertThat(taskId.queryId()).isEqualTo("20231017_101010_00001_abcde");
        assertThat(taskId.stageId()).isEqualTo(3);
        assertThat(taskId.stageExecutionId()).isEqualTo(0);
        assertThat(taskId.id()).isEqualTo(12);
        assertThat(taskId.attemptNumber()).isEqualTo(1);
        assertThat(taskId.toString()).isEqualTo("20231017_101010_00001_abcde.3.0.12.1");
    }

    @Test
    public void testInvalid()
    {
        assertPlanBridgeExceptionThrownBy(() -> TaskId.valueOf("query.1.2.3"))
                .hasErrorCode(INVALID_PLAN_ARGUMENT)
                .hasMessage("Invalid task id: query.1.2.3");
        assertPlanBridgeExceptionThrownBy(() -> TaskId.valueOf("query.1.x.3.0"))
                .hasErrorCode(INVALID_PLAN_ARGUMENT);
    }
}
