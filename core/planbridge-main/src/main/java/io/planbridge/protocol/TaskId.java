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

import com.google.common.base.Splitter;
import io.planbridge.spi.PlanBridgeException;

import java.util.List;

import static io.planbridge.spi.StandardErrorCode.INVALID_PLAN_ARGUMENT;
import static io.planbridge.util.Failures.checkCondition;
import static java.util.Objects.requireNonNull;

/**
 * Task identifier of the form {@code queryId.stageId.stageExecutionId.id.attemptNumber}.
 */
public record TaskId(String queryId, int stageId, int stageExecutionId, int id, int attemptNumber)
{
    private static final Splitter DOT_SPLITTER = Splitter.on('.');

    public TaskId
    {
        requireNonNull(queryId, "queryId is null");
    }

    public static TaskId valueOf(String taskId)
    {
        List<String> parts = DOT_SPLITTER.splitToList(taskId);
        checkCondition(parts.size() == 5, INVALID_PLAN_ARGUMENT, "Invalid task id: %s", taskId);
        try {
            return new TaskId(
                    parts.get(0),
                    Integer.parseInt(parts.get(1)),
                    Integer.parseInt(parts.get(2)),
                    Integer.parseInt(parts.get(3)),
                    Integer.parseInt(parts.get(4)));
        }
        catch (NumberFormatException e) {
            throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Invalid task id: " + taskId, e);
        }
    }

    @Override
    public String toString()
    {
        return queryId + "." + stageId + "." + stageExecutionId + "." + id + "." + attemptNumber;
    }
}
