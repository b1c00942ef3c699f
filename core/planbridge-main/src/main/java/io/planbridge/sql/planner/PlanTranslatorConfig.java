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
package io.planbridge.sql.planner;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

public class PlanTranslatorConfig
{
    private ExecutionMode executionMode = ExecutionMode.INTERACTIVE;
    private String shuffleName = "local";

    public ExecutionMode getExecutionMode()
    {
        return executionMode;
    }

    @Config("plan-translator.execution-mode")
    @ConfigDescription("How fragments exchange data: over the network (INTERACTIVE) or through a shuffle service (BATCH)")
    public PlanTranslatorConfig setExecutionMode(ExecutionMode executionMode)
    {
        this.executionMode = executionMode;
        return this;
    }

    public String getShuffleName()
    {
        return shuffleName;
    }

    @Config("plan-translator.shuffle-name")
    @ConfigDescription("Name of the shuffle implementation used in batch execution")
    public PlanTranslatorConfig setShuffleName(String shuffleName)
    {
        this.shuffleName = shuffleName;
        return this;
    }
}
