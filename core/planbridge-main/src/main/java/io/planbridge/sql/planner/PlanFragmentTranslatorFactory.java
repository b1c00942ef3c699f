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

import com.google.inject.Inject;
import io.airlift.json.JsonCodec;
import io.planbridge.expression.ExpressionConverter;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class PlanFragmentTranslatorFactory
{
    private final ExpressionConverter expressionConverter;
    private final ExecutionMode executionMode;
    private final String shuffleName;
    private final JsonCodec<ShuffleWriteInfo> shuffleWriteInfoCodec;

    @Inject
    public PlanFragmentTranslatorFactory(ExpressionConverter expressionConverter, PlanTranslatorConfig config, JsonCodec<ShuffleWriteInfo> shuffleWriteInfoCodec)
    {
        this.expressionConverter = requireNonNull(expressionConverter, "expressionConverter is null");
        requireNonNull(config, "config is null");
        this.executionMode = requireNonNull(config.getExecutionMode(), "executionMode is null");
        this.shuffleName = requireNonNull(config.getShuffleName(), "shuffleName is null");
        this.shuffleWriteInfoCodec = requireNonNull(shuffleWriteInfoCodec, "shuffleWriteInfoCodec is null");
    }

    public PlanFragmentTranslator create()
    {
        return create(Optional.empty());
    }

    /**
     * @param shuffleWriteInfo where the fragment writes its output; only valid in batch execution
     */
    public PlanFragmentTranslator create(Optional<ShuffleWriteInfo> shuffleWriteInfo)
    {
        switch (executionMode) {
            case INTERACTIVE:
                checkArgument(shuffleWriteInfo.isEmpty(), "Shuffle write info is only supported in batch execution");
                return new InteractivePlanFragmentTranslator(expressionConverter);
            case BATCH:
                return new BatchPlanFragmentTranslator(expressionConverter, shuffleName, shuffleWriteInfo.map(shuffleWriteInfoCodec::toJson));
        }
        throw new IllegalStateException("Unknown execution mode: " + executionMode);
    }
}
