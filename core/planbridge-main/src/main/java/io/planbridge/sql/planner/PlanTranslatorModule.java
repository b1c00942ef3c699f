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

import com.google.inject.Binder;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.expression.RowExpressionConverter;

import static io.airlift.configuration.ConfigBinder.configBinder;
import static io.airlift.json.JsonCodecBinder.jsonCodecBinder;

public class PlanTranslatorModule
        extends AbstractConfigurationAwareModule
{
    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(PlanTranslatorConfig.class);
        jsonCodecBinder(binder).bindJsonCodec(ShuffleWriteInfo.class);

        binder.bind(ExpressionConverter.class).to(RowExpressionConverter.class).in(Scopes.SINGLETON);
        binder.bind(PlanFragmentTranslatorFactory.class).in(Scopes.SINGLETON);
    }
}
