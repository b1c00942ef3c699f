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

import com.google.common.collect.ImmutableMap;
import com.google.inject.Injector;
import io.airlift.bootstrap.Bootstrap;
import io.airlift.bootstrap.LifeCycleManager;
import io.airlift.json.JsonCodec;
import io.airlift.json.JsonModule;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static io.airlift.json.JsonCodec.jsonCodec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestPlanTranslatorModule
{
    private static final ShuffleWriteInfo SHUFFLE_WRITE_INFO = new ShuffleWriteInfo("/tmp/shuffle", "20231017_101010_00001_abcde", 3, 8);

    @Test
    public void testInteractiveByDefault()
            throws Exception
    {
        Injector injector = initialize(ImmutableMap.of());
        try {
            PlanFragmentTranslatorFactory factory = injector.getInstance(PlanFragmentTranslatorFactory.class);
            assertThat(factory.create()).isInstanceOf(InteractivePlanFragmentTranslator.class);
            assertThat(injector.getInstance(PlanFragmentTranslatorFactory.class)).isSameAs(factory);
            assertThatThrownBy(() -> factory.create(Optional.of(SHUFFLE_WRITE_INFO)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Shuffle write info is only supported in batch execution");
        }
        finally {
            injector.getInstance(LifeCycleManager.class).stop();
        }
    }

    @Test
    public void testBatch()
            throws Exception
    {
        Injector injector = initialize(ImmutableMap.of(
                "plan-translator.execution-mode", "BATCH",
                "plan-translator.shuffle-name", "hdfs"));
        try {
            PlanFragmentTranslatorFactory factory = injector.getInstance(PlanFragmentTranslatorFactory.class);
            assertThat(factory.create()).isInstanceOf(BatchPlanFragmentTranslator.class);
            assertThat(factory.create(Optional.of(SHUFFLE_WRITE_INFO))).isInstanceOf(BatchPlanFragmentTranslator.class);
        }
        finally {
            injector.getInstance(LifeCycleManager.class).stop();
        }
    }

    @Test
    public void testShuffleWriteInfoJson()
    {
        JsonCodec<ShuffleWriteInfo> codec = jsonCodec(ShuffleWriteInfo.class);
        String json = codec.toJson(SHUFFLE_WRITE_INFO);
        assertThat(json).contains("rootPath", "queryId", "shuffleId", "numPartitions");
        assertThat(codec.fromJson(json)).isEqualTo(SHUFFLE_WRITE_INFO);
    }

    private static Injector initialize(Map<String, String> properties)
            throws Exception
    {
        return new Bootstrap(new JsonModule(), new PlanTranslatorModule())
                .doNotInitializeLogging()
                .setRequiredConfigurationProperties(properties)
                .initialize();
    }
}
