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
package io.planbridge.plan;

import io.planbridge.spi.type.Type;
import jakarta.annotation.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Single row vector holding the value of a constant partitioning key.
 */
public record ConstantVector(Type type, @Nullable Object value)
{
    public ConstantVector
    {
        requireNonNull(type, "type is null");
    }

    public boolean isNull()
    {
        return value == null;
    }
}
