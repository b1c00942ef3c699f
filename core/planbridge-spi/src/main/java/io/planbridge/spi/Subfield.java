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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Path to a column or to a nested element of a column, for example {@code a},
 * {@code a.b} or {@code a[1].c}.
 */
public record Subfield(String path)
{
    public Subfield
    {
        requireNonNull(path, "path is null");
        checkArgument(!path.isEmpty(), "path is empty");
    }

    public String getRootName()
    {
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.' || c == '[') {
                return path.substring(0, i);
            }
        }
        return path;
    }

    public boolean isColumn()
    {
        return getRootName().length() == path.length();
    }

    @Override
    public String toString()
    {
        return path;
    }
}
