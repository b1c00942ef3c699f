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

public record SortOrder(boolean ascending, boolean nullsFirst)
{
    public static final SortOrder ASC_NULLS_FIRST = new SortOrder(true, true);
    public static final SortOrder ASC_NULLS_LAST = new SortOrder(true, false);
    public static final SortOrder DESC_NULLS_FIRST = new SortOrder(false, true);
    public static final SortOrder DESC_NULLS_LAST = new SortOrder(false, false);

    @Override
    public String toString()
    {
        return (ascending ? "ASC" : "DESC") + (nullsFirst ? " NULLS FIRST" : " NULLS LAST");
    }
}
