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

public enum JoinType
{
    INNER,
    LEFT,
    RIGHT,
    FULL,
    /**
     * Returns probe rows that have a match on the build side.
     */
    LEFT_SEMI_FILTER,
    /**
     * Returns all probe rows plus a boolean column telling whether each row has a match.
     */
    LEFT_SEMI_PROJECT,
    /**
     * Returns probe rows that have no match on the build side.
     */
    ANTI;

    public boolean isInnerJoin()
    {
        return this == INNER;
    }
}
