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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Parameters of the shuffle a batch fragment writes its output to. They are
 * passed to the shuffle write node in serialized form.
 */
public class ShuffleWriteInfo
{
    private final String rootPath;
    private final String queryId;
    private final int shuffleId;
    private final int numPartitions;

    @JsonCreator
    public ShuffleWriteInfo(
            @JsonProperty("rootPath") String rootPath,
            @JsonProperty("queryId") String queryId,
            @JsonProperty("shuffleId") int shuffleId,
            @JsonProperty("numPartitions") int numPartitions)
    {
        this.rootPath = requireNonNull(rootPath, "rootPath is null");
        this.queryId = requireNonNull(queryId, "queryId is null");
        checkArgument(shuffleId >= 0, "shuffleId is negative");
        checkArgument(numPartitions > 0, "numPartitions must be positive");
        this.shuffleId = shuffleId;
        this.numPartitions = numPartitions;
    }

    @JsonProperty
    public String getRootPath()
    {
        return rootPath;
    }

    @JsonProperty
    public String getQueryId()
    {
        return queryId;
    }

    @JsonProperty
    public int getShuffleId()
    {
        return shuffleId;
    }

    @JsonProperty
    public int getNumPartitions()
    {
        return numPartitions;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ShuffleWriteInfo that = (ShuffleWriteInfo) o;
        return shuffleId == that.shuffleId &&
                numPartitions == that.numPartitions &&
                rootPath.equals(that.rootPath) &&
                queryId.equals(that.queryId);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(rootPath, queryId, shuffleId, numPartitions);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("rootPath", rootPath)
                .add("queryId", queryId)
                .add("shuffleId", shuffleId)
                .add("numPartitions", numPartitions)
                .toString();
    }
}
