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
package io.planbridge.protocol.predicate;

import com.google.common.collect.ImmutableMap;
import io.planbridge.spi.Subfield;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Conjunction of per-column domains. An empty map of domains means no
 * constraint; an absent map means no row can match.
 */
public record TupleDomain(Optional<Map<Subfield, Domain>> domains)
{
    public TupleDomain
    {
        domains = requireNonNull(domains, "domains is null").map(ImmutableMap::copyOf);
    }

    public static TupleDomain all()
    {
        return new TupleDomain(Optional.of(ImmutableMap.of()));
    }

    public static TupleDomain none()
    {
        return new TupleDomain(Optional.empty());
    }

    public static TupleDomain withColumnDomains(Map<Subfield, Domain> domains)
    {
        return new TupleDomain(Optional.of(domains));
    }

    public boolean isNone()
    {
        return domains.isEmpty();
    }
}
