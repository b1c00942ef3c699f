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

import com.google.common.collect.ImmutableList;
import io.airlift.slice.Slice;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.filter.AlwaysFalse;
import io.planbridge.filter.AlwaysTrue;
import io.planbridge.filter.BigintMultiRange;
import io.planbridge.filter.BigintRange;
import io.planbridge.filter.BoolValue;
import io.planbridge.filter.BytesRange;
import io.planbridge.filter.BytesValues;
import io.planbridge.filter.DoubleRange;
import io.planbridge.filter.Filter;
import io.planbridge.filter.FloatRange;
import io.planbridge.filter.IsNotNull;
import io.planbridge.filter.IsNull;
import io.planbridge.filter.MultiRange;
import io.planbridge.filter.NegatedBigintRange;
import io.planbridge.filter.NegatedBytesRange;
import io.planbridge.filter.NegatedBytesValues;
import io.planbridge.protocol.expression.Block;
import io.planbridge.protocol.predicate.AllOrNoneValueSet;
import io.planbridge.protocol.predicate.Domain;
import io.planbridge.protocol.predicate.EquatableValueSet;
import io.planbridge.protocol.predicate.Range;
import io.planbridge.protocol.predicate.SortedRangeSet;
import io.planbridge.spi.type.Type;
import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.airlift.slice.Slices.EMPTY_SLICE;
import static io.planbridge.filter.Filters.createBigintValues;
import static io.planbridge.filter.Filters.createNegatedBigintValues;
import static io.planbridge.spi.type.TypeSignatureParser.parseTypeSignature;
import static io.planbridge.util.Failures.checkInvariant;
import static io.planbridge.util.Failures.invariantViolation;
import static io.planbridge.util.Failures.unsupported;
import static java.util.Objects.requireNonNull;

/**
 * Compiles the value domain of a column into a {@link Filter} evaluated by the scan.
 * Ranges are expected ascending and disjoint; inputs breaking that order compile
 * to a generic {@link MultiRange}.
 */
public class DomainFilterCompiler
{
    private final ExpressionConverter expressionConverter;

    public DomainFilterCompiler(ExpressionConverter expressionConverter)
    {
        this.expressionConverter = requireNonNull(expressionConverter, "expressionConverter is null");
    }

    public Filter compile(Domain domain)
    {
        boolean nullAllowed = domain.nullAllowed();
        if (domain.values() instanceof SortedRangeSet rangeSet) {
            return compileRanges(parseTypeSignature(rangeSet.type()), rangeSet.ranges(), nullAllowed);
        }
        if (domain.values() instanceof EquatableValueSet valueSet) {
            if (valueSet.isNone()) {
                // an empty whitelist without nulls matches nothing and is rejected rather than compiled to is-not-null
                checkInvariant(nullAllowed, "Unexpected always-false filter");
                return new IsNull();
            }
            if (valueSet.isAll()) {
                return nullAllowed ? new AlwaysTrue() : new IsNotNull();
            }
            throw unsupported("EquatableValueSet with non-empty entries is not supported: %s", valueSet.type());
        }
        if (domain.values() instanceof AllOrNoneValueSet valueSet) {
            throw unsupported("AllOrNoneValueSet is not supported: %s", valueSet.type());
        }
        throw unsupported("Unsupported value set: %s", domain.values());
    }

    private Filter compileRanges(Type type, List<Range> ranges, boolean nullAllowed)
    {
        if (ranges.isEmpty()) {
            checkInvariant(nullAllowed, "Unexpected always-false filter");
            return new IsNull();
        }

        if (ranges.size() == 1) {
            Range range = ranges.get(0);
            if (RangeBounds.isFullyUnbounded(range) && !nullAllowed) {
                return new IsNotNull();
            }
            return toFilter(type, range, nullAllowed);
        }

        if (type.getKind().isIntegral()) {
            List<BigintRange> bigintRanges = new ArrayList<>(ranges.size());
            for (Range range : ranges) {
                bigintRanges.add(toBigintRange(type, range, nullAllowed));
            }
            return combineIntegerRanges(bigintRanges, nullAllowed);
        }

        switch (type.getKind()) {
            case VARCHAR: {
                List<BytesRange> bytesRanges = new ArrayList<>(ranges.size());
                for (Range range : ranges) {
                    bytesRanges.add(toBytesRange(type, range, nullAllowed));
                }
                return combineBytesRanges(bytesRanges, nullAllowed);
            }
            case BOOLEAN:
                return combineBooleanRanges(type, ranges, nullAllowed);
            default: {
                List<Filter> filters = new ArrayList<>(ranges.size());
                for (Range range : ranges) {
                    filters.add(toFilter(type, range, nullAllowed));
                }
                return new MultiRange(filters, nullAllowed);
            }
        }
    }

    private Filter toFilter(Type type, Range range, boolean nullAllowed)
    {
        switch (type.getKind()) {
            case TINYINT:
            case SMALLINT:
            case INTEGER:
            case BIGINT:
                return toBigintRange(type, range, nullAllowed);
            case DOUBLE:
                return toDoubleRange(type, range, nullAllowed);
            case REAL:
                return toFloatRange(type, range, nullAllowed);
            case VARCHAR:
                return toBytesRange(type, range, nullAllowed);
            case BOOLEAN:
                return toBooleanFilter(type, range, nullAllowed);
            case DATE:
                return toDateRange(type, range, nullAllowed);
            default:
                throw unsupported("Unsupported range type: %s", type);
        }
    }

    private BigintRange toBigintRange(Type type, Range range, boolean nullAllowed)
    {
        RangeBounds<Long> bounds = RangeBounds.of(range, block -> decode(type, block, Number.class).longValue());
        return new BigintRange(
                RangeBounds.inclusiveLower(bounds, Long.MIN_VALUE),
                RangeBounds.inclusiveUpper(bounds, Long.MAX_VALUE),
                nullAllowed);
    }

    private BigintRange toDateRange(Type type, Range range, boolean nullAllowed)
    {
        RangeBounds<Long> bounds = RangeBounds.of(range, block -> decode(type, block, LocalDate.class).toEpochDay());
        return new BigintRange(
                RangeBounds.inclusiveLower(bounds, Integer.MIN_VALUE),
                RangeBounds.inclusiveUpper(bounds, Integer.MAX_VALUE),
                nullAllowed);
    }

    private DoubleRange toDoubleRange(Type type, Range range, boolean nullAllowed)
    {
        RangeBounds<Double> bounds = RangeBounds.of(range, block -> decode(type, block, Number.class).doubleValue());
        return new DoubleRange(
                bounds.lower().orElse(-Double.MAX_VALUE),
                bounds.isLowerUnbounded(),
                bounds.lowerExclusive(),
                bounds.upper().orElse(Double.MAX_VALUE),
                bounds.isUpperUnbounded(),
                bounds.upperExclusive(),
                nullAllowed);
    }

    private FloatRange toFloatRange(Type type, Range range, boolean nullAllowed)
    {
        RangeBounds<Float> bounds = RangeBounds.of(range, block -> decode(type, block, Number.class).floatValue());
        return new FloatRange(
                bounds.lower().orElse(-Float.MAX_VALUE),
                bounds.isLowerUnbounded(),
                bounds.lowerExclusive(),
                bounds.upper().orElse(Float.MAX_VALUE),
                bounds.isUpperUnbounded(),
                bounds.upperExclusive(),
                nullAllowed);
    }

    private BytesRange toBytesRange(Type type, Range range, boolean nullAllowed)
    {
        RangeBounds<Slice> bounds = RangeBounds.of(range, block -> decode(type, block, Slice.class));
        return new BytesRange(
                bounds.lower().orElse(EMPTY_SLICE),
                bounds.isLowerUnbounded(),
                bounds.lowerExclusive(),
                bounds.upper().orElse(EMPTY_SLICE),
                bounds.isUpperUnbounded(),
                bounds.upperExclusive(),
                nullAllowed);
    }

    /**
     * The coordinator normalizes boolean ranges, so a range is either a single
     * value or bounded on one side only. {@code [FALSE, TRUE)} for example
     * arrives as {@code (-inf, TRUE)}.
     */
    private Filter toBooleanFilter(Type type, Range range, boolean nullAllowed)
    {
        RangeBounds<Boolean> bounds = RangeBounds.of(range, block -> decode(type, block, Boolean.class));

        if (!bounds.isLowerUnbounded() && !bounds.isUpperUnbounded()) {
            checkInvariant(
                    bounds.lowerValue().equals(bounds.upperValue()),
                    "Boolean range should not be [FALSE, TRUE] after coordinator optimization");
            return new BoolValue(bounds.lowerValue(), nullAllowed);
        }
        checkInvariant(
                bounds.isLowerUnbounded() != bounds.isUpperUnbounded(),
                "Boolean range must be bounded on exactly one side");

        if (!bounds.isLowerUnbounded()) {
            boolean value = bounds.lowerValue();
            // (TRUE, +inf) matches nothing
            if (bounds.lowerExclusive() && value) {
                return nullAllowed ? new IsNull() : new AlwaysFalse();
            }
            checkInvariant(bounds.lowerExclusive() || value, "Unexpected boolean range [FALSE, +inf)");
            return new BoolValue(true, nullAllowed);
        }

        boolean value = bounds.upperValue();
        // (-inf, FALSE) matches nothing
        if (bounds.upperExclusive() && !value) {
            return nullAllowed ? new IsNull() : new AlwaysFalse();
        }
        checkInvariant(bounds.upperExclusive() || !value, "Unexpected boolean range (-inf, TRUE]");
        return new BoolValue(false, nullAllowed);
    }

    private Filter combineBooleanRanges(Type type, List<Range> ranges, boolean nullAllowed)
    {
        checkInvariant(ranges.size() == 2, "Boolean domain must have exactly two ranges, found %s", ranges.size());
        Filter booleanFilter = null;
        for (Range range : ranges) {
            Filter filter = toBooleanFilter(type, range, nullAllowed);
            if (filter instanceof AlwaysFalse || filter instanceof IsNull) {
                continue;
            }
            checkInvariant(booleanFilter == null, "Boolean domain cannot have two value ranges");
            booleanFilter = filter;
        }
        if (booleanFilter == null) {
            throw invariantViolation("Boolean domain has no value range");
        }
        return booleanFilter;
    }

    static Filter combineIntegerRanges(List<BigintRange> ranges, boolean nullAllowed)
    {
        if (ranges.stream().allMatch(BigintRange::isSingleValue)) {
            LongArrayList values = new LongArrayList(ranges.size());
            for (BigintRange range : ranges) {
                values.add(range.getLower());
            }
            return createBigintValues(values, nullAllowed);
        }

        if (!isAscendingAndDisjoint(ranges)) {
            return new MultiRange(ranges, nullAllowed);
        }

        BigintRange first = ranges.get(0);
        BigintRange last = ranges.get(ranges.size() - 1);
        if (ranges.size() == 2 && first.getLower() == Long.MIN_VALUE && last.getUpper() == Long.MAX_VALUE && first.getUpper() + 1 < last.getLower()) {
            return new NegatedBigintRange(first.getUpper() + 1, last.getLower() - 1, nullAllowed);
        }

        // Ranges tiling the whole domain except isolated points are the negation of those points
        LongArrayList rejectedValues = new LongArrayList();
        if (first.getLower() == Long.MIN_VALUE + 1) {
            rejectedValues.add(Long.MIN_VALUE);
        }
        else if (first.getLower() != Long.MIN_VALUE) {
            return new BigintMultiRange(ranges, nullAllowed);
        }
        rejectedValues.add(first.getUpper() + 1);

        boolean foundMaximum = false;
        for (int i = 1; i < ranges.size(); i++) {
            BigintRange previous = ranges.get(i - 1);
            BigintRange current = ranges.get(i);
            if (previous.getUpper() > Long.MAX_VALUE - 2 || current.getLower() != previous.getUpper() + 2) {
                break;
            }
            if (current.getUpper() == Long.MAX_VALUE) {
                foundMaximum = true;
                break;
            }
            rejectedValues.add(current.getUpper() + 1);
            if (current.getUpper() == Long.MAX_VALUE - 1 && i == ranges.size() - 1) {
                foundMaximum = true;
                break;
            }
        }

        if (foundMaximum) {
            return createNegatedBigintValues(rejectedValues, nullAllowed);
        }
        return new BigintMultiRange(ranges, nullAllowed);
    }

    static Filter combineBytesRanges(List<BytesRange> ranges, boolean nullAllowed)
    {
        if (ranges.stream().allMatch(BytesRange::isSingleValue)) {
            ImmutableList.Builder<Slice> values = ImmutableList.builderWithExpectedSize(ranges.size());
            for (BytesRange range : ranges) {
                values.add(range.getLower());
            }
            return new BytesValues(values.build(), nullAllowed);
        }

        if (ranges.stream().allMatch(range -> range.isLowerExclusive() && range.isUpperExclusive())) {
            // Every bounded side must be paired with the same value on a neighboring range
            int lowerUnbounded = 0;
            int upperUnbounded = 0;
            Set<Slice> unmatched = new HashSet<>();
            List<Slice> rejectedValues = new ArrayList<>(ranges.size());
            for (BytesRange range : ranges) {
                if (range.isLowerUnbounded()) {
                    lowerUnbounded++;
                }
                else {
                    matchBound(range.getLower(), unmatched, rejectedValues);
                }
                if (range.isUpperUnbounded()) {
                    upperUnbounded++;
                }
                else {
                    matchBound(range.getUpper(), unmatched, rejectedValues);
                }
            }
            if (lowerUnbounded == 1 && upperUnbounded == 1 && unmatched.isEmpty()) {
                return new NegatedBytesValues(rejectedValues, nullAllowed);
            }
        }

        if (ranges.size() == 2 && ranges.get(0).isLowerUnbounded() && ranges.get(1).isUpperUnbounded()) {
            return new NegatedBytesRange(
                    ranges.get(0).getUpper(),
                    false,
                    !ranges.get(0).isUpperExclusive(),
                    ranges.get(1).getLower(),
                    false,
                    !ranges.get(1).isLowerExclusive(),
                    nullAllowed);
        }

        return new MultiRange(ranges, nullAllowed);
    }

    private static void matchBound(Slice bound, Set<Slice> unmatched, List<Slice> rejectedValues)
    {
        if (unmatched.remove(bound)) {
            rejectedValues.add(bound);
        }
        else {
            unmatched.add(bound);
        }
    }

    private static boolean isAscendingAndDisjoint(List<BigintRange> ranges)
    {
        for (int i = 0; i < ranges.size(); i++) {
            BigintRange range = ranges.get(i);
            if (range.getLower() > range.getUpper()) {
                return false;
            }
            if (i > 0 && range.getLower() <= ranges.get(i - 1).getUpper()) {
                return false;
            }
        }
        return true;
    }

    private <T> T decode(Type type, Block block, Class<T> javaType)
    {
        Object value = expressionConverter.getConstantValue(type, block);
        checkInvariant(value != null, "Range bound of type %s cannot be null", type);
        checkInvariant(javaType.isInstance(value), "Unexpected value for type %s: %s", type, value.getClass().getSimpleName());
        return javaType.cast(value);
    }
}
