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
package io.planbridge.spi.type;

import static com.google.common.base.Preconditions.checkArgument;

public final class DecimalType
        extends Type
{
    public static final int MAX_PRECISION = 38;
    public static final int MAX_SHORT_PRECISION = 18;

    private final int precision;
    private final int scale;

    public static DecimalType createDecimalType(int precision, int scale)
    {
        return new DecimalType(precision, scale);
    }

    private DecimalType(int precision, int scale)
    {
        super(TypeKind.DECIMAL);
        checkArgument(precision > 0 && precision <= MAX_PRECISION, "Invalid decimal precision %s", precision);
        checkArgument(scale >= 0 && scale <= precision, "Invalid decimal scale %s for precision %s", scale, precision);
        this.precision = precision;
        this.scale = scale;
    }

    public int getPrecision()
    {
        return precision;
    }

    public int getScale()
    {
        return scale;
    }

    public boolean isShort()
    {
        return precision <= MAX_SHORT_PRECISION;
    }

    @Override
    public String getDisplayName()
    {
        return "decimal(" + precision + "," + scale + ")";
    }
}
