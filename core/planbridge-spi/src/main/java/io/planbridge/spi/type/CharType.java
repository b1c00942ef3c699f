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

public final class CharType
        extends Type
{
    private final int length;

    public static CharType createCharType(int length)
    {
        return new CharType(length);
    }

    private CharType(int length)
    {
        super(TypeKind.CHAR);
        checkArgument(length >= 0, "Invalid char length %s", length);
        this.length = length;
    }

    public int getLength()
    {
        return length;
    }

    @Override
    public String getDisplayName()
    {
        return "char(" + length + ")";
    }
}
