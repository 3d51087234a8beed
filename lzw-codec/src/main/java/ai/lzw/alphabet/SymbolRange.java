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
package ai.lzw.alphabet;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Non-empty continuous range of symbol values, {@code [lower, upper]} inclusive.
 */
public final class SymbolRange
{
    private final int lower;
    private final int upper;

    public SymbolRange(int lower, int upper)
    {
        if (lower > upper) {
            throw new IllegalArgumentException("Invalid symbol range bounds: [" + lower + ", " + upper + "]");
        }
        this.lower = lower;
        this.upper = upper;
    }

    public static SymbolRange of(int lower, int upper)
    {
        return new SymbolRange(lower, upper);
    }

    public static SymbolRange of(char lower, char upper)
    {
        return new SymbolRange(lower, upper);
    }

    public int lower()
    {
        return lower;
    }

    public int upper()
    {
        return upper;
    }

    public long length()
    {
        return (long) upper - lower + 1;
    }

    public boolean contains(int symbol)
    {
        return lower <= symbol && symbol <= upper;
    }

    boolean overlaps(SymbolRange other)
    {
        return lower <= other.upper && other.lower <= upper;
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
        SymbolRange that = (SymbolRange) o;
        return lower == that.lower &&
                upper == that.upper;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString()
    {
        return new StringJoiner(", ", "[", "]")
                .add(Integer.toString(lower))
                .add(Integer.toString(upper))
                .toString();
    }
}
