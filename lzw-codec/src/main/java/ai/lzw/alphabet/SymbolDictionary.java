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

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Maps the dense index space {@code [0, length)} onto symbol values and back.
 * The symbols are the concatenation of one or more disjoint {@link SymbolRange}s, in the
 * order given, so index 0 is the lower bound of the first range and the first index of each
 * following range continues where the previous one ended.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class SymbolDictionary
{
    private final List<SymbolRange> ranges;
    private final int[] offsets;
    private final int length;

    private SymbolDictionary(List<SymbolRange> ranges)
    {
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("A symbol dictionary needs at least one range");
        }
        this.ranges = ImmutableList.copyOf(ranges);
        this.offsets = new int[ranges.size()];

        long total = 0;
        for (int i = 0; i < ranges.size(); i++) {
            SymbolRange range = requireNonNull(ranges.get(i), "range is null");
            for (int j = 0; j < i; j++) {
                if (ranges.get(j).overlaps(range)) {
                    throw new IllegalArgumentException("Symbol range " + range + " overlaps " + ranges.get(j));
                }
            }
            offsets[i] = (int) total;
            total += range.length();
            if (total > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Symbol dictionary is too large: " + total + " symbols");
            }
        }
        this.length = (int) total;
    }

    public static SymbolDictionary of(SymbolRange... ranges)
    {
        return new SymbolDictionary(ImmutableList.copyOf(ranges));
    }

    public static SymbolDictionary of(List<SymbolRange> ranges)
    {
        return new SymbolDictionary(ranges);
    }

    /**
     * @return the number of symbols in this dictionary
     */
    public int length()
    {
        return length;
    }

    public List<SymbolRange> ranges()
    {
        return ranges;
    }

    public int minSymbol()
    {
        int min = Integer.MAX_VALUE;
        for (SymbolRange range : ranges) {
            min = Math.min(min, range.lower());
        }
        return min;
    }

    public int maxSymbol()
    {
        int max = Integer.MIN_VALUE;
        for (SymbolRange range : ranges) {
            max = Math.max(max, range.upper());
        }
        return max;
    }

    /**
     * @throws SymbolOutOfRangeException if {@code index} is negative or not less than {@link #length()}
     */
    public int symbolByIndex(long index)
    {
        if (index >= 0) {
            for (int i = 0; i < ranges.size(); i++) {
                SymbolRange range = ranges.get(i);
                if (index < (long) offsets[i] + range.length()) {
                    return range.lower() + (int) (index - offsets[i]);
                }
            }
        }
        throw new SymbolOutOfRangeException(index, "Symbol index out of range [0, " + length + ")");
    }

    /**
     * @throws SymbolOutOfRangeException if no range of this dictionary contains {@code symbol}
     */
    public int indexOfSymbol(int symbol)
    {
        for (int i = 0; i < ranges.size(); i++) {
            SymbolRange range = ranges.get(i);
            if (range.contains(symbol)) {
                return offsets[i] + (symbol - range.lower());
            }
        }
        throw new SymbolOutOfRangeException(symbol, "Symbol not in dictionary " + this);
    }

    public boolean contains(int symbol)
    {
        for (SymbolRange range : ranges) {
            if (range.contains(symbol)) {
                return true;
            }
        }
        return false;
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
        return ranges.equals(((SymbolDictionary) o).ranges);
    }

    @Override
    public int hashCode()
    {
        return ranges.hashCode();
    }

    @Override
    public String toString()
    {
        return "SymbolDictionary" + ranges;
    }
}
