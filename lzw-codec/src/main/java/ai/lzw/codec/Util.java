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
package ai.lzw.codec;

import ai.lzw.compress.MalformedInputException;

final class Util
{
    // codes are non-negative ints
    static final int MAX_BIT_DEPTH = Integer.SIZE - 1;

    private Util()
    {
    }

    /**
     * @return log2(value) rounded down, for {@code value > 0}
     */
    public static int log2Floor(long value)
    {
        checkArgument(value > 0, "log2Floor is undefined for " + value);
        return 63 - Long.numberOfLeadingZeros(value);
    }

    /**
     * @return the number of bits needed to tell {@code count} values apart, at least 1
     */
    public static int log2Ceil(long count)
    {
        if (count <= 1) {
            return 1;
        }
        return log2Floor(count - 1) + 1;
    }

    public static long mask(int bits)
    {
        return (1L << bits) - 1;
    }

    public static void verify(boolean condition, long offset, String reason)
    {
        if (!condition) {
            throw new MalformedInputException(offset, reason);
        }
    }

    public static void checkArgument(boolean condition, String reason)
    {
        if (!condition) {
            throw new IllegalArgumentException(reason);
        }
    }

    public static MalformedInputException fail(long offset, String reason)
    {
        throw new MalformedInputException(offset, reason);
    }
}
