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

import java.util.Arrays;

/**
 * The codes of one encode pass together with the bit depth they need.
 */
final class EncodedCodes
{
    static final EncodedCodes EMPTY = new EncodedCodes(new int[0], 0, 0, 0);

    private final int[] codes;
    private final int count;
    private final int bitDepth;
    private final int dictionarySize;

    EncodedCodes(int[] codes, int count, int bitDepth, int dictionarySize)
    {
        this.codes = codes;
        this.count = count;
        this.bitDepth = bitDepth;
        this.dictionarySize = dictionarySize;
    }

    /**
     * @return the backing code array, valid up to {@link #count()}
     */
    int[] codes()
    {
        return codes;
    }

    int count()
    {
        return count;
    }

    boolean isEmpty()
    {
        return count == 0;
    }

    int bitDepth()
    {
        return bitDepth;
    }

    /**
     * @return the number of phrases in the encode dictionary when the pass ended
     */
    int dictionarySize()
    {
        return dictionarySize;
    }

    int[] toArray()
    {
        return Arrays.copyOf(codes, count);
    }
}
