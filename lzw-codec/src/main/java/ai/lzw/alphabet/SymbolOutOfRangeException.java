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

/**
 * A symbol, or a symbol index, is not covered by any range of a {@link SymbolDictionary}.
 */
public class SymbolOutOfRangeException
        extends IndexOutOfBoundsException
{
    private final long value;

    public SymbolOutOfRangeException(long value, String reason)
    {
        super(reason + ": " + value);
        this.value = value;
    }

    /**
     * @return the rejected symbol value or index
     */
    public long getValue()
    {
        return value;
    }
}
