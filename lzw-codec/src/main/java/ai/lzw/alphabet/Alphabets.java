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
 * Predefined symbol dictionaries.
 */
public final class Alphabets
{
    /** Raw bytes, as unsigned values */
    public static final SymbolDictionary BINARY_256 = SymbolDictionary.of(
            SymbolRange.of(0, 255));

    /** 7 bit ASCII */
    public static final SymbolDictionary ASCII_128 = SymbolDictionary.of(
            SymbolRange.of(0, 127));

    /** Printable UTF-16 code units, surrogates excluded */
    public static final SymbolDictionary UTF16_PACK = SymbolDictionary.of(
            SymbolRange.of(0x0020, 0xD7FF),
            SymbolRange.of(0xE000, 0xFFFF));

    /** URI-safe characters: [0-9A-Za-z] */
    public static final SymbolDictionary URI_PACK = SymbolDictionary.of(
            SymbolRange.of('0', '9'),
            SymbolRange.of('A', 'Z'),
            SymbolRange.of('a', 'z'));

    private Alphabets()
    {
    }
}
