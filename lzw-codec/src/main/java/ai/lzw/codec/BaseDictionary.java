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

import ai.lzw.alphabet.SymbolDictionary;
import ai.lzw.alphabet.SymbolOutOfRangeException;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single-symbol phrases every encode and decode pass starts from: code {@code i} is the
 * symbol at index {@code i} of the input alphabet. Depends only on the alphabet, so one
 * instance is built per codec and shared, read only, by all calls.
 */
final class BaseDictionary
{
    private static final Logger log = Logger.getLogger(BaseDictionary.class.getName());

    // symbol spans up to this size get a direct symbol -> code table
    private static final int MAX_DIRECT_SPAN = 1 << 17;

    private final SymbolDictionary alphabet;
    private final int[] symbols;
    private final int minSymbol;
    private final int[] codes;

    private BaseDictionary(SymbolDictionary alphabet)
    {
        this.alphabet = alphabet;
        this.symbols = new int[alphabet.length()];
        for (int code = 0; code < symbols.length; code++) {
            symbols[code] = alphabet.symbolByIndex(code);
        }

        this.minSymbol = alphabet.minSymbol();
        long span = (long) alphabet.maxSymbol() - minSymbol + 1;
        if (span <= MAX_DIRECT_SPAN) {
            codes = new int[(int) span];
            Arrays.fill(codes, -1);
            for (int code = 0; code < symbols.length; code++) {
                codes[symbols[code] - minSymbol] = code;
            }
        }
        else {
            codes = null;
        }
    }

    static BaseDictionary of(SymbolDictionary alphabet)
    {
        BaseDictionary dictionary = new BaseDictionary(alphabet);
        log.log(Level.FINE, () -> "Built base dictionary of " + dictionary.size() + " phrases for " + alphabet);
        return dictionary;
    }

    int size()
    {
        return symbols.length;
    }

    /**
     * @throws SymbolOutOfRangeException if the symbol is not in the input alphabet
     */
    int codeOf(int symbol)
    {
        if (codes == null) {
            return alphabet.indexOfSymbol(symbol);
        }
        long slot = (long) symbol - minSymbol;
        if (slot >= 0 && slot < codes.length && codes[(int) slot] >= 0) {
            return codes[(int) slot];
        }
        throw new SymbolOutOfRangeException(symbol, "Symbol not in dictionary " + alphabet);
    }

    /**
     * Copies the symbol of every base code, in code order, to {@code target}.
     */
    void copySymbols(int[] target)
    {
        System.arraycopy(symbols, 0, target, 0, symbols.length);
    }
}
