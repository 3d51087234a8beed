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
import com.google.common.base.Suppliers;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import static ai.lzw.codec.Util.MAX_BIT_DEPTH;
import static ai.lzw.codec.Util.checkArgument;
import static ai.lzw.codec.Util.log2Ceil;
import static ai.lzw.codec.Util.log2Floor;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * LZW codec from one symbol alphabet to another.
 * <p>
 * Encoding compresses a sequence of input alphabet symbols into LZW codes and packs the codes
 * into symbols of the pack alphabet, so the result only contains characters of the pack alphabet
 * (URI-safe characters, printable UTF-16, bytes, ...). Decoding reverses both steps.
 * <p>
 * All codes of a stream share one bit depth, chosen after the whole input has been compressed,
 * so the complete code sequence is held in memory. Calls are independent and this class is
 * thread safe; the base dictionary of single symbol phrases is built on first use and shared.
 *
 * @see CodecType for the predefined alphabet pairs
 */
public final class LzwCodec
{
    private static final Logger log = Logger.getLogger(LzwCodec.class.getName());

    private final SymbolDictionary inputDictionary;
    private final SymbolDictionary packDictionary;
    private final int packCapacity;

    private final Supplier<BaseDictionary> baseDictionary;
    private final BitPacker packer;
    private final BitUnpacker unpacker;

    /**
     * @throws IllegalArgumentException if the pack alphabet cannot carry codes of the input alphabet
     */
    public LzwCodec(SymbolDictionary inputDictionary, SymbolDictionary packDictionary)
    {
        this.inputDictionary = requireNonNull(inputDictionary, "inputDictionary is null");
        this.packDictionary = requireNonNull(packDictionary, "packDictionary is null");

        checkArgument(packDictionary.length() >= 2, "Pack dictionary needs at least 2 symbols to carry a bit: " + packDictionary);
        this.packCapacity = log2Floor(packDictionary.length());
        checkArgument(packCapacity <= MAX_BIT_DEPTH,
                format("Pack dictionary carries %s bits per symbol, at most %s are supported", packCapacity, MAX_BIT_DEPTH));
        checkArgument(packDictionary.length() > log2Ceil(inputDictionary.length()),
                format("Pack dictionary of %s symbols is too small even for the %s bit codes of the input dictionary",
                        packDictionary.length(), log2Ceil(inputDictionary.length())));

        this.baseDictionary = Suppliers.memoize(() -> BaseDictionary.of(inputDictionary));
        this.packer = new BitPacker(packDictionary, packCapacity);
        this.unpacker = new BitUnpacker(packDictionary, packCapacity);

        log.log(Level.FINE, () -> "Created LZW codec " + inputDictionary + " -> " + packDictionary + ", " + packCapacity + " bits per packed symbol");
    }

    public SymbolDictionary inputDictionary()
    {
        return inputDictionary;
    }

    public SymbolDictionary packDictionary()
    {
        return packDictionary;
    }

    /**
     * @return number of payload bits carried by one pack symbol
     */
    public int packCapacity()
    {
        return packCapacity;
    }

    /**
     * Compresses input symbols into pack symbols. Empty input gives empty output.
     *
     * @throws ai.lzw.alphabet.SymbolOutOfRangeException if a symbol is not in the input dictionary
     * @throws CapacityExceededException if the codes need more bits than the pack dictionary can describe
     */
    public int[] encode(int[] symbols)
    {
        return encode(symbols, 0, symbols.length);
    }

    public int[] encode(int[] symbols, int offset, int length)
    {
        verifyRange(symbols, offset, length);
        EncodedCodes codes = encodeCodes(symbols, offset, length);
        if (codes.isEmpty()) {
            return new int[0];
        }

        int bitDepth = codes.bitDepth();
        if (bitDepth >= packDictionary.length()) {
            throw new CapacityExceededException(bitDepth, "Bit depth cannot be stored in a pack dictionary of " + packDictionary.length() + " symbols");
        }

        int[] packed = packer.pack(codes.codes(), codes.count(), bitDepth);
        log.log(Level.FINE, () -> format("Encoded %s symbols into %s codes of %s bits, %s packed symbols", length, codes.count(), bitDepth, packed.length));
        return packed;
    }

    /**
     * Decompresses pack symbols produced by {@link #encode(int[])}. Empty input gives empty output.
     *
     * @throws ai.lzw.compress.MalformedInputException if the input is not a valid packed stream
     */
    public int[] decode(int[] packed)
    {
        return decode(packed, 0, packed.length);
    }

    public int[] decode(int[] packed, int offset, int length)
    {
        verifyRange(packed, offset, length);
        if (length == 0) {
            return new int[0];
        }

        int[] codes = unpack(packed, offset, length);
        int[] symbols = decodeCodes(codes, codes.length);
        log.log(Level.FINE, () -> format("Decoded %s packed symbols into %s codes, %s symbols", length, codes.length, symbols.length));
        return symbols;
    }

    /**
     * Encodes the chars of {@code text}. Both dictionaries must hold UTF-16 code units.
     */
    public String encode(CharSequence text)
    {
        checkCharDictionary(packDictionary);
        return toText(encode(toSymbols(text)));
    }

    /**
     * Decodes text produced by {@link #encode(CharSequence)}.
     */
    public String decode(CharSequence packed)
    {
        checkCharDictionary(inputDictionary);
        return toText(decode(toSymbols(packed)));
    }

    EncodedCodes encodeCodes(int[] symbols, int offset, int length)
    {
        return new PhraseEncoder(baseDictionary.get()).encode(symbols, offset, length);
    }

    int[] decodeCodes(int[] codes, int count)
    {
        return new PhraseDecoder(baseDictionary.get()).decode(codes, count);
    }

    int[] pack(int[] codes, int bitDepth)
    {
        return packer.pack(codes, codes.length, bitDepth);
    }

    int[] unpack(int[] packed)
    {
        return unpack(packed, 0, packed.length);
    }

    int[] unpack(int[] packed, int offset, int length)
    {
        return unpacker.unpack(packed, offset, length);
    }

    /**
     * @return number of pack symbols, header included, for {@code count} codes of {@code bitDepth} bits
     */
    long packedLength(int count, int bitDepth)
    {
        return packer.packedLength(count, bitDepth);
    }

    private static int[] toSymbols(CharSequence text)
    {
        int[] symbols = new int[text.length()];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = text.charAt(i);
        }
        return symbols;
    }

    private static String toText(int[] symbols)
    {
        char[] chars = new char[symbols.length];
        for (int i = 0; i < symbols.length; i++) {
            chars[i] = (char) symbols[i];
        }
        return new String(chars);
    }

    private static void checkCharDictionary(SymbolDictionary dictionary)
    {
        checkArgument(dictionary.minSymbol() >= Character.MIN_VALUE && dictionary.maxSymbol() <= Character.MAX_VALUE,
                "Not a dictionary of chars: " + dictionary);
    }

    private static void verifyRange(int[] data, int offset, int length)
    {
        requireNonNull(data, "data is null");
        if (offset < 0 || length < 0 || length > data.length - offset) {
            throw new IllegalArgumentException(format("Invalid offset or length (%s, %s) in array of length %s", offset, length, data.length));
        }
    }

    @Override
    public String toString()
    {
        return "LzwCodec[" + inputDictionary + " -> " + packDictionary + "]";
    }
}
