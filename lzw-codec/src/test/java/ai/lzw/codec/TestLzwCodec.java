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

import ai.lzw.alphabet.Alphabets;
import ai.lzw.alphabet.SymbolDictionary;
import ai.lzw.alphabet.SymbolOutOfRangeException;
import ai.lzw.alphabet.SymbolRange;
import ai.lzw.compress.MalformedInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static ai.lzw.codec.TestPhraseDictionary.randomSymbols;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestLzwCodec
{
    private static final String TOBEORNOT = "TOBEORNOTTOBEORNOTTOBEORNOT";

    @ParameterizedTest
    @EnumSource(CodecType.class)
    public void testRoundTrip(CodecType type)
    {
        LzwCodec codec = type.codec();
        Random random = new Random(type.ordinal() * 31L);

        for (int iteration = 0; iteration < 300; iteration++) {
            int length = 1 + random.nextInt(1 + iteration * 4);
            int[] symbols = randomSymbols(random, type, length, 1 + random.nextInt(type.inputDictionary().length()));

            int[] packed = codec.encode(symbols);
            for (int symbol : packed) {
                assertThat(type.packDictionary().contains(symbol)).isTrue();
            }
            assertArrayEquals(symbols, codec.decode(packed));
        }
    }

    @ParameterizedTest
    @EnumSource(CodecType.class)
    public void testRoundTripRepeatedChunks(CodecType type)
    {
        LzwCodec codec = type.codec();
        Random random = new Random(7);

        int chunkLength = 16;
        int[] symbols = randomSymbols(random, type, 1024, type.inputDictionary().length());
        for (int i = chunkLength; i < symbols.length; i++) {
            symbols[i] = symbols[i - chunkLength];
        }

        assertArrayEquals(symbols, codec.decode(codec.encode(symbols)));

        int[] constant = new int[1024];
        Arrays.fill(constant, type.inputDictionary().symbolByIndex(0));
        assertArrayEquals(constant, codec.decode(codec.encode(constant)));
    }

    @ParameterizedTest
    @EnumSource(CodecType.class)
    public void testEmpty(CodecType type)
    {
        assertEquals(0, type.codec().encode(new int[0]).length);
        assertEquals(0, type.codec().decode(new int[0]).length);
    }

    @Test
    public void testCompressesRepetition()
    {
        LzwCodec codec = CodecType.STRING_TO_URI.codec();

        String packed = codec.encode(TOBEORNOT);

        assertEquals("81KQJ4K2T9IIJU4A1G241D846G3C1F8", packed);
        // one 7 bit code per character
        long naive = codec.packedLength(TOBEORNOT.length(), 7);
        assertThat((long) packed.length()).isLessThan(naive);
        assertEquals(TOBEORNOT, codec.decode(packed));
    }

    @Test
    public void testUriOutput()
    {
        LzwCodec codec = CodecType.STRING_TO_URI.codec();

        assertEquals("82KQJ4K2T9IIJU4A1G241JO1MG74", codec.encode("TOBEORNOTTOBEORTOBEORNOT"));
        assertEquals("831IG0812", codec.encode("ABABABA"));
        assertEquals("7312", codec.encode("A"));
        assertEquals("140", codec.encode("\0"));

        String text = "Ololo, test string, TOBEORNOTTOBEORTOBEORNOT!";
        String packed = codec.encode(text);
        assertThat(packed).matches("[0-9A-Za-z]+");
        assertEquals(text, codec.decode(packed));
    }

    @Test
    public void testStringCodecs()
    {
        String text = "The quick brown fox jumps over the lazy dog. The quick brown fox jumps over the lazy dog.";
        for (CodecType type : List.of(CodecType.STRING_TO_STRING, CodecType.STRING_TO_UTF16, CodecType.STRING_TO_URI)) {
            LzwCodec codec = type.codec();
            assertEquals(text, codec.decode(codec.encode(text)), type.name());
            assertEquals("", codec.encode(""));
            assertEquals("", codec.decode(""));
        }

        String packed = CodecType.STRING_TO_UTF16.codec().encode(text);
        assertThat(packed.length()).isLessThan(text.length() / 2);
        packed.chars().forEach(c -> assertThat(Character.isSurrogate((char) c)).isFalse());
    }

    @Test
    public void testRejectsNonAsciiText()
    {
        assertThatThrownBy(() -> CodecType.STRING_TO_URI.codec().encode("café"))
                .isInstanceOf(SymbolOutOfRangeException.class);
    }

    @Test
    public void testOneSymbolStream()
    {
        assertThatThrownBy(() -> CodecType.STRING_TO_URI.codec().decode("8"))
                .isInstanceOf(MalformedInputException.class);
        assertThatThrownBy(() -> CodecType.BINARY_TO_BINARY.codec().decode(new int[] {9}))
                .isInstanceOf(MalformedInputException.class);
    }

    @Test
    public void testCodeTwoBeyondDictionary()
    {
        LzwCodec codec = CodecType.STRING_TO_URI.codec();

        int[] packed = codec.pack(new int[] {65, 66, 131}, 8);
        assertThatThrownBy(() -> codec.decode(packed))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageStartingWith("Code 131 is beyond the dictionary")
                .satisfies(e -> assertEquals(2, ((MalformedInputException) e).getOffset()));
    }

    @Test
    public void testForeignPackedSymbol()
    {
        assertThatThrownBy(() -> CodecType.STRING_TO_URI.codec().decode("82KQ-4K2T9IIJU4A1G241JO1MG74"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessage("Symbol 45 is not in the pack alphabet: offset=4");
    }

    @Test
    public void testOffsetAndLength()
    {
        LzwCodec codec = CodecType.STRING_TO_STRING.codec();
        int[] data = "xxABABABAxx".chars().toArray();

        int[] packed = codec.encode(data, 2, 7);
        assertArrayEquals("ABABABA".chars().toArray(), codec.decode(packed));

        int[] shifted = new int[packed.length + 3];
        System.arraycopy(packed, 0, shifted, 3, packed.length);
        assertArrayEquals("ABABABA".chars().toArray(), codec.decode(shifted, 3, packed.length));

        assertThatThrownBy(() -> codec.encode(data, 5, 7))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid offset or length (5, 7) in array of length 11");
        assertThatThrownBy(() -> codec.decode(packed, -1, 2))
                .isInstanceOf(IllegalArgumentException.class);

        // offset + length overflows int
        assertThatThrownBy(() -> codec.encode(new int[10], 1, Integer.MAX_VALUE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid offset or length (1, 2147483647) in array of length 10");
        assertThatThrownBy(() -> codec.decode(new int[10], 1, Integer.MAX_VALUE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid offset or length (1, 2147483647) in array of length 10");
    }

    @Test
    public void testPackDictionaryValidation()
    {
        assertThatThrownBy(() -> new LzwCodec(Alphabets.ASCII_128, SymbolDictionary.of(SymbolRange.of('a', 'a'))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Pack dictionary needs at least 2 symbols");

        // 7 bit base codes need a bit depth symbol at index 7
        assertThatThrownBy(() -> new LzwCodec(Alphabets.ASCII_128, SymbolDictionary.of(SymbolRange.of('a', 'g'))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too small");

        LzwCodec codec = new LzwCodec(Alphabets.ASCII_128, SymbolDictionary.of(SymbolRange.of('a', 'h')));
        assertEquals(3, codec.packCapacity());
        assertEquals("abc", codec.decode(codec.encode("abc")));
    }

    @Test
    public void testCapacityExceeded()
    {
        LzwCodec codec = new LzwCodec(Alphabets.ASCII_128, SymbolDictionary.of(SymbolRange.of('a', 'h')));

        // code 128 needs 8 bits, the header can only say 0 to 7
        assertThatThrownBy(() -> codec.encode("aaa"))
                .isInstanceOf(CapacityExceededException.class)
                .hasMessageStartingWith("Bit depth cannot be stored")
                .satisfies(e -> assertEquals(8, ((CapacityExceededException) e).getRequired()));
    }

    @Test
    public void testTinyPackDictionary()
    {
        SymbolDictionary bits = SymbolDictionary.of(SymbolRange.of('0', '1'));
        LzwCodec codec = new LzwCodec(SymbolDictionary.of(SymbolRange.of('x', 'x')), bits);

        assertEquals(1, codec.packCapacity());
        assertEquals("100", codec.encode("x"));
        assertEquals("1001", codec.encode("xxx"));
        assertEquals("xxx", codec.decode("1001"));
        // code 2 needs a bit depth of 2, which a two symbol header cannot hold
        assertThatThrownBy(() -> codec.encode("xxxxxx"))
                .isInstanceOf(CapacityExceededException.class);
    }

    @Test
    public void testCustomAlphabets()
    {
        SymbolDictionary dna = SymbolDictionary.of(
                SymbolRange.of('A', 'A'),
                SymbolRange.of('C', 'C'),
                SymbolRange.of('G', 'G'),
                SymbolRange.of('T', 'T'));
        LzwCodec codec = new LzwCodec(dna, Alphabets.URI_PACK);

        String sequence = "GATTACA".repeat(50);
        String packed = codec.encode(sequence);
        assertThat(packed.length()).isLessThan(sequence.length() / 2);
        assertEquals(sequence, codec.decode(packed));
    }

    @Test
    public void testConcurrentUse()
            throws Exception
    {
        LzwCodec codec = new LzwCodec(Alphabets.ASCII_128, Alphabets.UTF16_PACK);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int task = 0; task < 32; task++) {
                int seed = task;
                results.add(executor.submit(() -> {
                    Random random = new Random(seed);
                    int[] symbols = randomSymbols(random, CodecType.STRING_TO_UTF16, 5000, 6);
                    return Arrays.equals(symbols, codec.decode(codec.encode(symbols)));
                }));
            }
            for (Future<Boolean> result : results) {
                assertThat(result.get()).isTrue();
            }
        }
        finally {
            executor.shutdownNow();
        }
    }
}
