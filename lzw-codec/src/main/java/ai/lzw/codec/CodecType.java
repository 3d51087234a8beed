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
import com.google.common.base.Suppliers;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Predefined input and pack alphabet pairs. Each constant shares one codec instance.
 */
public enum CodecType
{
    /** Bytes to bytes */
    BINARY_TO_BINARY(Alphabets.BINARY_256, Alphabets.BINARY_256),
    /** ASCII text to ASCII text */
    STRING_TO_STRING(Alphabets.ASCII_128, Alphabets.ASCII_128),
    /** ASCII text to printable UTF-16 */
    STRING_TO_UTF16(Alphabets.ASCII_128, Alphabets.UTF16_PACK),
    /** ASCII text to URI-safe [0-9A-Za-z] */
    STRING_TO_URI(Alphabets.ASCII_128, Alphabets.URI_PACK);

    private final SymbolDictionary inputDictionary;
    private final SymbolDictionary packDictionary;
    private final Supplier<LzwCodec> codec;

    CodecType(SymbolDictionary inputDictionary, SymbolDictionary packDictionary)
    {
        this.inputDictionary = inputDictionary;
        this.packDictionary = packDictionary;
        this.codec = Suppliers.memoize(() -> new LzwCodec(inputDictionary, packDictionary));
    }

    public SymbolDictionary inputDictionary()
    {
        return inputDictionary;
    }

    public SymbolDictionary packDictionary()
    {
        return packDictionary;
    }

    public LzwCodec codec()
    {
        return codec.get();
    }

    /**
     * @param name the constant name, case insensitive
     * @throws IllegalArgumentException if no codec type has this name
     */
    public static CodecType fromName(String name)
    {
        for (CodecType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown codec type '" + name + "', expected one of " +
                Arrays.stream(values()).map(type -> type.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")));
    }
}
