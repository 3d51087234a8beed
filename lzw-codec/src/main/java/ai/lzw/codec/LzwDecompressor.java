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

import ai.lzw.compress.Decompressor;
import ai.lzw.compress.MalformedInputException;

import java.nio.ByteBuffer;

import static ai.lzw.codec.LzwCompressor.toSymbols;
import static ai.lzw.codec.LzwCompressor.verifyRange;
import static java.lang.String.format;

/**
 * Byte decompressor for the output of {@link LzwCompressor}.
 */
public class LzwDecompressor
        implements Decompressor
{
    private final LzwCodec codec = CodecType.BINARY_TO_BINARY.codec();

    @Override
    public int decompress(byte[] input, int inputOffset, int inputLength, byte[] output, int outputOffset, int maxOutputLength)
            throws MalformedInputException
    {
        verifyRange(input, inputOffset, inputLength);
        verifyRange(output, outputOffset, maxOutputLength);

        int[] symbols = codec.decode(toSymbols(input, inputOffset, inputLength));
        if (symbols.length > maxOutputLength) {
            throw new MalformedInputException(inputOffset + inputLength, format("Output buffer too small: %s bytes needed, %s available", symbols.length, maxOutputLength));
        }
        for (int i = 0; i < symbols.length; i++) {
            output[outputOffset + i] = (byte) symbols[i];
        }
        return symbols.length;
    }

    @Override
    public void decompress(ByteBuffer input, ByteBuffer output)
            throws MalformedInputException
    {
        byte[] data = new byte[input.remaining()];
        input.duplicate().get(data);

        int[] symbols = codec.decode(toSymbols(data, 0, data.length));
        if (symbols.length > output.remaining()) {
            throw new MalformedInputException(input.limit(), format("Output buffer too small: %s bytes needed, %s available", symbols.length, output.remaining()));
        }
        for (int symbol : symbols) {
            output.put((byte) symbol);
        }
        input.position(input.limit());
    }
}
