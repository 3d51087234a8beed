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

import ai.lzw.compress.Compressor;

import java.nio.ByteBuffer;

import static ai.lzw.codec.BitPacker.HEADER_SIZE;
import static ai.lzw.codec.Util.log2Ceil;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Byte compressor backed by {@link CodecType#BINARY_TO_BINARY}.
 */
public class LzwCompressor
        implements Compressor
{
    private final LzwCodec codec = CodecType.BINARY_TO_BINARY.codec();

    @Override
    public int maxCompressedLength(int uncompressedSize)
    {
        if (uncompressedSize <= 0) {
            return 0;
        }
        // at most one code per byte, each below 256 + uncompressedSize
        long bits = (long) uncompressedSize * log2Ceil(uncompressedSize + 256L);
        long result = HEADER_SIZE + (bits + Byte.SIZE - 1) / Byte.SIZE;
        return (int) Math.min(result, Integer.MAX_VALUE);
    }

    @Override
    public int compress(byte[] input, int inputOffset, int inputLength, byte[] output, int outputOffset, int maxOutputLength)
    {
        verifyRange(input, inputOffset, inputLength);
        verifyRange(output, outputOffset, maxOutputLength);

        int[] packed = codec.encode(toSymbols(input, inputOffset, inputLength));
        if (packed.length > maxOutputLength) {
            throw new IllegalArgumentException(format("Output buffer too small: %s bytes needed, %s available", packed.length, maxOutputLength));
        }
        for (int i = 0; i < packed.length; i++) {
            output[outputOffset + i] = (byte) packed[i];
        }
        return packed.length;
    }

    @Override
    public void compress(ByteBuffer input, ByteBuffer output)
    {
        byte[] data = new byte[input.remaining()];
        input.duplicate().get(data);

        int[] packed = codec.encode(toSymbols(data, 0, data.length));
        if (packed.length > output.remaining()) {
            throw new IllegalArgumentException(format("Output buffer too small: %s bytes needed, %s available", packed.length, output.remaining()));
        }
        for (int value : packed) {
            output.put((byte) value);
        }
        input.position(input.limit());
    }

    static int[] toSymbols(byte[] data, int offset, int length)
    {
        int[] symbols = new int[length];
        for (int i = 0; i < length; i++) {
            symbols[i] = data[offset + i] & 0xFF;
        }
        return symbols;
    }

    static void verifyRange(byte[] data, int offset, int length)
    {
        requireNonNull(data, "data is null");
        if (offset < 0 || length < 0 || length > data.length - offset) {
            throw new IllegalArgumentException(format("Invalid offset or length (%s, %s) in array of length %s", offset, length, data.length));
        }
    }
}
