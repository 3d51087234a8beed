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
package ai.lzw.compress;

import java.nio.ByteBuffer;

public interface Compressor
{
    /**
     * @return an upper bound on the number of bytes {@code compress} writes for an input of the given size
     */
    int maxCompressedLength(int uncompressedSize);

    /**
     * @return number of bytes written to the output
     */
    int compress(byte[] input, int inputOffset, int inputLength, byte[] output, int outputOffset, int maxOutputLength);

    void compress(ByteBuffer input, ByteBuffer output);
}
