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

/**
 * The codes of an encoded stream need more bits than the codec can carry: more than a
 * non-negative {@code int} holds, or more than the pack alphabet can store in its header.
 * Nothing is written when this is thrown.
 */
public class CapacityExceededException
        extends IllegalStateException
{
    private final long required;

    public CapacityExceededException(long required, String reason)
    {
        super(reason + ": " + required);
        this.required = required;
    }

    public long getRequired()
    {
        return required;
    }
}
