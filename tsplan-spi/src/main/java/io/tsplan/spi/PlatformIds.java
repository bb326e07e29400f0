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
package io.tsplan.spi;

import java.util.HexFormat;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;

final class PlatformIds
{
    static final int ENCODED_LENGTH = 16;

    private PlatformIds() {}

    static long decode(String encoded)
    {
        checkArgument(encoded != null && encoded.length() == ENCODED_LENGTH, "id must have a length of %s characters", ENCODED_LENGTH);
        long value = 0;
        for (int i = 0; i < ENCODED_LENGTH; i++) {
            char character = encoded.charAt(i);
            // ASCII only, Character.digit would also take other scripts' digits
            checkArgument(HexFormat.isHexDigit(character), "id contains a non hexadecimal character: %s", encoded);
            value = (value << 4) | HexFormat.fromHexDigit(character);
        }
        checkArgument(value != 0, "id must not be zero");
        return value;
    }

    static String encode(long value)
    {
        return format("%016x", value);
    }
}
