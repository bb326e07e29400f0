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

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Identifies a planning failure. Two codes are equal when their numeric
 * codes are equal; the name is only used for messages.
 */
public final class ErrorCode
{
    private final int code;
    private final String name;
    private final ErrorType type;

    public ErrorCode(int code, String name, ErrorType type)
    {
        checkArgument(code >= 0, "code is negative: %s", code);
        this.code = code;
        this.name = requireNonNull(name, "name is null");
        this.type = requireNonNull(type, "type is null");
    }

    public int getCode()
    {
        return code;
    }

    public String getName()
    {
        return name;
    }

    public ErrorType getType()
    {
        return type;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return code == ((ErrorCode) obj).code;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(code);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("code", code)
                .add("name", name)
                .add("type", type)
                .toString();
    }
}
