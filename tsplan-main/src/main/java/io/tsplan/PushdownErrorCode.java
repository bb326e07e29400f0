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
package io.tsplan;

import io.tsplan.spi.ErrorCode;
import io.tsplan.spi.ErrorCodeSupplier;
import io.tsplan.spi.ErrorType;

import static io.tsplan.spi.ErrorType.USER_ERROR;

public enum PushdownErrorCode
        implements ErrorCodeSupplier
{
    UNSUPPORTED_OPERATOR(0, USER_ERROR),
    UNSUPPORTED_LITERAL_KIND(1, USER_ERROR),
    UNKNOWN_OBJECT(2, USER_ERROR),
    UNSUPPORTED_EXPRESSION(3, USER_ERROR),
    BUCKET_NOT_FOUND(4, USER_ERROR),
    INVALID_BUCKET_ID(5, USER_ERROR);

    private final ErrorCode errorCode;

    PushdownErrorCode(int code, ErrorType type)
    {
        errorCode = new ErrorCode(code + 0x0100_0000, name(), type);
    }

    @Override
    public ErrorCode toErrorCode()
    {
        return errorCode;
    }
}
