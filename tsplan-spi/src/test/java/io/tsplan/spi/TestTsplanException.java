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

import org.testng.annotations.Test;

import static io.tsplan.spi.ErrorType.INSUFFICIENT_RESOURCES;
import static io.tsplan.spi.ErrorType.INTERNAL_ERROR;
import static io.tsplan.spi.ErrorType.USER_ERROR;
import static io.tsplan.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static io.tsplan.spi.StandardErrorCode.OPTIMIZER_TIMEOUT;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertThrows;

public class TestTsplanException
{
    @Test
    public void testMessage()
    {
        assertEquals(new TsplanException(GENERIC_INTERNAL_ERROR, "not yet").getMessage(), "not yet");
        assertEquals(new TsplanException(GENERIC_INTERNAL_ERROR, new IllegalStateException("cause")).getMessage(), "cause");
        assertEquals(new TsplanException(GENERIC_INTERNAL_ERROR, (String) null).getMessage(), "GENERIC_INTERNAL_ERROR");
    }

    @Test
    public void testErrorCode()
    {
        ErrorCode errorCode = new TsplanException(OPTIMIZER_TIMEOUT, "slow").getErrorCode();
        assertEquals(errorCode.getName(), "OPTIMIZER_TIMEOUT");
        assertEquals(errorCode.getType(), INSUFFICIENT_RESOURCES);
        assertEquals(errorCode, OPTIMIZER_TIMEOUT.toErrorCode());
    }

    @Test
    public void testErrorCodeIdentity()
    {
        assertEquals(new ErrorCode(7, "A", USER_ERROR), new ErrorCode(7, "B", INTERNAL_ERROR));
        assertNotEquals(new ErrorCode(7, "A", USER_ERROR), new ErrorCode(8, "A", USER_ERROR));
        assertEquals(new ErrorCode(7, "A", USER_ERROR).toString(), "ErrorCode{code=7, name=A, type=USER_ERROR}");
        assertThrows(IllegalArgumentException.class, () -> new ErrorCode(-1, "NEGATIVE", USER_ERROR));
    }
}
