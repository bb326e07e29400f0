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
package io.tsplan.plan;

public final class ColumnNames
{
    public static final String TIME = "_time";
    public static final String START = "_start";
    public static final String STOP = "_stop";
    public static final String VALUE = "_value";
    public static final String MEASUREMENT = "_measurement";
    public static final String FIELD = "_field";

    private ColumnNames() {}
}
