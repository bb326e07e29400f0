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

import com.facebook.airlift.bootstrap.Bootstrap;
import com.google.inject.Injector;
import io.tsplan.spi.BucketResolver;

import java.util.Map;

import static com.google.common.base.Throwables.throwIfUnchecked;
import static java.util.Objects.requireNonNull;

public final class PushdownPlannerFactory
{
    private PushdownPlannerFactory() {}

    public static PushdownPlanner create(Map<String, String> config, BucketResolver bucketResolver)
    {
        requireNonNull(config, "config is null");
        requireNonNull(bucketResolver, "bucketResolver is null");
        try {
            Bootstrap app = new Bootstrap(
                    new PushdownModule(),
                    binder -> binder.bind(BucketResolver.class).toInstance(bucketResolver));

            Injector injector = app
                    .doNotInitializeLogging()
                    .setRequiredConfigurationProperties(config)
                    .initialize();

            return injector.getInstance(PushdownPlanner.class);
        }
        catch (Exception e) {
            throwIfUnchecked(e);
            throw new RuntimeException(e);
        }
    }
}
