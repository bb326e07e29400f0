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

import com.facebook.airlift.configuration.Config;
import com.facebook.airlift.configuration.ConfigDescription;
import io.airlift.units.Duration;

import static java.util.concurrent.TimeUnit.MINUTES;

public class PushdownConfig
{
    private boolean enabled = true;
    private boolean groupWindowAggregateTransposeEnabled;
    private boolean mergeFiltersEnabled = true;
    private int maxRewritePasses = 100;
    private Duration optimizerTimeout = new Duration(3, MINUTES);

    public boolean isEnabled()
    {
        return enabled;
    }

    @Config("pushdown.enabled")
    @ConfigDescription("Push query operators into the storage engine")
    public PushdownConfig setEnabled(boolean enabled)
    {
        this.enabled = enabled;
        return this;
    }

    public boolean isGroupWindowAggregateTransposeEnabled()
    {
        return groupWindowAggregateTransposeEnabled;
    }

    @Config("pushdown.group-window-aggregate-transpose-enabled")
    @ConfigDescription("Compute windowed aggregates of grouped reads per series in storage when the query does not state its capabilities")
    public PushdownConfig setGroupWindowAggregateTransposeEnabled(boolean groupWindowAggregateTransposeEnabled)
    {
        this.groupWindowAggregateTransposeEnabled = groupWindowAggregateTransposeEnabled;
        return this;
    }

    public boolean isMergeFiltersEnabled()
    {
        return mergeFiltersEnabled;
    }

    @Config("pushdown.merge-filters-enabled")
    @ConfigDescription("Merge adjacent filters before pushing them down")
    public PushdownConfig setMergeFiltersEnabled(boolean mergeFiltersEnabled)
    {
        this.mergeFiltersEnabled = mergeFiltersEnabled;
        return this;
    }

    public int getMaxRewritePasses()
    {
        return maxRewritePasses;
    }

    @Config("pushdown.max-rewrite-passes")
    @ConfigDescription("Maximum number of full rewrite passes over a plan")
    public PushdownConfig setMaxRewritePasses(int maxRewritePasses)
    {
        this.maxRewritePasses = maxRewritePasses;
        return this;
    }

    public Duration getOptimizerTimeout()
    {
        return optimizerTimeout;
    }

    @Config("pushdown.optimizer-timeout")
    @ConfigDescription("Maximum time spent rewriting one plan")
    public PushdownConfig setOptimizerTimeout(Duration optimizerTimeout)
    {
        this.optimizerTimeout = optimizerTimeout;
        return this;
    }
}
