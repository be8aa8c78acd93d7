/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.readrepair.repair;

import java.util.concurrent.TimeUnit;

import com.codahale.metrics.Timer;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

/**
 * Counters of one table sweep. Owned by a single {@link TableRepairDriver} run and only ever updated from the thread
 * consuming range outcomes, so nothing here is synchronized.
 */
public class TableStats
{
    private long repairedRows = 0;
    private long repairedPartitions = 0;
    private long failedPartitions = 0;
    private int lastReportedPercent = 0;

    private final Multiset<String> failureCauses = HashMultiset.create();
    private final Timer rangeLatency = new Timer();

    public void record(PartitionOutcome outcome)
    {
        rangeLatency.update(outcome.latencyNanos, TimeUnit.NANOSECONDS);
        if (outcome.isSuccess())
        {
            repairedRows += outcome.rowCount;
            repairedPartitions++;
        }
        else
        {
            failedPartitions++;
            failureCauses.add(outcome.cause.getClass().getSimpleName());
        }
    }

    public long getRepairedRows()
    {
        return repairedRows;
    }

    public long getRepairedPartitions()
    {
        return repairedPartitions;
    }

    public long getFailedPartitions()
    {
        return failedPartitions;
    }

    public long getCompletedPartitions()
    {
        return repairedPartitions + failedPartitions;
    }

    public int getLastReportedPercent()
    {
        return lastReportedPercent;
    }

    void setLastReportedPercent(int lastReportedPercent)
    {
        this.lastReportedPercent = lastReportedPercent;
    }

    /**
     * Failed ranges counted by the simple class name of their cause.
     */
    public Multiset<String> getFailureCauses()
    {
        return failureCauses;
    }

    public Timer getRangeLatency()
    {
        return rangeLatency;
    }
}
