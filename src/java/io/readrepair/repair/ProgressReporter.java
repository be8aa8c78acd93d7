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

import java.io.PrintStream;

import com.codahale.metrics.Snapshot;
import com.google.common.base.MoreObjects;
import com.google.common.base.Stopwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Prints sweep progress to the console. A table progress line is only printed when the completed percentage goes up, so a table gets
 * at most one hundred lines whatever its number of token ranges. Failed ranges count as completed.
 */
public class ProgressReporter
{
    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    private final PrintStream out;

    public ProgressReporter(PrintStream out)
    {
        this.out = out;
    }

    public void report(RepairTarget target, int totalRanges, TableStats stats)
    {
        int percent = percent(stats.getCompletedPartitions(), totalRanges);
        if (percent <= stats.getLastReportedPercent())
            return;

        String line = String.format("%s.%s repaired %d rows, %d/%d partitions (%d failed) %d%%",
                                    target.keyspace, target.table,
                                    stats.getRepairedRows(),
                                    stats.getRepairedPartitions(), totalRanges,
                                    stats.getFailedPartitions(),
                                    percent);
        out.println(line);
        logger.debug(line);
        stats.setLastReportedPercent(percent);
    }

    /**
     * Called once all ranges of a table have been delivered. Flushes a pending percentage and prints the summary.
     */
    public void complete(RepairTarget target, int totalRanges, TableStats stats, Stopwatch elapsed)
    {
        report(target, totalRanges, stats);

        Snapshot latency = stats.getRangeLatency().getSnapshot();
        StringBuilder line = new StringBuilder(String.format("%s.%s finished in %s: repaired %d rows, %d/%d partitions (%d failed), range latency p50=%dms p99=%dms",
                                                             target.keyspace, target.table,
                                                             elapsed,
                                                             stats.getRepairedRows(),
                                                             stats.getRepairedPartitions(), totalRanges,
                                                             stats.getFailedPartitions(),
                                                             NANOSECONDS.toMillis((long) latency.getMedian()),
                                                             NANOSECONDS.toMillis((long) latency.get99thPercentile())));
        if (!stats.getFailureCauses().isEmpty())
            line.append(", failures: ").append(stats.getFailureCauses());

        out.println(line);
        if (stats.getFailedPartitions() > 0)
            logger.warn(line.toString());
        else
            logger.info(line.toString());
    }

    public void tableStarted(RepairTarget target)
    {
        out.println(String.format("%s.%s partition key: %s", target.keyspace, target.table, String.join(", ", target.partitionKeyColumns)));
    }

    public void tableFailed(String keyspace, String table, Throwable cause)
    {
        out.println(String.format("%s.%s error: %s", keyspace, table, MoreObjects.firstNonNull(cause.getMessage(), cause.toString())));
    }

    public void keyspaceFailed(String keyspace, Throwable cause)
    {
        out.println(String.format("keyspace %s error: %s", keyspace, MoreObjects.firstNonNull(cause.getMessage(), cause.toString())));
    }

    public void keyspaceStarted(String keyspace, int tableCount)
    {
        out.println(String.format("repairing %d tables on keyspace %s...", tableCount, keyspace));
    }

    public void keyspaceFinished(String keyspace, int tableCount, boolean success)
    {
        if (success)
            out.println(String.format("repaired %d tables on keyspace %s...", tableCount, keyspace));
        else
            out.println(String.format("failed to repair all tables on keyspace %s...", keyspace));
    }

    static int percent(long completed, int total)
    {
        return total == 0 ? 100 : (int) (completed * 100 / total);
    }
}
