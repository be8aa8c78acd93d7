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

import java.util.Iterator;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.readrepair.client.BoundedConcurrentExecutor;
import io.readrepair.client.ClusterConnector;
import io.readrepair.client.ClusterSession;
import io.readrepair.client.RangeQuery;
import io.readrepair.dht.TokenRange;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Sweeps every token range of one table with {@code SELECT COUNT(1)} at consistency level ALL.
 * <p>
 * A failing range is counted and the sweep moves on; every range is attempted exactly once. Only a failure to set
 * the table up (connection, schema, query preparation) fails the table as a whole.
 * <p>
 * Each call to {@link #repair(String, String)} opens and closes its own session, so one driver can be used by several
 * worker threads at once.
 */
public class TableRepairDriver
{
    private static final Logger logger = LoggerFactory.getLogger(TableRepairDriver.class);

    private final ClusterConnector connector;
    private final ImmutableList<TokenRange> ranges;
    private final int concurrency;
    private final int timeoutSeconds;
    private final ProgressReporter reporter;

    public TableRepairDriver(ClusterConnector connector, List<TokenRange> ranges, int concurrency, int timeoutSeconds, ProgressReporter reporter)
    {
        checkArgument(!ranges.isEmpty(), "No token ranges to repair");
        checkArgument(concurrency > 0, "concurrency must be positive, got %s", concurrency);
        this.connector = connector;
        this.ranges = ImmutableList.copyOf(ranges);
        this.concurrency = concurrency;
        this.timeoutSeconds = timeoutSeconds;
        this.reporter = reporter;
    }

    /**
     * @return false if the table could not be swept at all; failed ranges alone do not fail the table
     */
    public boolean repair(String keyspace, String table)
    {
        try
        {
            repairRanges(keyspace, table);
            return true;
        }
        catch (Exception e)
        {
            Throwable cause = Throwables.getRootCause(e);
            logger.error("Failed to repair {}.{}", keyspace, table, e);
            reporter.tableFailed(keyspace, table, cause);
            return false;
        }
    }

    @VisibleForTesting
    TableStats repairRanges(String keyspace, String table)
    {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try (ClusterSession session = connector.connect())
        {
            RepairTarget target = new RepairTarget(keyspace, table, session.partitionKeyColumns(keyspace, table));
            reporter.tableStarted(target);
            logger.info("Repairing {} over {} token ranges with concurrency {}", target, ranges.size(), concurrency);

            RangeQuery query = session.prepareRangeCount(target, timeoutSeconds);
            TableStats stats = new TableStats();
            Iterator<PartitionOutcome> outcomes = BoundedConcurrentExecutor.execute(query, ranges, concurrency);
            while (outcomes.hasNext())
            {
                PartitionOutcome outcome = outcomes.next();
                if (!outcome.isSuccess())
                    logger.debug("Token range {} of {} failed: {}", outcome.range, target, outcome.cause.toString());
                stats.record(outcome);
                reporter.report(target, ranges.size(), stats);
            }

            reporter.complete(target, ranges.size(), stats, stopwatch);
            return stats;
        }
    }
}
