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

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.readrepair.client.ClusterConnector;
import io.readrepair.client.ClusterSession;
import io.readrepair.config.RepairOptions;
import io.readrepair.dht.TokenRange;
import io.readrepair.dht.TokenRangePartitioner;

/**
 * Sweeps keyspaces one after the other, in name order. The tables of a keyspace are swept concurrently by a pool of
 * {@link RepairOptions#processes} workers, each worker holding its own session. Together with the per-table
 * concurrency this bounds the cluster to {@code processes * concurrency} requests in flight.
 */
public class SweepCoordinator
{
    private static final Logger logger = LoggerFactory.getLogger(SweepCoordinator.class);

    private final RepairOptions options;
    private final ClusterConnector connector;
    private final ProgressReporter reporter;

    public SweepCoordinator(RepairOptions options, ClusterConnector connector, ProgressReporter reporter)
    {
        this.options = options;
        this.connector = connector;
        this.reporter = reporter;
    }

    public SweepReport sweep()
    {
        List<TokenRange> ranges = TokenRangePartitioner.partition(options.partitionSize);
        logger.info("Split the token ring into {} ranges for a partition size of {}", ranges.size(), options.partitionSize);
        TableRepairDriver driver = new TableRepairDriver(connector, ranges, options.concurrency, options.timeoutSeconds, reporter);

        SweepReport report = new SweepReport();
        ExecutorService workers = Executors.newFixedThreadPool(options.processes, new ThreadFactoryBuilder().setNameFormat("repair-worker-%d")
                                                                                                          .setDaemon(true)
                                                                                                          .build());
        try (ClusterSession discovery = connector.connect())
        {
            SortedSet<String> keyspaces = options.keyspaces.isEmpty() ? discovery.keyspaces() : options.keyspaces;
            for (String keyspace : keyspaces)
            {
                SortedSet<String> tables;
                try
                {
                    tables = resolveTables(discovery, keyspace);
                }
                catch (RuntimeException e)
                {
                    logger.error("Unable to list the tables of keyspace {}", keyspace, e);
                    reporter.keyspaceFailed(keyspace, e);
                    reporter.keyspaceFinished(keyspace, 0, false);
                    report.addUnresolvedKeyspace(keyspace);
                    continue;
                }

                List<SweepResult> results = repairKeyspace(workers, driver, keyspace, tables);
                report.addKeyspace(keyspace, results);
                reporter.keyspaceFinished(keyspace, tables.size(), report.keyspaceSucceeded(keyspace));
            }
        }
        finally
        {
            workers.shutdownNow();
        }
        return report;
    }

    @VisibleForTesting
    SortedSet<String> resolveTables(ClusterSession session, String keyspace)
    {
        SortedSet<String> existing = session.tables(keyspace);
        if (options.tables.isEmpty())
            return existing;

        SortedSet<String> selected = new TreeSet<>();
        for (String table : options.tables)
        {
            if (existing.contains(table))
                selected.add(table);
            else
                logger.warn("Table {} does not exist in keyspace {}, skipping it", table, keyspace);
        }
        return selected;
    }

    private List<SweepResult> repairKeyspace(ExecutorService workers, TableRepairDriver driver, String keyspace, SortedSet<String> tables)
    {
        reporter.keyspaceStarted(keyspace, tables.size());

        List<Future<Boolean>> futures = new ArrayList<>(tables.size());
        for (String table : tables)
            futures.add(workers.submit(() -> driver.repair(keyspace, table)));

        ImmutableList.Builder<SweepResult> results = ImmutableList.builder();
        int i = 0;
        for (String table : tables)
        {
            boolean ok;
            try
            {
                ok = Uninterruptibles.getUninterruptibly(futures.get(i++));
            }
            catch (ExecutionException e)
            {
                logger.error("Unexpected failure while repairing {}.{}", keyspace, table, e.getCause());
                reporter.tableFailed(keyspace, table, e.getCause());
                ok = false;
            }
            results.add(new SweepResult(keyspace, table, ok));
        }
        return results.build();
    }
}
