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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import io.readrepair.dht.TokenRange;

import static org.assertj.core.api.Assertions.assertThat;

public class ProgressReporterTest
{
    private static final RepairTarget TARGET = new RepairTarget("ks", "tbl", ImmutableList.of("id", "bucket"));
    private static final TokenRange RANGE = new TokenRange(0, 100);
    private static final Pattern PROGRESS = Pattern.compile("ks\\.tbl repaired \\d+ rows, \\d+/\\d+ partitions \\(\\d+ failed\\) (\\d+)%");

    private ByteArrayOutputStream buffer;
    private ProgressReporter reporter;

    @Before
    public void setUp()
    {
        buffer = new ByteArrayOutputStream();
        reporter = new ProgressReporter(new PrintStream(buffer, true));
    }

    @Test
    public void testAtMostOneLinePerPercent()
    {
        TableStats stats = new TableStats();
        for (int i = 0; i < 1000; i++)
        {
            stats.record(PartitionOutcome.success(RANGE, 1, 1000));
            reporter.report(TARGET, 1000, stats);
        }

        List<Integer> percents = progressPercents();
        assertThat(percents).hasSize(100);
        assertThat(percents).isSorted().doesNotHaveDuplicates();
        assertThat(percents.get(0)).isEqualTo(1);
        assertThat(percents.get(percents.size() - 1)).isEqualTo(100);
    }

    @Test
    public void testFewRangesSkipPercentages()
    {
        TableStats stats = new TableStats();
        for (int i = 0; i < 3; i++)
        {
            stats.record(PartitionOutcome.success(RANGE, 5, 1000));
            reporter.report(TARGET, 3, stats);
        }

        assertThat(progressPercents()).containsExactly(33, 66, 100);
        assertThat(lines()).contains("ks.tbl repaired 15 rows, 3/3 partitions (0 failed) 100%");
    }

    @Test
    public void testFailedRangesCountTowardsProgress()
    {
        TableStats stats = new TableStats();
        stats.record(PartitionOutcome.success(RANGE, 10, 1000));
        reporter.report(TARGET, 2, stats);
        stats.record(PartitionOutcome.failure(RANGE, new TimeoutException("read timeout"), 1000));
        reporter.report(TARGET, 2, stats);

        assertThat(lines()).containsExactly("ks.tbl repaired 10 rows, 1/2 partitions (0 failed) 50%",
                                            "ks.tbl repaired 10 rows, 1/2 partitions (1 failed) 100%");
    }

    @Test
    public void testNoProgressLineBeforeOnePercent()
    {
        TableStats stats = new TableStats();
        stats.record(PartitionOutcome.success(RANGE, 1, 1000));
        reporter.report(TARGET, 1000, stats);

        assertThat(lines()).isEmpty();
    }

    @Test
    public void testSummaryListsFailureCauses()
    {
        TableStats stats = new TableStats();
        stats.record(PartitionOutcome.success(RANGE, 4, 2_000_000));
        stats.record(PartitionOutcome.failure(RANGE, new TimeoutException(), 2_000_000));
        stats.record(PartitionOutcome.failure(RANGE, new TimeoutException(), 2_000_000));
        stats.record(PartitionOutcome.failure(RANGE, new IllegalStateException(), 2_000_000));

        reporter.complete(TARGET, 4, stats, Stopwatch.createStarted());

        List<String> lines = lines();
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).isEqualTo("ks.tbl repaired 4 rows, 1/4 partitions (3 failed) 100%");
        assertThat(lines.get(1)).startsWith("ks.tbl finished in ")
                                .contains("repaired 4 rows, 1/4 partitions (3 failed)")
                                .contains("p50=2ms")
                                .contains("TimeoutException x 2")
                                .contains("IllegalStateException");
        assertThat(stats.getFailureCauses().count("TimeoutException")).isEqualTo(2);
    }

    @Test
    public void testSummaryWithoutFailures()
    {
        TableStats stats = new TableStats();
        stats.record(PartitionOutcome.success(RANGE, 4, 1000));
        reporter.report(TARGET, 1, stats);
        reporter.complete(TARGET, 1, stats, Stopwatch.createStarted());

        List<String> lines = lines();
        assertThat(lines).hasSize(2);
        assertThat(lines.get(1)).doesNotContain("failures:");
    }

    @Test
    public void testTableAndKeyspaceMessages()
    {
        reporter.keyspaceStarted("ks", 2);
        reporter.tableStarted(TARGET);
        reporter.tableFailed("ks", "other", new IllegalArgumentException("Unknown table ks.other"));
        reporter.tableFailed("ks", "third", new IllegalStateException());
        reporter.keyspaceFinished("ks", 2, false);
        reporter.keyspaceFinished("ks2", 3, true);
        reporter.keyspaceFailed("ks3", new IllegalArgumentException("Unknown keyspace ks3"));

        assertThat(lines()).containsExactly("repairing 2 tables on keyspace ks...",
                                            "ks.tbl partition key: id, bucket",
                                            "ks.other error: Unknown table ks.other",
                                            "ks.third error: java.lang.IllegalStateException",
                                            "failed to repair all tables on keyspace ks...",
                                            "repaired 3 tables on keyspace ks2...",
                                            "keyspace ks3 error: Unknown keyspace ks3");
    }

    @Test
    public void testPercent()
    {
        assertThat(ProgressReporter.percent(0, 10)).isZero();
        assertThat(ProgressReporter.percent(1, 3)).isEqualTo(33);
        assertThat(ProgressReporter.percent(10, 10)).isEqualTo(100);
        assertThat(ProgressReporter.percent(0, 0)).isEqualTo(100);
        assertThat(ProgressReporter.percent(9_999, 10_000)).isEqualTo(99);
    }

    private List<String> lines()
    {
        String output = new String(buffer.toByteArray(), StandardCharsets.UTF_8);
        return Splitter.onPattern("\r?\n").omitEmptyStrings().splitToList(output);
    }

    private List<Integer> progressPercents()
    {
        ImmutableList.Builder<Integer> percents = ImmutableList.builder();
        for (String line : lines())
        {
            Matcher matcher = PROGRESS.matcher(line);
            if (matcher.matches())
                percents.add(Integer.parseInt(matcher.group(1)));
        }
        return percents.build();
    }
}
