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

import com.google.common.collect.ImmutableList;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.readrepair.client.ClusterConnector;
import io.readrepair.client.ClusterSession;
import io.readrepair.client.FakeCluster;
import io.readrepair.dht.TokenRange;
import io.readrepair.dht.TokenRangePartitioner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TableRepairDriverTest
{
    private FakeCluster cluster;
    private ByteArrayOutputStream buffer;
    private ProgressReporter reporter;

    @Before
    public void setUp()
    {
        cluster = new FakeCluster().withTable("ks", "users", "id");
        buffer = new ByteArrayOutputStream();
        reporter = new ProgressReporter(new PrintStream(buffer, true));
    }

    @After
    public void tearDown()
    {
        cluster.shutdown();
    }

    @Test
    public void testFailedRangeIsCountedAndSkipped()
    {
        List<TokenRange> ranges = TokenRangePartitioner.partition(4);
        cluster.rowsPerRange(10)
               .failing((target, range) -> range.equals(ranges.get(1)));
        TableRepairDriver driver = new TableRepairDriver(cluster, ranges, 2, 10, reporter);

        TableStats stats = driver.repairRanges("ks", "users");

        assertThat(stats.getRepairedRows()).isEqualTo(30);
        assertThat(stats.getRepairedPartitions()).isEqualTo(3);
        assertThat(stats.getFailedPartitions()).isEqualTo(1);
        assertThat(stats.getFailureCauses().count("IllegalStateException")).isEqualTo(1);
        assertThat(cluster.queried).containsExactlyInAnyOrderElementsOf(ranges);
        assertThat(output()).startsWith("ks.users partition key: id")
                            .contains("ks.users finished in ");
    }

    @Test
    public void testFailedRangesDoNotFailTheTable()
    {
        List<TokenRange> ranges = TokenRangePartitioner.partition(4);
        cluster.failing((target, range) -> range.equals(ranges.get(1)));

        assertThat(new TableRepairDriver(cluster, ranges, 2, 10, reporter).repair("ks", "users")).isTrue();
    }

    @Test
    public void testEveryRangeIsAttemptedWhateverFails()
    {
        List<TokenRange> ranges = TokenRangePartitioner.partition(500);
        cluster.queryDelayMillis(1)
               .failing((target, range) -> ranges.indexOf(range) % 7 == 0);
        long expectedFailures = ranges.stream().filter(r -> ranges.indexOf(r) % 7 == 0).count();

        TableStats stats = new TableRepairDriver(cluster, ranges, 16, 10, reporter).repairRanges("ks", "users");

        assertThat(stats.getFailedPartitions()).isEqualTo(expectedFailures);
        assertThat(stats.getRepairedPartitions() + stats.getFailedPartitions()).isEqualTo(ranges.size());
        assertThat(stats.getRepairedRows()).isEqualTo(10 * (ranges.size() - expectedFailures));
        assertThat(cluster.queried).hasSize(ranges.size()).doesNotHaveDuplicates();
        assertThat(cluster.maxInFlight.get()).isLessThanOrEqualTo(16);
        assertThat(cluster.openSessions.get()).isZero();
    }

    @Test
    public void testEveryRangeFailing()
    {
        List<TokenRange> ranges = TokenRangePartitioner.partition(50);
        cluster.failing((target, range) -> true);

        TableRepairDriver driver = new TableRepairDriver(cluster, ranges, 4, 10, reporter);
        assertThat(driver.repair("ks", "users")).isTrue();
        assertThat(output()).contains("ks.users repaired 0 rows, 0/50 partitions (50 failed) 100%");
    }

    @Test
    public void testUnknownTableFailsTheTable()
    {
        TableRepairDriver driver = new TableRepairDriver(cluster, TokenRangePartitioner.partition(4), 2, 10, reporter);

        assertThat(driver.repair("ks", "missing")).isFalse();
        assertThat(output()).isEqualTo("ks.missing error: Unknown table ks.missing" + System.lineSeparator());
        assertThat(cluster.queried).isEmpty();
        assertThat(cluster.openSessions.get()).isZero();
    }

    @Test
    public void testUnreachableClusterFailsTheTable()
    {
        cluster.unreachable();
        TableRepairDriver driver = new TableRepairDriver(cluster, TokenRangePartitioner.partition(4), 2, 10, reporter);

        assertThat(driver.repair("ks", "users")).isFalse();
        assertThat(output()).contains("ks.users error: All host(s) tried for query failed");
    }

    @Test
    public void testSessionIsClosedWhenPreparationFails()
    {
        ClusterConnector connector = mock(ClusterConnector.class);
        ClusterSession session = mock(ClusterSession.class);
        when(connector.connect()).thenReturn(session);
        when(session.partitionKeyColumns("ks", "users")).thenReturn(ImmutableList.of("id"));
        when(session.prepareRangeCount(any(RepairTarget.class), anyInt()))
            .thenThrow(new IllegalStateException("Keyspace ks does not exist"));

        TableRepairDriver driver = new TableRepairDriver(connector, TokenRangePartitioner.partition(4), 2, 10, reporter);

        assertThat(driver.repair("ks", "users")).isFalse();
        verify(session).close();
        assertThat(output()).contains("ks.users error: Keyspace ks does not exist");
    }

    @Test
    public void testRejectsInvalidArguments()
    {
        assertThatThrownBy(() -> new TableRepairDriver(cluster, ImmutableList.of(), 2, 10, reporter))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TableRepairDriver(cluster, TokenRangePartitioner.partition(4), 0, 10, reporter))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private String output()
    {
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }
}
