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

package io.readrepair.client;

import java.util.List;
import java.util.SortedSet;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.MoreExecutors;

import com.datastax.driver.core.BoundStatement;
import com.datastax.driver.core.Cluster;
import com.datastax.driver.core.ColumnMetadata;
import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.KeyspaceMetadata;
import com.datastax.driver.core.Metadata;
import com.datastax.driver.core.PreparedStatement;
import com.datastax.driver.core.ResultSet;
import com.datastax.driver.core.Row;
import com.datastax.driver.core.Session;
import com.datastax.driver.core.TableMetadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.readrepair.repair.RepairTarget;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link ClusterSession} backed by a DataStax Java driver {@link Cluster} owned exclusively by this session.
 */
public class JavaDriverSession implements ClusterSession
{
    private static final Logger logger = LoggerFactory.getLogger(JavaDriverSession.class);

    private final Cluster cluster;
    private final Session session;

    JavaDriverSession(Cluster cluster)
    {
        this.cluster = cluster;
        try
        {
            this.session = cluster.connect();
        }
        catch (RuntimeException e)
        {
            cluster.close();
            throw e;
        }
    }

    @Override
    public SortedSet<String> keyspaces()
    {
        ImmutableSortedSet.Builder<String> keyspaces = ImmutableSortedSet.naturalOrder();
        for (KeyspaceMetadata keyspace : cluster.getMetadata().getKeyspaces())
            keyspaces.add(keyspace.getName());
        return keyspaces.build();
    }

    @Override
    public SortedSet<String> tables(String keyspace)
    {
        ImmutableSortedSet.Builder<String> tables = ImmutableSortedSet.naturalOrder();
        for (TableMetadata table : keyspaceMetadata(keyspace).getTables())
            tables.add(table.getName());
        return tables.build();
    }

    @Override
    public List<String> partitionKeyColumns(String keyspace, String table)
    {
        TableMetadata metadata = keyspaceMetadata(keyspace).getTable(Metadata.quote(table));
        checkArgument(metadata != null, "Unknown table %s.%s", keyspace, table);

        ImmutableList.Builder<String> columns = ImmutableList.builder();
        for (ColumnMetadata column : metadata.getPartitionKey())
            columns.add(column.getName());
        return columns.build();
    }

    @Override
    public RangeQuery prepareRangeCount(RepairTarget target, int timeoutSeconds)
    {
        String cql = rangeCountQuery(target);
        logger.debug("Preparing {}", cql);
        PreparedStatement prepared = session.prepare(cql);
        prepared.setConsistencyLevel(ConsistencyLevel.ALL);
        int timeoutMillis = Math.toIntExact(timeoutSeconds * 1000L);

        return range -> {
            BoundStatement statement = prepared.bind(range.start, range.end);
            statement.setReadTimeoutMillis(timeoutMillis);
            return Futures.transform(session.executeAsync(statement), JavaDriverSession::count, MoreExecutors.directExecutor());
        };
    }

    @Override
    public void close()
    {
        cluster.close();
    }

    private KeyspaceMetadata keyspaceMetadata(String keyspace)
    {
        KeyspaceMetadata metadata = cluster.getMetadata().getKeyspace(Metadata.quote(keyspace));
        checkArgument(metadata != null, "Unknown keyspace %s", keyspace);
        return metadata;
    }

    private static Long count(ResultSet result)
    {
        Row row = result.one();
        return row == null ? 0L : row.getLong(0);
    }

    @VisibleForTesting
    static String rangeCountQuery(RepairTarget target)
    {
        String token = "token(" + Joiner.on(", ").join(target.partitionKeyColumns.stream().map(Metadata::quote).iterator()) + ')';
        return String.format("SELECT COUNT(1) FROM %s.%s WHERE %s >= ? AND %s <= ?",
                             Metadata.quote(target.keyspace),
                             Metadata.quote(target.table),
                             token,
                             token);
    }
}
