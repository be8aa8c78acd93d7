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

import io.readrepair.repair.RepairTarget;

/**
 * A connection to the cluster giving access to schema metadata and range-count queries.
 * Not shared between table workers.
 */
public interface ClusterSession extends AutoCloseable
{
    SortedSet<String> keyspaces();

    /**
     * @throws IllegalArgumentException if the keyspace does not exist
     */
    SortedSet<String> tables(String keyspace);

    /**
     * @return the partition key columns of the table, in key order
     * @throws IllegalArgumentException if the keyspace or table does not exist
     */
    List<String> partitionKeyColumns(String keyspace, String table);

    /**
     * Prepares {@code SELECT COUNT(1)} over a token range of the target at consistency level ALL.
     */
    RangeQuery prepareRangeCount(RepairTarget target, int timeoutSeconds);

    @Override
    void close();
}
