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

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A table to sweep together with the partition key columns its token predicate is built on.
 */
public final class RepairTarget
{
    public final String keyspace;
    public final String table;
    public final ImmutableList<String> partitionKeyColumns;

    public RepairTarget(String keyspace, String table, List<String> partitionKeyColumns)
    {
        this.keyspace = checkNotNull(keyspace, "keyspace");
        this.table = checkNotNull(table, "table");
        this.partitionKeyColumns = ImmutableList.copyOf(partitionKeyColumns);
        checkArgument(!this.partitionKeyColumns.isEmpty(), "Table %s.%s has no partition key columns", keyspace, table);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof RepairTarget))
            return false;
        RepairTarget that = (RepairTarget) o;
        return keyspace.equals(that.keyspace)
               && table.equals(that.table)
               && partitionKeyColumns.equals(that.partitionKeyColumns);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(keyspace, table, partitionKeyColumns);
    }

    @Override
    public String toString()
    {
        return keyspace + '.' + table;
    }
}
