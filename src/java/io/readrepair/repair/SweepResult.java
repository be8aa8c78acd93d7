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

import java.util.Objects;

/**
 * Whether one table was swept.
 */
public final class SweepResult
{
    public final String keyspace;
    public final String table;
    public final boolean ok;

    public SweepResult(String keyspace, String table, boolean ok)
    {
        this.keyspace = keyspace;
        this.table = table;
        this.ok = ok;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof SweepResult))
            return false;
        SweepResult that = (SweepResult) o;
        return ok == that.ok && keyspace.equals(that.keyspace) && table.equals(that.table);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(keyspace, table, ok);
    }

    @Override
    public String toString()
    {
        return keyspace + '.' + table + (ok ? " ok" : " failed");
    }
}
