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

import io.readrepair.dht.TokenRange;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The result of sweeping one token range of one table. Either a row count or the cause of the failure.
 */
public final class PartitionOutcome
{
    public final TokenRange range;
    public final long rowCount;
    public final Throwable cause;
    public final long latencyNanos;

    private PartitionOutcome(TokenRange range, long rowCount, Throwable cause, long latencyNanos)
    {
        this.range = checkNotNull(range);
        this.rowCount = rowCount;
        this.cause = cause;
        this.latencyNanos = latencyNanos;
    }

    public static PartitionOutcome success(TokenRange range, long rowCount, long latencyNanos)
    {
        return new PartitionOutcome(range, rowCount, null, latencyNanos);
    }

    public static PartitionOutcome failure(TokenRange range, Throwable cause, long latencyNanos)
    {
        return new PartitionOutcome(range, 0, checkNotNull(cause), latencyNanos);
    }

    public boolean isSuccess()
    {
        return cause == null;
    }

    @Override
    public String toString()
    {
        return isSuccess()
               ? String.format("PartitionOutcome{range=%s, rows=%d}", range, rowCount)
               : String.format("PartitionOutcome{range=%s, cause=%s}", range, cause);
    }
}
