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

package io.readrepair.dht;

import com.google.common.collect.ImmutableList;

import io.readrepair.exceptions.ConfigurationException;

/**
 * Splits the whole Murmur3 ring into fixed-size token ranges.
 * <p>
 * The ring is treated as {@code [-Long.MAX_VALUE, Long.MAX_VALUE]}. {@code Long.MIN_VALUE} is the partitioner's
 * minimum token and no partition key ever hashes to it, so it is left out.
 * <p>
 * The requested partition size is a target, not an exact count: the span is divided with truncation and the last
 * range is clamped to end at {@link #MAX_TOKEN}, so it may be slightly shorter than the others. The result only
 * depends on the partition size and is shared by every table of a sweep.
 */
public final class TokenRangePartitioner
{
    public static final long MIN_TOKEN = -Long.MAX_VALUE;
    public static final long MAX_TOKEN = Long.MAX_VALUE;

    // 2 * Long.MAX_VALUE == 2^64 - 2, only representable as an unsigned long
    private static final long TOTAL_SPAN = MAX_TOKEN * 2;

    private TokenRangePartitioner()
    {
    }

    public static ImmutableList<TokenRange> partition(int partitionSize)
    {
        if (partitionSize < 1)
            throw new ConfigurationException("Partition size must be a positive number, got " + partitionSize);

        long rangeSize = Long.divideUnsigned(TOTAL_SPAN, partitionSize);
        if (rangeSize == 0)
            throw new ConfigurationException("Partition size " + partitionSize + " yields empty token ranges");

        ImmutableList.Builder<TokenRange> ranges = ImmutableList.builderWithExpectedSize(partitionSize);
        long start = MIN_TOKEN;
        while (true)
        {
            // unsigned distance to the top of the ring; never overflows since start >= MIN_TOKEN
            long remaining = MAX_TOKEN - start;
            if (Long.compareUnsigned(rangeSize, remaining) >= 0)
            {
                ranges.add(new TokenRange(start, MAX_TOKEN));
                return ranges.build();
            }

            long end = start + rangeSize;
            ranges.add(new TokenRange(start, end));
            start = end + 1;
        }
    }
}
