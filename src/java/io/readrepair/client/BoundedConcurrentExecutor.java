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

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;

import com.google.common.base.Stopwatch;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Uninterruptibles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.readrepair.dht.TokenRange;
import io.readrepair.repair.PartitionOutcome;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Runs a {@link RangeQuery} over a list of token ranges with a bounded number of requests in flight.
 * <p>
 * Outcomes are handed out in completion order, which is generally not the order of the ranges. A failed range is
 * delivered as a failure outcome and never stops the remaining ranges from being dispatched.
 * <p>
 * Requests are only ever dispatched from the thread consuming the iterator; driver callbacks just queue the
 * outcome and give back their permit. The returned iterator is not thread safe.
 */
public final class BoundedConcurrentExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(BoundedConcurrentExecutor.class);

    private BoundedConcurrentExecutor()
    {
    }

    public static Iterator<PartitionOutcome> execute(RangeQuery query, List<TokenRange> ranges, int concurrency)
    {
        checkArgument(concurrency > 0, "concurrency must be positive, got %s", concurrency);
        return new CompletionIterator(query, ranges, concurrency);
    }

    private static final class CompletionIterator extends AbstractIterator<PartitionOutcome>
    {
        private final RangeQuery query;
        private final ImmutableList<TokenRange> ranges;
        private final Semaphore permits;
        private final BlockingQueue<PartitionOutcome> completed = new LinkedBlockingQueue<>();

        private int dispatched = 0;
        private int delivered = 0;

        CompletionIterator(RangeQuery query, List<TokenRange> ranges, int concurrency)
        {
            this.query = query;
            this.ranges = ImmutableList.copyOf(ranges);
            this.permits = new Semaphore(concurrency);
        }

        @Override
        protected PartitionOutcome computeNext()
        {
            if (delivered == ranges.size())
                return endOfData();

            dispatch();
            PartitionOutcome outcome = Uninterruptibles.takeUninterruptibly(completed);
            delivered++;
            // refill the freed slot before the caller processes the outcome
            dispatch();
            return outcome;
        }

        private void dispatch()
        {
            while (dispatched < ranges.size() && permits.tryAcquire())
                submit(ranges.get(dispatched++));
        }

        private void submit(TokenRange range)
        {
            Stopwatch stopwatch = Stopwatch.createStarted();
            ListenableFuture<Long> future;
            try
            {
                future = query.execute(range);
            }
            catch (RuntimeException e)
            {
                future = Futures.immediateFailedFuture(e);
            }

            Futures.addCallback(future, new FutureCallback<Long>()
            {
                @Override
                public void onSuccess(Long rows)
                {
                    complete(PartitionOutcome.success(range, rows == null ? 0 : rows, stopwatch.elapsed(NANOSECONDS)));
                }

                @Override
                public void onFailure(Throwable t)
                {
                    logger.trace("Query for token range {} failed", range, t);
                    complete(PartitionOutcome.failure(range, t, stopwatch.elapsed(NANOSECONDS)));
                }
            }, MoreExecutors.directExecutor());
        }

        private void complete(PartitionOutcome outcome)
        {
            // the permit must be back before the consumer can see the outcome, or it may find none to dispatch with
            permits.release();
            completed.add(outcome);
        }
    }
}
