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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A contiguous interval of Murmur3 token space, inclusive at both ends.
 */
public final class TokenRange
{
    public final long start;
    public final long end;

    public TokenRange(long start, long end)
    {
        checkArgument(start <= end, "Token range start %s is after end %s", start, end);
        this.start = start;
        this.end = end;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof TokenRange))
            return false;
        TokenRange that = (TokenRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(start, end);
    }

    @Override
    public String toString()
    {
        return "[" + start + ',' + end + ']';
    }
}
