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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;

/**
 * Per keyspace verdicts of a sweep. A keyspace succeeded when it could be resolved and every one of its tables was
 * swept.
 */
public class SweepReport
{
    private final Map<String, List<SweepResult>> resultsByKeyspace = new TreeMap<>();
    private final Set<String> unresolvedKeyspaces = new TreeSet<>();

    void addKeyspace(String keyspace, List<SweepResult> results)
    {
        resultsByKeyspace.put(keyspace, ImmutableList.copyOf(results));
    }

    void addUnresolvedKeyspace(String keyspace)
    {
        unresolvedKeyspaces.add(keyspace);
    }

    public Set<String> keyspaces()
    {
        Set<String> keyspaces = new TreeSet<>(resultsByKeyspace.keySet());
        keyspaces.addAll(unresolvedKeyspaces);
        return keyspaces;
    }

    public List<SweepResult> results(String keyspace)
    {
        return resultsByKeyspace.getOrDefault(keyspace, Collections.emptyList());
    }

    public boolean keyspaceSucceeded(String keyspace)
    {
        if (unresolvedKeyspaces.contains(keyspace) || !resultsByKeyspace.containsKey(keyspace))
            return false;
        return resultsByKeyspace.get(keyspace).stream().allMatch(r -> r.ok);
    }

    public boolean succeeded()
    {
        return keyspaces().stream().allMatch(this::keyspaceSucceeded);
    }

    public List<SweepResult> failedTables()
    {
        ImmutableList.Builder<SweepResult> failed = ImmutableList.builder();
        for (List<SweepResult> results : resultsByKeyspace.values())
            results.stream().filter(r -> !r.ok).forEach(failed::add);
        return failed.build();
    }

    public Set<String> unresolvedKeyspaces()
    {
        return Collections.unmodifiableSet(unresolvedKeyspaces);
    }
}
