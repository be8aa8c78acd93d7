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

package io.readrepair.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.SortedSet;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import io.readrepair.exceptions.ConfigurationException;

/**
 * Validated settings of one sweep. Built through {@link #builder()}; {@link Builder#build()} fails with a
 * {@link ConfigurationException} before anything touches the cluster.
 */
public class RepairOptions
{
    public static final int DEFAULT_PORT = 9042;
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_CONCURRENCY = 100;
    public static final int DEFAULT_PROCESSES = 5;
    public static final int DEFAULT_PARTITION_SIZE = 10000;
    // the driver takes the per-request timeout in milliseconds as an int
    public static final int MAX_TIMEOUT_SECONDS = Integer.MAX_VALUE / 1000;

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public final ImmutableList<String> hosts;
    public final int port;
    public final String username;
    public final String password;
    public final Path caCertificate;
    public final int timeoutSeconds;
    public final int concurrency;
    public final int processes;
    public final int partitionSize;
    /** Empty means every keyspace of the cluster. */
    public final ImmutableSortedSet<String> keyspaces;
    /** Empty means every table of each keyspace. */
    public final ImmutableSortedSet<String> tables;

    private RepairOptions(Builder builder)
    {
        hosts = ImmutableList.copyOf(builder.hosts);
        port = builder.port;
        username = builder.username;
        password = builder.password;
        caCertificate = builder.caCertificate;
        timeoutSeconds = builder.timeoutSeconds;
        concurrency = builder.concurrency;
        processes = builder.processes;
        partitionSize = builder.partitionSize;
        keyspaces = ImmutableSortedSet.copyOf(builder.keyspaces);
        tables = ImmutableSortedSet.copyOf(builder.tables);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Splits a comma separated operator list, dropping blanks.
     */
    public static ImmutableList<String> splitList(String value)
    {
        return value == null ? ImmutableList.of() : ImmutableList.copyOf(LIST_SPLITTER.split(value));
    }

    @Override
    public String toString()
    {
        // never print the password
        return "RepairOptions{hosts=" + hosts +
               ", port=" + port +
               ", username=" + username +
               ", caCertificate=" + caCertificate +
               ", timeoutSeconds=" + timeoutSeconds +
               ", concurrency=" + concurrency +
               ", processes=" + processes +
               ", partitionSize=" + partitionSize +
               ", keyspaces=" + keyspaces +
               ", tables=" + tables +
               '}';
    }

    public static class Builder
    {
        private ImmutableList<String> hosts = ImmutableList.of();
        private int port = DEFAULT_PORT;
        private String username;
        private String password;
        private Path caCertificate;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private int concurrency = DEFAULT_CONCURRENCY;
        private int processes = DEFAULT_PROCESSES;
        private int partitionSize = DEFAULT_PARTITION_SIZE;
        private SortedSet<String> keyspaces = ImmutableSortedSet.of();
        private SortedSet<String> tables = ImmutableSortedSet.of();

        private Builder()
        {
        }

        public Builder hosts(String commaSeparatedHosts)
        {
            return hosts(splitList(commaSeparatedHosts));
        }

        public Builder hosts(Collection<String> hosts)
        {
            this.hosts = ImmutableList.copyOf(hosts);
            return this;
        }

        public Builder port(int port)
        {
            this.port = port;
            return this;
        }

        public Builder credentials(String username, String password)
        {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder caCertificate(String caCertificate)
        {
            this.caCertificate = caCertificate == null ? null : Paths.get(caCertificate);
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds)
        {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder concurrency(int concurrency)
        {
            this.concurrency = concurrency;
            return this;
        }

        public Builder processes(int processes)
        {
            this.processes = processes;
            return this;
        }

        public Builder partitionSize(int partitionSize)
        {
            this.partitionSize = partitionSize;
            return this;
        }

        public Builder keyspaces(String commaSeparatedKeyspaces)
        {
            return keyspaces(splitList(commaSeparatedKeyspaces));
        }

        public Builder keyspaces(Collection<String> keyspaces)
        {
            this.keyspaces = ImmutableSortedSet.copyOf(keyspaces);
            return this;
        }

        public Builder tables(String commaSeparatedTables)
        {
            return tables(splitList(commaSeparatedTables));
        }

        public Builder tables(Collection<String> tables)
        {
            this.tables = ImmutableSortedSet.copyOf(tables);
            return this;
        }

        public RepairOptions build()
        {
            if (hosts.isEmpty())
                throw new ConfigurationException("At least one contact point must be given with --hosts");
            if (port < 1 || port > 65535)
                throw new ConfigurationException("Invalid port " + port);
            if ((username == null) != (password == null))
                throw new ConfigurationException("--username and --password must be given together");
            if (caCertificate != null && !Files.isReadable(caCertificate))
                throw new ConfigurationException("CA certificate " + caCertificate + " does not exist or is not readable");
            requirePositive("--timeout", timeoutSeconds);
            if (timeoutSeconds > MAX_TIMEOUT_SECONDS)
                throw new ConfigurationException("--timeout must be at most " + MAX_TIMEOUT_SECONDS + " seconds, got " + timeoutSeconds);
            requirePositive("--concurrency", concurrency);
            requirePositive("--processes", processes);
            requirePositive("--partitionsize", partitionSize);
            return new RepairOptions(this);
        }

        private static void requirePositive(String option, int value)
        {
            if (value < 1)
                throw new ConfigurationException(option + " must be a positive number, got " + value);
        }
    }
}
