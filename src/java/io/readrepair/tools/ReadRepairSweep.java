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

package io.readrepair.tools;

import java.io.PrintStream;
import java.util.function.Function;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;

import io.airlift.airline.Command;
import io.airlift.airline.Help;
import io.airlift.airline.Option;
import io.airlift.airline.ParseException;
import io.airlift.airline.SingleCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.readrepair.client.ClusterConnector;
import io.readrepair.client.JavaDriverConnector;
import io.readrepair.config.RepairOptions;
import io.readrepair.exceptions.ConfigurationException;
import io.readrepair.repair.ProgressReporter;
import io.readrepair.repair.SweepCoordinator;
import io.readrepair.repair.SweepReport;
import io.readrepair.repair.SweepResult;

/**
 * Command line entry point. Exits with {@value #EXIT_SUCCESS} when every keyspace was fully swept,
 * {@value #EXIT_FAILURE} when a table or keyspace failed or the cluster could not be reached, and
 * {@value #EXIT_BAD_USAGE} on invalid arguments.
 */
@Command(name = ReadRepairSweep.TOOL_NAME, description = "Performant Cassandra/Scylla cluster read repairer using consistency level = ALL")
public class ReadRepairSweep
{
    private static final Logger logger = LoggerFactory.getLogger(ReadRepairSweep.class);

    static final String TOOL_NAME = "read-repair-sweep";

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_BAD_USAGE = 2;

    @VisibleForTesting
    static Function<RepairOptions, ClusterConnector> connectorFactory = JavaDriverConnector::new;

    @Option(name = "--hosts", title = "hosts", description = "comma delimited target hosts to connect to (required)")
    String hosts;

    @Option(name = "--port", title = "port", description = "native protocol port (default 9042)")
    int port = RepairOptions.DEFAULT_PORT;

    @Option(name = "--username", title = "username", description = "username to login as")
    String username;

    @Option(name = "--password", title = "password", description = "user password")
    String password;

    @Option(name = "--cacert", title = "cacert", description = "SSL CA certificates path")
    String caCertificate;

    @Option(name = "--timeout", title = "seconds", description = "request timeout in seconds (default 60)")
    int timeoutSeconds = RepairOptions.DEFAULT_TIMEOUT_SECONDS;

    @Option(name = "--concurrency", title = "concurrency", description = "query execution concurrency per table (default 100)")
    int concurrency = RepairOptions.DEFAULT_CONCURRENCY;

    @Option(name = "--processes", title = "processes", description = "number of tables to repair in parallel (default 5)")
    int processes = RepairOptions.DEFAULT_PROCESSES;

    @Option(name = "--partitionsize", title = "size", description = "number of token ranges to split the ring into (default 10000)")
    int partitionSize = RepairOptions.DEFAULT_PARTITION_SIZE;

    @Option(name = "--keyspaces", title = "keyspaces", description = "comma separated keyspaces to repair")
    String keyspaces;

    @Option(name = "--tables", title = "tables", description = "comma separated tables to repair")
    String tables;

    @Option(name = { "-h", "--help" }, description = "Display help information")
    boolean help;

    public static void main(String... args)
    {
        System.exit(run(System.out, System.err, args));
    }

    @VisibleForTesting
    static int run(PrintStream out, PrintStream err, String... args)
    {
        SingleCommand<ReadRepairSweep> parser = SingleCommand.singleCommand(ReadRepairSweep.class);
        ReadRepairSweep command;
        try
        {
            command = parser.parse(args);
        }
        catch (ParseException e)
        {
            badUse(err, e);
            return EXIT_BAD_USAGE;
        }

        if (command.help)
        {
            StringBuilder usage = new StringBuilder();
            Help.help(parser.getCommandMetadata(), usage);
            out.print(usage);
            return EXIT_SUCCESS;
        }

        return command.execute(out, err);
    }

    @VisibleForTesting
    RepairOptions options()
    {
        return RepairOptions.builder()
                            .hosts(hosts)
                            .port(port)
                            .credentials(username, password)
                            .caCertificate(caCertificate)
                            .timeoutSeconds(timeoutSeconds)
                            .concurrency(concurrency)
                            .processes(processes)
                            .partitionSize(partitionSize)
                            .keyspaces(keyspaces)
                            .tables(tables)
                            .build();
    }

    int execute(PrintStream out, PrintStream err)
    {
        SweepCoordinator coordinator;
        try
        {
            RepairOptions options = options();
            logger.info("Starting read repair sweep with {}", options);
            coordinator = new SweepCoordinator(options, connectorFactory.apply(options), new ProgressReporter(out));
        }
        catch (ConfigurationException e)
        {
            badUse(err, e);
            return EXIT_BAD_USAGE;
        }

        SweepReport report;
        try
        {
            report = coordinator.sweep();
        }
        catch (ConfigurationException e)
        {
            badUse(err, e);
            return EXIT_BAD_USAGE;
        }
        catch (Exception e)
        {
            logger.error("Read repair sweep aborted", e);
            err(err, Throwables.getRootCause(e));
            return EXIT_FAILURE;
        }

        if (report.succeeded())
            return EXIT_SUCCESS;

        for (String keyspace : report.unresolvedKeyspaces())
            err.println("unable to resolve keyspace " + keyspace);
        for (SweepResult failed : report.failedTables())
            err.println("failed to repair " + failed.keyspace + '.' + failed.table);
        return EXIT_FAILURE;
    }

    private static void badUse(PrintStream err, Exception e)
    {
        err.println(TOOL_NAME + ": " + e.getMessage());
        err.println("See '" + TOOL_NAME + " --help'.");
    }

    private static void err(PrintStream err, Throwable e)
    {
        err.println("error: " + e.getMessage());
        err.println("-- StackTrace --");
        err.println(Throwables.getStackTraceAsString(e));
    }
}
