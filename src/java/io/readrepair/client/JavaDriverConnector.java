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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

import com.google.common.annotations.VisibleForTesting;

import com.datastax.driver.core.Cluster;
import com.datastax.driver.core.PlainTextAuthProvider;
import com.datastax.driver.core.ProtocolOptions;
import com.datastax.driver.core.RemoteEndpointAwareJdkSSLOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.readrepair.config.RepairOptions;
import io.readrepair.exceptions.ConfigurationException;

/**
 * Builds a fresh driver {@link Cluster} per session from the operator's connection options.
 */
public class JavaDriverConnector implements ClusterConnector
{
    private static final Logger logger = LoggerFactory.getLogger(JavaDriverConnector.class);

    static final String TLS_PROTOCOL = "TLSv1.2";

    private final RepairOptions options;
    private final SSLContext sslContext;

    public JavaDriverConnector(RepairOptions options)
    {
        this.options = options;
        this.sslContext = options.caCertificate == null ? null : sslContext(options.caCertificate);
    }

    @Override
    public ClusterSession connect()
    {
        return new JavaDriverSession(clusterBuilder().build());
    }

    @VisibleForTesting
    Cluster.Builder clusterBuilder()
    {
        Cluster.Builder builder = Cluster.builder()
                                         .addContactPoints(options.hosts.toArray(new String[0]))
                                         .withPort(options.port)
                                         .withCompression(ProtocolOptions.Compression.NONE)
                                         .withoutJMXReporting();

        if (options.username != null)
            builder.withAuthProvider(new PlainTextAuthProvider(options.username, options.password));

        if (sslContext != null)
            builder.withSSL(RemoteEndpointAwareJdkSSLOptions.builder().withSSLContext(sslContext).build());

        return builder;
    }

    /**
     * An SSL context trusting exactly the certificates found in the given PEM or DER file.
     */
    @VisibleForTesting
    static SSLContext sslContext(Path caCertificate)
    {
        try (InputStream in = Files.newInputStream(caCertificate))
        {
            Collection<? extends Certificate> certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
            if (certificates.isEmpty())
                throw new ConfigurationException("No certificate found in " + caCertificate);

            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            int i = 0;
            for (Certificate certificate : certificates)
                trustStore.setCertificateEntry("ca-" + i++, certificate);

            TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagerFactory.init(trustStore);

            SSLContext context = SSLContext.getInstance(TLS_PROTOCOL);
            context.init(null, trustManagerFactory.getTrustManagers(), null);
            logger.info("Using {} with {} trusted certificate(s) from {}", TLS_PROTOCOL, certificates.size(), caCertificate);
            return context;
        }
        catch (IOException | GeneralSecurityException e)
        {
            throw new ConfigurationException("Unable to load CA certificate " + caCertificate + ": " + e.getMessage(), e);
        }
    }
}
