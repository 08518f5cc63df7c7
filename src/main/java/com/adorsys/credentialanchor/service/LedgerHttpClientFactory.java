package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.config.LedgerConfig;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.jboss.logging.Logger;

/**
 * Builds the pooled HTTP client used for all ledger calls. Automatic retries are disabled:
 * a transaction that may have reached the ledger must not be resubmitted blindly.
 */
public final class LedgerHttpClientFactory {

    private static final Logger logger = Logger.getLogger(LedgerHttpClientFactory.class);

    private static final int MAX_CONNECTIONS = 20;

    private LedgerHttpClientFactory() {
    }

    public static CloseableHttpClient create(LedgerConfig config) {
        Timeout connectTimeout = Timeout.ofMilliseconds(config.getConnectTimeout().toMillis());
        Timeout responseTimeout = Timeout.ofMilliseconds(config.getSubmissionTimeout().toMillis());

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(connectTimeout)
                        .build())
                .setMaxConnTotal(MAX_CONNECTIONS)
                .setMaxConnPerRoute(MAX_CONNECTIONS)
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(connectTimeout)
                .setResponseTimeout(responseTimeout)
                .build();

        logger.debugf("Creating ledger HTTP client: connectTimeout=%s, responseTimeout=%s",
                connectTimeout, responseTimeout);

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();
    }
}
