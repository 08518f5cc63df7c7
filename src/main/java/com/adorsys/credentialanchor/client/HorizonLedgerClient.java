package com.adorsys.credentialanchor.client;

import com.adorsys.credentialanchor.exception.AccountException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.ledger.AccountState;
import com.adorsys.credentialanchor.ledger.SubmissionResult;
import com.adorsys.credentialanchor.ledger.horizon.AccountResponse;
import com.adorsys.credentialanchor.ledger.horizon.HorizonProblem;
import com.adorsys.credentialanchor.ledger.horizon.SubmitTransactionResponse;
import com.adorsys.credentialanchor.ledger.xdr.SignedTransaction;
import com.adorsys.credentialanchor.service.CircuitBreaker;
import com.adorsys.credentialanchor.util.HttpStatusCode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Apache HTTP Client implementation of {@link LedgerClient} talking to a Stellar Horizon server,
 * with circuit breaker support.
 */
public class HorizonLedgerClient implements LedgerClient {

    private static final Logger logger = Logger.getLogger(HorizonLedgerClient.class);

    private static final String ACCOUNTS_PATH = "accounts/";
    private static final String TRANSACTIONS_PATH = "transactions";
    private static final String NATIVE_ASSET = "native";

    private final String horizonUrl;
    private final CloseableHttpClient httpClient;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;

    /**
     * @param horizonUrl     the Horizon base URL
     * @param httpClient     the HTTP client to use, carrying the connect and response timeouts
     * @param circuitBreaker optional circuit breaker (can be null to disable)
     */
    public HorizonLedgerClient(String horizonUrl, CloseableHttpClient httpClient, CircuitBreaker circuitBreaker) {
        this.horizonUrl = horizonUrl.endsWith("/") ? horizonUrl : horizonUrl + "/";
        this.httpClient = httpClient;
        this.circuitBreaker = circuitBreaker;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        logger.infof("Initialized HorizonLedgerClient with horizonUrl: %s, circuitBreaker: %s",
                this.horizonUrl, circuitBreaker != null ? "enabled" : "disabled");
    }

    @Override
    public AccountState loadAccount(String accountId) throws AccountException, SubmissionException {
        checkCircuitBreaker();

        String requestId = UUID.randomUUID().toString();
        logger.debugf("Request ID: %s, Loading account: %s", requestId, accountId);

        HttpGet httpGet = new HttpGet(horizonUrl + ACCOUNTS_PATH + accountId);
        configureRequest(httpGet, requestId);

        HorizonResponse response = execute(httpGet, requestId, "Failed to load account " + accountId);

        if (response.statusCode() == HttpStatusCode.NOT_FOUND.getCode()) {
            recordSuccess();
            logger.warnf("Request ID: %s, Account %s does not exist on the network", requestId, accountId);
            throw new AccountException("Account " + accountId
                    + " does not exist on the network. Please fund it first.", accountId);
        }
        if (!HttpStatusCode.isSuccess(response.statusCode())) {
            throw failure(requestId, "Failed to load account " + accountId, response);
        }

        recordSuccess();
        AccountResponse account = readBody(response, AccountResponse.class, requestId);
        AccountState state = toAccountState(accountId, account);
        logger.debugf("Request ID: %s, Loaded %s", requestId, state);
        return state;
    }

    @Override
    public SubmissionResult submitTransaction(SignedTransaction transaction) throws SubmissionException {
        checkCircuitBreaker();

        String requestId = UUID.randomUUID().toString();
        String transactionHash = transaction.getHashHex();
        logger.debugf("Request ID: %s, Submitting transaction %s (memo '%s')",
                requestId, transactionHash, transaction.getTransaction().getMemo());

        HttpPost httpPost = new HttpPost(horizonUrl + TRANSACTIONS_PATH);
        configureRequest(httpPost, requestId);
        httpPost.setEntity(new UrlEncodedFormEntity(
                List.of(new BasicNameValuePair("tx", transaction.toEnvelopeXdrBase64())), StandardCharsets.UTF_8));

        HorizonResponse response = execute(httpPost, requestId, "Failed to submit transaction " + transactionHash);

        if (HttpStatusCode.isSuccess(response.statusCode())) {
            recordSuccess();
            SubmitTransactionResponse body = readBody(response, SubmitTransactionResponse.class, requestId);
            if (Boolean.FALSE.equals(body.getSuccessful())) {
                throw new SubmissionException("Transaction " + body.getHash() + " was included but failed",
                        response.statusCode());
            }
            logger.infof("Request ID: %s, Transaction %s included in ledger %d",
                    requestId, body.getHash(), body.getLedger());
            return new SubmissionResult(body.getHash(), body.getLedger());
        }

        if (response.statusCode() == HttpStatusCode.BAD_REQUEST.getCode()) {
            // rejected by the ledger: the endpoint itself is healthy
            recordSuccess();
            HorizonProblem problem = readProblem(response);
            String resultCode = problem != null ? problem.getTransactionResultCode() : null;
            List<String> operationCodes = problem != null ? problem.getOperationResultCodes() : List.of();
            logger.errorf("Request ID: %s, Transaction %s rejected. Result code: %s, Operation codes: %s",
                    requestId, transactionHash, resultCode, operationCodes);
            throw new SubmissionException("Transaction rejected by the ledger: "
                    + (resultCode != null ? resultCode : "unknown result"),
                    response.statusCode(), resultCode, operationCodes);
        }

        throw failure(requestId, "Failed to submit transaction " + transactionHash, response);
    }

    @Override
    public boolean checkHealth() {
        String requestId = UUID.randomUUID().toString();
        logger.debugf("Request ID: %s, Checking ledger endpoint health at: %s", requestId, horizonUrl);

        HttpGet httpGet = new HttpGet(horizonUrl);
        configureRequest(httpGet, requestId);

        try {
            int statusCode = httpClient.execute(httpGet, ClassicHttpResponse::getCode);
            if (HttpStatusCode.isSuccess(statusCode)) {
                logger.debugf("Request ID: %s, Ledger endpoint health check successful.", requestId);
                return true;
            }
            logger.warnf("Request ID: %s, Ledger endpoint health check failed. Status code: %d", requestId, statusCode);
            return false;
        } catch (IOException e) {
            logger.errorf(e, "Request ID: %s, Error during ledger endpoint health check", requestId);
            return false;
        }
    }

    private HorizonResponse execute(HttpUriRequestBase request, String requestId, String errorMessage)
            throws SubmissionException {
        try {
            return httpClient.execute(request, response -> new HorizonResponse(response.getCode(), readEntity(response)));
        } catch (SocketTimeoutException e) {
            recordFailure();
            logger.errorf("Request ID: %s, Timeout: %s: %s", requestId, errorMessage, e.getMessage());
            throw new SubmissionException("Timeout: " + errorMessage, e);
        } catch (InterruptedIOException e) {
            Thread.currentThread().interrupt();
            recordFailure();
            logger.errorf(e, "Request ID: %s, Interrupted: %s", requestId, errorMessage);
            throw new SubmissionException("Interrupted: " + errorMessage, e);
        } catch (IOException e) {
            recordFailure();
            logger.errorf(e, "Request ID: %s, %s: %s", requestId, errorMessage, e.getMessage());
            throw new SubmissionException(errorMessage, e);
        }
    }

    private SubmissionException failure(String requestId, String errorMessage, HorizonResponse response) {
        recordFailure();
        logger.errorf("Request ID: %s, %s. Status code: %d, Response: %s",
                requestId, errorMessage, response.statusCode(), response.body());
        return new SubmissionException(errorMessage + ". Status code: " + response.statusCode(), response.statusCode());
    }

    private <T> T readBody(HorizonResponse response, Class<T> type, String requestId) throws SubmissionException {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (IOException e) {
            logger.errorf(e, "Request ID: %s, Unreadable ledger response: %s", requestId, response.body());
            throw new SubmissionException("Unreadable ledger response", e);
        }
    }

    private HorizonProblem readProblem(HorizonResponse response) {
        try {
            return objectMapper.readValue(response.body(), HorizonProblem.class);
        } catch (IOException e) {
            logger.debugf("Ledger error body is not a problem document: %s", e.getMessage());
            return null;
        }
    }

    private static String readEntity(ClassicHttpResponse response) throws IOException {
        if (response.getEntity() == null) {
            return "";
        }
        try {
            return EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        } catch (ParseException e) {
            return "Unable to read response body: " + e.getMessage();
        }
    }

    private AccountState toAccountState(String accountId, AccountResponse account) throws SubmissionException {
        long sequence;
        try {
            sequence = Long.parseLong(account.getSequence());
        } catch (NumberFormatException e) {
            throw new SubmissionException("Invalid sequence number for account " + accountId, e);
        }
        BigDecimal nativeBalance = BigDecimal.ZERO;
        if (account.getBalances() != null) {
            nativeBalance = account.getBalances().stream()
                    .filter(balance -> NATIVE_ASSET.equals(balance.getAssetType()))
                    .map(balance -> new BigDecimal(balance.getBalance()))
                    .findFirst()
                    .orElse(BigDecimal.ZERO);
        }
        String id = account.getAccountId() != null ? account.getAccountId() : accountId;
        return new AccountState(id, sequence, nativeBalance, account.getData());
    }

    // timeouts come from the client's default request config
    private void configureRequest(HttpUriRequestBase request, String requestId) {
        request.setHeader("X-Request-ID", requestId);
        request.setHeader("Accept", "application/json");
    }

    private void checkCircuitBreaker() throws SubmissionException {
        if (circuitBreaker == null) {
            return;
        }
        try {
            circuitBreaker.checkState();
        } catch (CircuitBreaker.CircuitBreakerOpenException e) {
            logger.warnf("Ledger call rejected: %s", e.getMessage());
            throw new SubmissionException("Ledger endpoint unavailable: " + e.getMessage(), e);
        }
    }

    private void recordSuccess() {
        if (circuitBreaker != null) {
            circuitBreaker.recordSuccess();
        }
    }

    private void recordFailure() {
        if (circuitBreaker != null) {
            circuitBreaker.recordFailure();
        }
    }

    private record HorizonResponse(int statusCode, String body) {
    }
}
