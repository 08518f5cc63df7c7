package com.adorsys.credentialanchor.ledger.horizon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Horizon error body (RFC 7807 problem) including the transaction result codes on rejections.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HorizonProblem {

    @JsonProperty("title")
    private String title;

    @JsonProperty("status")
    private int status;

    @JsonProperty("detail")
    private String detail;

    @JsonProperty("extras")
    private Extras extras;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Extras {
        @JsonProperty("result_codes")
        private ResultCodes resultCodes;

        public ResultCodes getResultCodes() {
            return resultCodes;
        }

        public void setResultCodes(ResultCodes resultCodes) {
            this.resultCodes = resultCodes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResultCodes {
        @JsonProperty("transaction")
        private String transaction;

        @JsonProperty("operations")
        private List<String> operations;

        public String getTransaction() {
            return transaction;
        }

        public void setTransaction(String transaction) {
            this.transaction = transaction;
        }

        public List<String> getOperations() {
            return operations;
        }

        public void setOperations(List<String> operations) {
            this.operations = operations;
        }
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public Extras getExtras() {
        return extras;
    }

    public void setExtras(Extras extras) {
        this.extras = extras;
    }

    public String getTransactionResultCode() {
        return extras != null && extras.resultCodes != null ? extras.resultCodes.transaction : null;
    }

    public List<String> getOperationResultCodes() {
        return extras != null && extras.resultCodes != null && extras.resultCodes.operations != null
                ? extras.resultCodes.operations : List.of();
    }
}
