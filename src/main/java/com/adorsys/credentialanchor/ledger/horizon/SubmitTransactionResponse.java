package com.adorsys.credentialanchor.ledger.horizon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmitTransactionResponse {

    @JsonProperty("hash")
    private String hash;

    @JsonProperty("ledger")
    private long ledger;

    @JsonProperty("successful")
    private Boolean successful;

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }

    public long getLedger() {
        return ledger;
    }

    public void setLedger(long ledger) {
        this.ledger = ledger;
    }

    public Boolean getSuccessful() {
        return successful;
    }

    public void setSuccessful(Boolean successful) {
        this.successful = successful;
    }
}
