package com.adorsys.credentialanchor.ledger.horizon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Subset of the Horizon {@code GET /accounts/{id}} response used by the anchor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountResponse {

    @JsonProperty("account_id")
    private String accountId;

    @JsonProperty("sequence")
    private String sequence;

    @JsonProperty("balances")
    private List<Balance> balances;

    @JsonProperty("data")
    private Map<String, String> data;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Balance {
        @JsonProperty("balance")
        private String balance;

        @JsonProperty("asset_type")
        private String assetType;

        public String getBalance() {
            return balance;
        }

        public void setBalance(String balance) {
            this.balance = balance;
        }

        public String getAssetType() {
            return assetType;
        }

        public void setAssetType(String assetType) {
            this.assetType = assetType;
        }
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getSequence() {
        return sequence;
    }

    public void setSequence(String sequence) {
        this.sequence = sequence;
    }

    public List<Balance> getBalances() {
        return balances;
    }

    public void setBalances(List<Balance> balances) {
        this.balances = balances;
    }

    public Map<String, String> getData() {
        return data;
    }

    public void setData(Map<String, String> data) {
        this.data = data;
    }
}
