package com.adorsys.credentialanchor.config;

import java.util.Locale;

/**
 * Stellar networks the extension can anchor to, with their passphrases and public Horizon endpoints.
 */
public enum LedgerNetwork {
    MAINNET("mainnet", "Public Global Stellar Network ; September 2015", "https://horizon.stellar.org"),
    TESTNET("testnet", "Test SDF Network ; September 2015", "https://horizon-testnet.stellar.org");

    private final String id;
    private final String passphrase;
    private final String defaultHorizonUrl;

    LedgerNetwork(String id, String passphrase, String defaultHorizonUrl) {
        this.id = id;
        this.passphrase = passphrase;
        this.defaultHorizonUrl = defaultHorizonUrl;
    }

    public String getId() {
        return id;
    }

    public String getPassphrase() {
        return passphrase;
    }

    public String getDefaultHorizonUrl() {
        return defaultHorizonUrl;
    }

    /**
     * @return the network for the given id, or null if the id names none
     */
    public static LedgerNetwork fromId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (LedgerNetwork network : values()) {
            if (network.id.equals(normalized)) {
                return network;
            }
        }
        return null;
    }
}
