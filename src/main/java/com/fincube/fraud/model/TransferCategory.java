package com.fincube.fraud.model;

/**
 * Asset transfer categories as reported by the ledger.
 * Token categories correspond to ERC-20, ERC-721 and ERC-1155 transfers.
 */
public enum TransferCategory {
    EXTERNAL,
    INTERNAL,
    FUNGIBLE_TOKEN,
    NFT,
    MULTI_TOKEN;

    public boolean isToken() {
        return this == FUNGIBLE_TOKEN || this == NFT || this == MULTI_TOKEN;
    }

    /**
     * Maps a ledger category string (external, internal, erc20, erc721, erc1155).
     * Unknown values fall back to EXTERNAL.
     */
    public static TransferCategory fromLedgerName(String name) {
        if (name == null) return EXTERNAL;
        switch (name.trim().toLowerCase()) {
            case "internal":
                return INTERNAL;
            case "erc20":
                return FUNGIBLE_TOKEN;
            case "erc721":
                return NFT;
            case "erc1155":
                return MULTI_TOKEN;
            default:
                return EXTERNAL;
        }
    }
}
