package com.scratchsync.domain.model;

/**
 * Logical asset slots of a catalog entity.
 * Each kind names the entity attribute that carries its URL.
 */
public enum AssetKind {
    TICKET("ticket", "ticketImageUrl"),
    ODDS("odds", "oddsImageUrl");

    private final String key;
    private final String attribute;

    AssetKind(String key, String attribute) {
        this.key = key;
        this.attribute = attribute;
    }

    /**
     * Short name used inside storage keys (e.g. "ticket" in "ga/42/ticket-&lt;sha&gt;.png").
     */
    public String getKey() {
        return key;
    }

    /**
     * Entity attribute holding the source URL, later replaced by the hosted URL.
     */
    public String getAttribute() {
        return attribute;
    }

    @Override
    public String toString() {
        return key;
    }
}
