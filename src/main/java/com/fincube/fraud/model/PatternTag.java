package com.fincube.fraud.model;

/**
 * Indicators raised by the pattern detectors. Each tag belongs to exactly one dimension.
 */
public enum PatternTag {

    BURST_ACTIVITY(PatternDimension.TEMPORAL, "Burst of transfers less than a minute apart"),
    REGULAR_INTERVALS(PatternDimension.TEMPORAL, "Highly regular sub-hour intervals (bot signature)"),
    NIGHT_ACTIVITY(PatternDimension.TEMPORAL, "Predominantly active between 01:00 and 05:00 UTC"),
    SHORT_LIFESPAN_HIGH_VOLUME(PatternDimension.TEMPORAL, "High transfer volume within a 24h lifespan"),

    ROUND_VALUES(PatternDimension.VALUE, "Majority of transfers use round values"),
    MATCHING_SEND_RECEIVE_VALUES(PatternDimension.VALUE, "Sent values mirror received values"),
    MIXER_VALUE_PATTERN(PatternDimension.VALUE, "Near-equal inflow and outflow at high volume"),
    CONSISTENT_SMALL_VALUES(PatternDimension.VALUE, "Low-variance outgoing values (draining or farming)"),

    HIGH_ADDRESS_DIVERSITY(PatternDimension.NETWORK, "Almost every transfer uses a new counterparty"),
    ONE_TIME_INTERACTIONS(PatternDimension.NETWORK, "Most recipients are used exactly once"),
    CIRCULAR_FLOW(PatternDimension.NETWORK, "Funds flow back from the same counterparties"),
    DENYLISTED_COUNTERPARTIES(PatternDimension.NETWORK, "Repeated transfers to denylisted address patterns"),

    EXCESSIVE_TOKEN_DIVERSITY(PatternDimension.TOKEN, "Interacts with an unusually large number of tokens"),
    TOKEN_WASH_TRADING(PatternDimension.TOKEN, "Balanced back-and-forth flows on several tokens"),
    HIGH_NFT_ACTIVITY(PatternDimension.TOKEN, "High NFT transfer activity"),

    DUST_ACCOUNT(PatternDimension.BEHAVIORAL, "High activity with a near-zero balance"),
    IMMEDIATE_FORWARDING(PatternDimension.BEHAVIORAL, "Received funds are forwarded within minutes"),
    ASYMMETRIC_FLOW(PatternDimension.BEHAVIORAL, "Transfers are almost entirely one-directional"),
    ZERO_VALUE_SPAM(PatternDimension.BEHAVIORAL, "Majority of transfers carry zero value");

    private final PatternDimension dimension;
    private final String description;

    PatternTag(PatternDimension dimension, String description) {
        this.dimension = dimension;
        this.description = description;
    }

    public PatternDimension getDimension() {
        return dimension;
    }

    public String getDescription() {
        return description;
    }
}
