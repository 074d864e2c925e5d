package com.fincube.fraud.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Known fraud modalities recognised from combinations of pattern tags.
 */
public enum Archetype {
    MIXER(EnumSet.of(PatternTag.MIXER_VALUE_PATTERN, PatternTag.HIGH_ADDRESS_DIVERSITY, PatternTag.DUST_ACCOUNT)),
    WASH_TRADING(EnumSet.of(PatternTag.TOKEN_WASH_TRADING, PatternTag.MATCHING_SEND_RECEIVE_VALUES)),
    BOT(EnumSet.of(PatternTag.REGULAR_INTERVALS, PatternTag.BURST_ACTIVITY));

    private final Set<PatternTag> indicators;

    Archetype(Set<PatternTag> indicators) {
        this.indicators = Collections.unmodifiableSet(indicators);
    }

    public Set<PatternTag> getIndicators() {
        return indicators;
    }

    public boolean matches(Set<PatternTag> tags) {
        return indicators.stream().anyMatch(tags::contains);
    }
}
