package com.transparenta.analytics.query;

public record JoinRequirements(boolean needsEntityJoin, boolean needsTerritorialJoin) {

    public static final JoinRequirements NONE = new JoinRequirements(false, false);

    public JoinRequirements {
        // territorial rows are reached through the entity
        needsEntityJoin = needsEntityJoin || needsTerritorialJoin;
    }
}
