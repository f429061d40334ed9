package io.cryptomm.engine.core.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class RebalanceAction {
    private static final RebalanceAction NONE = new RebalanceAction(RebalanceActionType.NONE, null, BigDecimal.ZERO);

    RebalanceActionType actionType;
    // Side that reduces inventory; null for NONE
    OrderSide side;
    BigDecimal quantity;

    public static RebalanceAction none() {
        return NONE;
    }

    public boolean isRequired() {
        return actionType != RebalanceActionType.NONE;
    }
}
