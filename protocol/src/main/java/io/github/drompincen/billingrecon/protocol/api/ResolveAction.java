package io.github.drompincen.billingrecon.protocol.api;

public enum ResolveAction {
    APPROVE, DISMISS;

    public ItemStatus targetStatus() {
        return this == APPROVE ? ItemStatus.APPROVED : ItemStatus.DISMISSED;
    }

    public ActivityAction activityAction() {
        return this == APPROVE ? ActivityAction.APPROVED : ActivityAction.DISMISSED;
    }
}
