package com.vibecoding.fleetcatalog.model;

import java.util.Collection;
import java.util.Optional;

/**
 * Fleet 리소스 상태. priority 가 클수록 나쁜 상태
 */
public enum FleetState {
    READY("Ready", 0, FleetState.LIFECYCLE_PRODUCTION),
    NOT_READY("NotReady", 1, FleetState.LIFECYCLE_DEPRECATED),
    PENDING("Pending", 2, FleetState.LIFECYCLE_EXPERIMENTAL),
    OUT_OF_SYNC("OutOfSync", 3, FleetState.LIFECYCLE_DEPRECATED),
    MODIFIED("Modified", 4, FleetState.LIFECYCLE_DEPRECATED),
    WAIT_APPLIED("WaitApplied", 5, FleetState.LIFECYCLE_EXPERIMENTAL),
    ERR_APPLIED("ErrApplied", 6, FleetState.LIFECYCLE_DEPRECATED);

    public static final String LIFECYCLE_PRODUCTION = "production";
    public static final String LIFECYCLE_EXPERIMENTAL = "experimental";
    public static final String LIFECYCLE_DEPRECATED = "deprecated";

    /** 알 수 없는 상태는 모든 알려진 상태보다 나쁘게 취급 */
    public static final int UNKNOWN_PRIORITY = 99;

    private final String value;
    private final int priority;
    private final String lifecycle;

    FleetState(String value, int priority, String lifecycle) {
        this.value = value;
        this.priority = priority;
        this.lifecycle = lifecycle;
    }

    public String getValue() {
        return value;
    }

    public int getPriority() {
        return priority;
    }

    public String getLifecycle() {
        return lifecycle;
    }

    public static Optional<FleetState> fromValue(String value) {
        for (FleetState state : values()) {
            if (state.value.equals(value)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    public static int priorityOf(String status) {
        return fromValue(status).map(FleetState::getPriority).orElse(UNKNOWN_PRIORITY);
    }

    /**
     * 가장 나쁜 상태. null/빈 값은 건너뛰고, 남는 것이 없으면 Ready
     */
    public static String worstOf(Collection<String> statuses) {
        String worst = READY.value;
        int worstPriority = READY.priority;
        if (statuses == null) {
            return worst;
        }
        for (String status : statuses) {
            if (status == null || status.isEmpty()) {
                continue;
            }
            int priority = priorityOf(status);
            if (priority > worstPriority) {
                worstPriority = priority;
                worst = status;
            }
        }
        return worst;
    }

    /**
     * 상태 -> lifecycle. 알 수 없거나 없는 상태는 production (deprecated 로 오경보하지 않음)
     */
    public static String toLifecycle(String status) {
        return fromValue(status).map(FleetState::getLifecycle).orElse(LIFECYCLE_PRODUCTION);
    }
}
