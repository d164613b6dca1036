package net.orrery.core.model;

import java.util.Locale;

public enum StateType {
    SCHEDULED, PENDING, RUNNING, COMPLETED, FAILED, CANCELLED;

    public static StateType from(String s) {
        if (s == null) throw new IllegalArgumentException("state type is null");
        return StateType.valueOf(s.toUpperCase(Locale.ROOT));
    }
    public String code() { return name(); }
}
