package com.routine.loader.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Session settings under which stored routines are loaded and run.
 */
@Value
public class SessionSettings {
    @NonNull
    String sqlMode;
    @NonNull
    String characterSet;
    @NonNull
    String collation;

    public SessionSettings withSqlMode(String canonicalSqlMode) {
        return new SessionSettings(canonicalSqlMode, characterSet, collation);
    }
}
