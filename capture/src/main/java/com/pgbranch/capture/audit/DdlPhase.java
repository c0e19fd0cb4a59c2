package com.pgbranch.capture.audit;

public enum DdlPhase {
    START,
    END;

    public static DdlPhase fromText(String text) {
        return "start".equalsIgnoreCase(text) ? START : END;
    }
}
