package com.pipewright.core.engine;

import java.util.UUID;

public final class RunIds {

    private RunIds() {}

    /**
     * @return 8 lowercase hex characters
     */
    public static String newRunId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
