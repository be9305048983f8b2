package com.cusip.refdata.load.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnected,
    Map<String, Long> masterCounts,
    boolean loadRunning
) {
}
