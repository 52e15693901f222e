package com.pipewright.core.model;

import java.time.Instant;

/**
 * @param mergeRequestUrl    durable reference to the merged change
 * @param mergeRequestNumber number assigned by the hosting service, may be null
 * @param shippedAt          when the change was merged
 */
public record ShipOutput(String mergeRequestUrl, Integer mergeRequestNumber, Instant shippedAt)
        implements StepOutput {}
