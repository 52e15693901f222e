package com.pipewright.core.pipeline;

/**
 * How a completed step hands over to the next one.
 */
public enum ChainingMode {
    /** Launch the next step as a separate process and return. */
    PROCESS,
    /** Keep executing the next step in the current process. */
    INLINE
}
