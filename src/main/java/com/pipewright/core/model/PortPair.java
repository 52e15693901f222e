package com.pipewright.core.model;

import java.io.Serializable;

/**
 * Backend and frontend ports assigned to one workspace slot.
 */
public record PortPair(int backend, int frontend) implements Serializable {}
