package com.libforge.precompiled.core.resolve;

/**
 * Tells the fallback policy whether a local build is possible at all.
 */
@FunctionalInterface
public interface ToolchainDetector {

    boolean isAvailable();
}
