/**
 * Shared utilities for all xforge modules.
 *
 * <p>Contains {@link com.libforge.precompiled.util.BuildId} (the release key derived
 * from hashing build inputs) and {@link com.libforge.precompiled.util.AtomicFiles}.
 * No framework dependencies, pure Java.
 */
package com.libforge.precompiled.util;
