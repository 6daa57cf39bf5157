/**
 * Pure Java value types shared across all xforge modules.
 *
 * <p>Holds the resolution mode and the failure taxonomy. {@code BuildId} and the
 * atomic file helpers live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libforge.precompiled.types;
