/**
 * Pure Java value types shared across all chatvault modules.
 *
 * <p>Byte readers and key material live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.chatvault.types;
