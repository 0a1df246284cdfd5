package com.questrail.enumbits.mapping;

/**
 * Indicates that a {@link BitLayout} could not be built from the requested
 * configuration.
 *
 * This typically reflects:
 * <ul>
 *   <li>An end value outside {@code 0..digits} of the storage word</li>
 *   <li>An enum with more constants than the storage word has bits</li>
 * </ul>
 *
 * Layouts are normally held in {@code static final} fields, so this surfaces
 * when the owning class is initialised.
 */
public final class BitLayoutException extends RuntimeException
{
    public BitLayoutException(String message) {
        super(message);
    }
}
