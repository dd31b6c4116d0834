package com.ccdsim.service;

import com.ccdsim.model.AuxiliaryArray;

/**
 * Resolves a resource reference such as {@code "built-in pattern_noise.npz"} to its array.
 */
@FunctionalInterface
public interface AuxiliaryArraySource {

    /**
     * @throws com.ccdsim.model.CcdSimException with {@link com.ccdsim.model.Fault#RESOURCE}
     *         if the reference cannot be loaded
     */
    AuxiliaryArray load(String reference);
}
