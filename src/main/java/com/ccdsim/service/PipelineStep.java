package com.ccdsim.service;

import com.ccdsim.model.Converter;

/**
 * One named, independently switchable step of a transformation pipeline.
 * Implemented by enums whose declaration order is the canonical execution order.
 */
public interface PipelineStep {

    String key();

    String documentation();

    boolean isEnabledByDefault();

    Converter apply(Converter converter, TransformContext context);
}
