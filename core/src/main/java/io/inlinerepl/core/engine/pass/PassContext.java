package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.NameAllocator;
import io.inlinerepl.core.model.TransformOptions;

/**
 * State shared by the passes of one pipeline run.
 *
 * @param options transform options of this run
 * @param budget  loop guard limits
 * @param names   allocator for generated identifiers
 */
public record PassContext(TransformOptions options, GuardBudget budget, NameAllocator names) {}
