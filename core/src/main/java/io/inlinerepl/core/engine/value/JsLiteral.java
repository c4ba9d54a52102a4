package io.inlinerepl.core.engine.value;

/**
 * Pre-rendered text for values JSON cannot represent ({@code undefined}, bigints, functions,
 * symbols). Carried inside decycled trees as a POJO node and printed verbatim.
 */
record JsLiteral(String text) {}
