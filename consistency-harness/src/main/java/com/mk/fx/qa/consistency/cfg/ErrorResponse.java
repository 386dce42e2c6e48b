package com.mk.fx.qa.consistency.cfg;

/**
 * Body of every error answer of the REST surface.
 *
 * @param error short error title
 * @param details what went wrong
 */
public record ErrorResponse(String error, String details) {}
