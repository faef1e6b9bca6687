package io.vena.modelsync.exceptions;

/**
 * Thrown when a payload is merged into the aggregate model, which only
 * mirrors the events of other models and holds no sessions of its own.
 */
public class AggregateMergeException extends IllegalStateException {
	public AggregateMergeException(String message) { super(message); }
}
