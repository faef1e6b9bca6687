package io.vena.modelsync.exceptions;

public class InvalidPayloadException extends IllegalArgumentException {
	public InvalidPayloadException(String message) { super(message); }
	public InvalidPayloadException(String message, Throwable cause) { super(message, cause); }
}
