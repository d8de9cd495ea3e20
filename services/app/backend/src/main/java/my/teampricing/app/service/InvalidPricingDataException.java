package my.teampricing.app.service;

/**
 * A stored row violates the engine's input constraints, for example a negative salary. The request itself was fine.
 */
public class InvalidPricingDataException extends RuntimeException {
	public InvalidPricingDataException(String message, Throwable cause) {
		super(message, cause);
	}
}
