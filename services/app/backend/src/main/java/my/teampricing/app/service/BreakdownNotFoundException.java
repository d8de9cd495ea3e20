package my.teampricing.app.service;

public class BreakdownNotFoundException extends RuntimeException {
	public BreakdownNotFoundException(String stackId, String key) {
		super("No breakdown '" + key + "' for stack " + stackId);
	}
}
