package my.teampricing.app.pricing;

public record ParsedSetting(double value, boolean malformed) {
	public static ParsedSetting of(double value) {
		return new ParsedSetting(value, false);
	}

	public static ParsedSetting malformedZero() {
		return new ParsedSetting(0.0, true);
	}
}
