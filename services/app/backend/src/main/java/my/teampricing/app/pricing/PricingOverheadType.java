package my.teampricing.app.pricing;

public record PricingOverheadType(String id,
								  String name,
								  boolean active,
								  double amount,
								  OverheadPeriod period) {
	public PricingOverheadType {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("overhead type id is required");
		}
		if (amount < 0) {
			throw new IllegalArgumentException("overhead amount must not be negative: " + id);
		}
		if (period == null) {
			period = OverheadPeriod.ANNUAL;
		}
	}
}
