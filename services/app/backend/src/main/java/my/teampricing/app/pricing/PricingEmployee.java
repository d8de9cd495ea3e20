package my.teampricing.app.pricing;

public record PricingEmployee(String id,
							  String name,
							  EmployeeCategory category,
							  String techStackId,
							  boolean active,
							  double grossMonthly,
							  double netMonthly,
							  Double oncostRate,
							  Double annualBenefits,
							  Double annualBonus,
							  double fte) {
	public PricingEmployee {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("employee id is required");
		}
		if (category == null) {
			throw new IllegalArgumentException("employee category is required: " + id);
		}
		if (grossMonthly < 0) {
			throw new IllegalArgumentException("grossMonthly must not be negative: " + id);
		}
		if (annualBenefits != null && annualBenefits < 0) {
			throw new IllegalArgumentException("annualBenefits must not be negative: " + id);
		}
		if (annualBonus != null && annualBonus < 0) {
			throw new IllegalArgumentException("annualBonus must not be negative: " + id);
		}
		if (fte < 0) {
			throw new IllegalArgumentException("fte must not be negative: " + id);
		}
	}
}
