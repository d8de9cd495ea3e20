package my.teampricing.app.pricing;

import java.util.Map;

public record EffectiveEmployee(PricingEmployee employee,
								Map<String, Double> shares,
								boolean activeOverridden) {
	public EffectiveEmployee {
		shares = shares == null ? Map.of() : shares;
	}

	public String id() {
		return employee.id();
	}

	public EmployeeCategory category() {
		return employee.category();
	}

	public double share(String overheadTypeId) {
		Double share = shares.get(overheadTypeId);
		return share == null ? 0.0 : share;
	}

	public boolean hasAllocation(String overheadTypeId) {
		return share(overheadTypeId) > 0.0;
	}
}
