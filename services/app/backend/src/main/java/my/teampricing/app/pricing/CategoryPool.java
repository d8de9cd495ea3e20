package my.teampricing.app.pricing;

import java.util.List;
import java.util.Map;

/**
 * Active employees of one category, optionally restricted to one stack, with their pooled monthly figures.
 */
public record CategoryPool(EmployeeCategory category,
						   String techStackId,
						   List<EffectiveEmployee> employees,
						   double monthlyCost,
						   double rawMonthlyCost,
						   Map<String, Double> overheadMonthly,
						   double totalFte) {
	public boolean isEmpty() {
		return employees.isEmpty();
	}

	public double overheadMonthly(String overheadTypeId) {
		Double value = overheadMonthly.get(overheadTypeId);
		return value == null ? 0.0 : value;
	}

	public double capacityHours(double hoursPerFte) {
		return hoursPerFte * totalFte;
	}
}
