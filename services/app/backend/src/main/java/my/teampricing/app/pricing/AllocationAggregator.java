package my.teampricing.app.pricing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AllocationAggregator {
	private static final int MONTHS_PER_YEAR = 12;

	private final CostNormalizer normalizer;
	private final Map<String, PricingOverheadType> activeTypes;

	public AllocationAggregator(CostNormalizer normalizer, List<PricingOverheadType> activeOverheadTypes) {
		this.normalizer = normalizer;
		this.activeTypes = new LinkedHashMap<>();
		for (PricingOverheadType type : activeOverheadTypes) {
			this.activeTypes.put(type.id(), type);
		}
	}

	public double overheadMonthly(EffectiveEmployee employee, String overheadTypeId) {
		PricingOverheadType type = activeTypes.get(overheadTypeId);
		if (type == null) {
			return 0.0;
		}
		return CostNormalizer.overheadMonthlyEquivalent(type) * employee.share(overheadTypeId);
	}

	public double allocatedOverheadMonthly(EffectiveEmployee employee) {
		double total = 0.0;
		for (String typeId : activeTypes.keySet()) {
			total += overheadMonthly(employee, typeId);
		}
		return total;
	}

	public double fullyLoadedAnnual(EffectiveEmployee employee) {
		return normalizer.annualBase(employee.employee()) + allocatedOverheadMonthly(employee) * MONTHS_PER_YEAR;
	}

	public double fullyLoadedMonthly(EffectiveEmployee employee) {
		return fullyLoadedAnnual(employee) / MONTHS_PER_YEAR;
	}

	public double allocationSum(String overheadTypeId, List<EffectiveEmployee> activeEmployees) {
		double sum = 0.0;
		for (EffectiveEmployee employee : activeEmployees) {
			sum += employee.share(overheadTypeId);
		}
		return sum;
	}

	public int missingAllocationCount(String overheadTypeId, List<EffectiveEmployee> activeEmployees) {
		int missing = 0;
		for (EffectiveEmployee employee : activeEmployees) {
			if (!employee.hasAllocation(overheadTypeId)) {
				missing += 1;
			}
		}
		return missing;
	}

	public CostNormalizer normalizer() {
		return normalizer;
	}
}
