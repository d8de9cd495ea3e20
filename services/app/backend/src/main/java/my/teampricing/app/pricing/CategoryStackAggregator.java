package my.teampricing.app.pricing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CategoryStackAggregator {
	private final AllocationAggregator allocations;
	private final List<PricingOverheadType> activeOverheadTypes;

	public CategoryStackAggregator(AllocationAggregator allocations, List<PricingOverheadType> activeOverheadTypes) {
		this.allocations = allocations;
		this.activeOverheadTypes = activeOverheadTypes;
	}

	public CategoryPool stackPool(EffectiveDataset dataset, EmployeeCategory category, String techStackId) {
		if (!category.isStackBound()) {
			throw new IllegalArgumentException(category + " is pooled globally, not per stack");
		}
		return pool(category, techStackId, dataset.employeesOf(category, techStackId));
	}

	public CategoryPool sharedPool(EffectiveDataset dataset, EmployeeCategory category) {
		return pool(category, null, dataset.employeesOf(category));
	}

	CategoryPool pool(EmployeeCategory category, String techStackId, List<EffectiveEmployee> employees) {
		double monthly = 0.0;
		double raw = 0.0;
		double fte = 0.0;
		Map<String, Double> overheads = new LinkedHashMap<>();
		for (PricingOverheadType type : activeOverheadTypes) {
			overheads.put(type.id(), 0.0);
		}
		for (EffectiveEmployee employee : employees) {
			monthly += allocations.fullyLoadedMonthly(employee);
			raw += allocations.normalizer().rawMonthly(employee.employee());
			fte += employee.employee().fte();
			for (PricingOverheadType type : activeOverheadTypes) {
				overheads.merge(type.id(), allocations.overheadMonthly(employee, type.id()), Double::sum);
			}
		}
		return new CategoryPool(category, techStackId, employees, monthly, raw, Collections.unmodifiableMap(overheads), fte);
	}
}
