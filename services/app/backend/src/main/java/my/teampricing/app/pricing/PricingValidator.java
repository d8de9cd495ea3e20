package my.teampricing.app.pricing;

import java.util.ArrayList;
import java.util.List;

public class PricingValidator {
	public static final double DEFAULT_TOLERANCE = 0.005;

	private final double tolerance;

	public PricingValidator() {
		this(DEFAULT_TOLERANCE);
	}

	public PricingValidator(double tolerance) {
		if (tolerance < 0) {
			throw new IllegalArgumentException("Allocation tolerance must not be negative");
		}
		this.tolerance = tolerance;
	}

	public boolean isAllocationValid(double sum) {
		return Math.abs(sum - 1.0) <= tolerance;
	}

	public List<OverheadAllocationStatus> allocationStatuses(EffectiveDataset dataset, AllocationAggregator allocations) {
		List<OverheadAllocationStatus> statuses = new ArrayList<>();
		for (PricingOverheadType type : dataset.activeOverheadTypes()) {
			double sum = allocations.allocationSum(type.id(), dataset.activeEmployees());
			statuses.add(new OverheadAllocationStatus(
					type.id(),
					type.name(),
					sum,
					isAllocationValid(sum),
					allocations.missingAllocationCount(type.id(), dataset.activeEmployees())
			));
		}
		return List.copyOf(statuses);
	}

	public ValidationReport validate(EffectiveDataset dataset, PricingSettings settings, AllocationAggregator allocations) {
		List<String> employeesMissingAllocation = new ArrayList<>();
		for (EffectiveEmployee employee : dataset.activeEmployees()) {
			boolean missing = dataset.activeOverheadTypes().stream()
					.anyMatch(type -> !employee.hasAllocation(type.id()));
			if (missing) {
				employeesMissingAllocation.add(employee.id());
			}
		}

		List<String> stacksWithoutEmployees = new ArrayList<>();
		for (TechStackRef stack : dataset.techStacks()) {
			boolean staffed = dataset.activeEmployees().stream()
					.anyMatch(employee -> employee.category().isStackBound() && stack.id().equals(employee.employee().techStackId()));
			if (!staffed) {
				stacksWithoutEmployees.add(stack.id());
			}
		}

		return new ValidationReport(
				settings.missingKeys(),
				settings.malformedKeys(),
				allocationStatuses(dataset, allocations),
				List.copyOf(employeesMissingAllocation),
				dataset.activeOverheadTypes().isEmpty(),
				List.copyOf(stacksWithoutEmployees)
		);
	}
}
