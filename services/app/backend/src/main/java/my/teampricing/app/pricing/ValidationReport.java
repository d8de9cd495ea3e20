package my.teampricing.app.pricing;

import java.util.List;

/**
 * Data-quality warnings gathered next to a computation. None of them stop the computation.
 */
public record ValidationReport(List<String> missingSettings,
							   List<String> malformedSettings,
							   List<OverheadAllocationStatus> overheadAllocations,
							   List<String> employeesMissingAllocation,
							   boolean noActiveOverheadTypes,
							   List<String> stacksWithoutEmployees) {
	public List<OverheadAllocationStatus> invalidOverheadAllocations() {
		return overheadAllocations.stream().filter(status -> !status.valid()).toList();
	}

	public boolean hasWarnings() {
		return !missingSettings.isEmpty()
				|| !malformedSettings.isEmpty()
				|| !invalidOverheadAllocations().isEmpty()
				|| !employeesMissingAllocation.isEmpty()
				|| noActiveOverheadTypes
				|| !stacksWithoutEmployees.isEmpty();
	}
}
