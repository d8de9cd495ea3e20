package my.teampricing.app.dto;

import java.util.List;

public record ValidationReportDto(
		String viewId,
		boolean hasWarnings,
		List<String> missingSettings,
		List<String> malformedSettings,
		List<OverheadAllocationStatusDto> invalidOverheadAllocations,
		List<String> employeesMissingAllocation,
		boolean noActiveOverheadTypes,
		List<String> stacksWithoutEmployees
) {
}
