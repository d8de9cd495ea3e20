package my.teampricing.app.dto;

import my.teampricing.app.pricing.EmployeeCategory;

public record BreakdownResponseDto(
		String viewId,
		EmployeeCategory category,
		String stackId,
		String currency,
		BreakdownNodeDto breakdown
) {
}
