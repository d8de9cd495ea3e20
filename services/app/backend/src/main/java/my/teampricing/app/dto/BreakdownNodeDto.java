package my.teampricing.app.dto;

import my.teampricing.app.pricing.BreakdownOperation;

import java.util.List;

public record BreakdownNodeDto(
		String key,
		String label,
		BreakdownOperation operation,
		Double result,
		String formula,
		boolean monetary,
		List<BreakdownNodeDto> inputs
) {
}
