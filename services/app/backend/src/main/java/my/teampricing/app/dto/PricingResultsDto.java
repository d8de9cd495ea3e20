package my.teampricing.app.dto;

import java.util.List;
import java.util.Map;

public record PricingResultsDto(
		String viewId,
		String currency,
		Double exchangeRatio,
		Map<String, Double> settings,
		List<StackPricingDto> devStacks,
		List<StackPricingDto> agenticStacks,
		SharedCostsDto sharedCosts,
		ValidationReportDto validation
) {
}
