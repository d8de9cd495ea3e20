package my.teampricing.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.teampricing.app.dto.BreakdownResponseDto;
import my.teampricing.app.dto.PricingResultsDto;
import my.teampricing.app.dto.ValidationReportDto;
import my.teampricing.app.service.PricingService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pricing")
@Tag(name = "Pricing")
public class PricingController {
	private final PricingService pricingService;

	public PricingController(PricingService pricingService) {
		this.pricingService = pricingService;
	}

	@GetMapping
	@Operation(summary = "Compute hourly prices per tech stack")
	public PricingResultsDto getResults(@RequestParam(required = false) String viewId) {
		return pricingService.getResults(viewId);
	}

	@GetMapping("/breakdowns")
	@Operation(summary = "Explain one pricing metric of a stack")
	public BreakdownResponseDto getBreakdown(@RequestParam(required = false) String category,
											 @RequestParam String stackId,
											 @RequestParam String key,
											 @RequestParam(required = false) String viewId) {
		return pricingService.getBreakdown(viewId, category, stackId, key);
	}

	@GetMapping("/validation")
	@Operation(summary = "List data-quality warnings for the pricing inputs")
	public ValidationReportDto getValidation(@RequestParam(required = false) String viewId) {
		return pricingService.getValidation(viewId);
	}
}
