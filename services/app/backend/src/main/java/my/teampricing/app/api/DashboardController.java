package my.teampricing.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.teampricing.app.dto.DashboardSummaryDto;
import my.teampricing.app.service.PricingService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@Tag(name = "Dashboard")
public class DashboardController {
	private final PricingService pricingService;

	public DashboardController(PricingService pricingService) {
		this.pricingService = pricingService;
	}

	@GetMapping
	@Operation(summary = "Team cost summary")
	public DashboardSummaryDto getSummary(@RequestParam(required = false) String viewId) {
		return pricingService.getDashboard(viewId);
	}
}
