package my.teampricing.app.api;

import my.teampricing.app.dto.BreakdownNodeDto;
import my.teampricing.app.dto.BreakdownResponseDto;
import my.teampricing.app.dto.PricingResultsDto;
import my.teampricing.app.dto.SharedCostsDto;
import my.teampricing.app.dto.StackPricingDto;
import my.teampricing.app.dto.ValidationReportDto;
import my.teampricing.app.pricing.BreakdownOperation;
import my.teampricing.app.pricing.EmployeeCategory;
import my.teampricing.app.pricing.PricingStatus;
import my.teampricing.app.service.BreakdownNotFoundException;
import my.teampricing.app.service.PricingService;
import my.teampricing.app.service.PricingViewNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PricingControllerTest {
	@Mock
	private PricingService pricingService;

	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.standaloneSetup(new PricingController(pricingService))
				.setControllerAdvice(new RestExceptionHandler())
				.build();
	}

	@Test
	void returnsPricingResults() throws Exception {
		StackPricingDto java = new StackPricingDto("java", "Java", EmployeeCategory.DEV, PricingStatus.PRICED, 1, 1.0, 100.0,
				300.0, 300.0, 0.0, 0.0, 300.0, 1.0, List.of(), 0.0, 0.0, 300.0, 396.0);
		StackPricingDto go = new StackPricingDto("go", "Go", EmployeeCategory.DEV, PricingStatus.NO_EMPLOYEES, 0, 0.0, 0.0,
				null, null, 0.0, 0.0, null, null, List.of(), null, null, null, null);
		ValidationReportDto validation = new ValidationReportDto(null, true, List.of(), List.of(), List.of(), List.of(),
				true, List.of("go"));
		when(pricingService.getResults(null)).thenReturn(new PricingResultsDto(null, "EGP", null, Map.of("margin", 0.2),
				List.of(java, go), List.of(), new SharedCostsDto(0.0, 0.0, 0.0, 0.0, 0, 0), validation));

		mockMvc.perform(get("/api/pricing"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.currency").value("EGP"))
				.andExpect(jsonPath("$.devStacks[0].stackId").value("java"))
				.andExpect(jsonPath("$.devStacks[0].finalPrice").value(396.0))
				.andExpect(jsonPath("$.devStacks[1].status").value("NO_EMPLOYEES"))
				.andExpect(jsonPath("$.devStacks[1].finalPrice").isEmpty())
				.andExpect(jsonPath("$.validation.stacksWithoutEmployees[0]").value("go"));
	}

	@Test
	void returnsBreakdownTree() throws Exception {
		BreakdownNodeDto leaf = new BreakdownNodeDto("margin", "margin", BreakdownOperation.VALUE, 0.2, null, false, List.of());
		BreakdownNodeDto one = new BreakdownNodeDto("one", "1", BreakdownOperation.VALUE, 1.0, null, false, List.of());
		BreakdownNodeDto root = new BreakdownNodeDto("margin_multiplier", "Margin multiplier", BreakdownOperation.SUM, 1.2,
				"1 + margin", false, List.of(one, leaf));
		when(pricingService.getBreakdown("lean", "DEV", "java", "margin_multiplier"))
				.thenReturn(new BreakdownResponseDto("lean", EmployeeCategory.DEV, "java", "EGP", root));

		mockMvc.perform(get("/api/pricing/breakdowns")
						.param("viewId", "lean")
						.param("category", "DEV")
						.param("stackId", "java")
						.param("key", "margin_multiplier"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.breakdown.operation").value("SUM"))
				.andExpect(jsonPath("$.breakdown.formula").value("1 + margin"))
				.andExpect(jsonPath("$.breakdown.inputs.length()").value(2));
	}

	@Test
	void unknownViewIsNotFound() throws Exception {
		when(pricingService.getValidation("ghost")).thenThrow(new PricingViewNotFoundException("ghost"));

		mockMvc.perform(get("/api/pricing/validation").param("viewId", "ghost"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.title").value("Pricing view not found"))
				.andExpect(jsonPath("$.detail").value("Pricing view not found: ghost"));
	}

	@Test
	void unknownBreakdownIsNotFound() throws Exception {
		when(pricingService.getBreakdown(null, null, "java", "nope"))
				.thenThrow(new BreakdownNotFoundException("java", "nope"));

		mockMvc.perform(get("/api/pricing/breakdowns").param("stackId", "java").param("key", "nope"))
				.andExpect(status().isNotFound());
	}

	@Test
	void invalidCategoryIsBadRequest() throws Exception {
		when(pricingService.getBreakdown(null, "QA", "java", "final_price_hr"))
				.thenThrow(new IllegalArgumentException("Breakdowns exist for DEV and AGENTIC_AI only, not QA"));

		mockMvc.perform(get("/api/pricing/breakdowns")
						.param("category", "QA")
						.param("stackId", "java")
						.param("key", "final_price_hr"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.status").value(400));
	}

	@Test
	void missingParameterIsBadRequest() throws Exception {
		mockMvc.perform(get("/api/pricing/breakdowns").param("stackId", "java"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value("Missing parameter: key"));
		verifyNoInteractions(pricingService);
	}
}
