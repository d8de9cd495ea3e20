package my.teampricing.app.service;

import my.teampricing.app.config.AppProperties;
import my.teampricing.app.dto.BreakdownResponseDto;
import my.teampricing.app.dto.DashboardSummaryDto;
import my.teampricing.app.dto.PricingResultsDto;
import my.teampricing.app.dto.StackPricingDto;
import my.teampricing.app.dto.ValidationReportDto;
import my.teampricing.app.pricing.AllocationRow;
import my.teampricing.app.pricing.BreakdownOperation;
import my.teampricing.app.pricing.EmployeeCategory;
import my.teampricing.app.pricing.OverheadPeriod;
import my.teampricing.app.pricing.PricingEmployee;
import my.teampricing.app.pricing.PricingEngine;
import my.teampricing.app.pricing.PricingOverheadType;
import my.teampricing.app.pricing.PricingSnapshot;
import my.teampricing.app.pricing.PricingStatus;
import my.teampricing.app.pricing.ScenarioOverrides;
import my.teampricing.app.pricing.SettingRecord;
import my.teampricing.app.pricing.SettingValueType;
import my.teampricing.app.pricing.TechStackRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PricingServiceTest {
	@Mock
	private PricingSnapshotLoader snapshotLoader;

	private PricingService service;

	@BeforeEach
	void setUp() {
		AppProperties properties = new AppProperties(new AppProperties.Pricing(0.005, "EGP", "USD"));
		service = new PricingService(snapshotLoader, new PricingEngine(), properties);
	}

	@Test
	void resultsSplitDevAndAgenticStacks() {
		when(snapshotLoader.load(null)).thenReturn(new PricingInputs(snapshot(List.of()), ScenarioOverrides.none()));

		PricingResultsDto results = service.getResults(null);

		assertThat(results.currency()).isEqualTo("EGP");
		assertThat(results.devStacks()).extracting(StackPricingDto::stackId).containsExactly("java", "go");
		assertThat(results.agenticStacks()).extracting(StackPricingDto::status)
				.containsExactly(PricingStatus.NO_EMPLOYEES, PricingStatus.NO_EMPLOYEES);
		StackPricingDto java = results.devStacks().get(0);
		assertThat(java.status()).isEqualTo(PricingStatus.PRICED);
		assertThat(java.finalPrice()).isCloseTo(470.6625, within(1e-9));
		assertThat(java.overheads()).singleElement().satisfies(overhead -> {
			assertThat(overhead.typeName()).isEqualTo("Office");
			assertThat(overhead.perRelHour()).isCloseTo(6.5625, within(1e-9));
			assertThat(overhead.pct()).isCloseTo(6.5625 / 356.5625, within(1e-12));
		});
		assertThat(java.cogsPct()).isCloseTo(350.0 / 356.5625, within(1e-12));
		assertThat(results.devStacks().get(1).finalPrice()).isNull();
		assertThat(results.sharedCosts().qaEmployeeCount()).isEqualTo(1);
		assertThat(results.validation().stacksWithoutEmployees()).containsExactly("go");
	}

	@Test
	void exchangeRatioSwitchesCurrencyLabel() {
		when(snapshotLoader.load("usd")).thenReturn(new PricingInputs(snapshot(List.of()), new ScenarioOverrides("usd", null, null,
				Map.of("exchange_ratio", new SettingRecord("exchange_ratio", "50", SettingValueType.FLOAT)), null)));

		PricingResultsDto results = service.getResults("usd");

		assertThat(results.viewId()).isEqualTo("usd");
		assertThat(results.currency()).isEqualTo("USD");
		assertThat(results.exchangeRatio()).isEqualTo(50.0);
		assertThat(results.devStacks().get(0).finalPrice()).isCloseTo(470.6625 / 50, within(1e-9));
	}

	@Test
	void breakdownIsReturnedAsTree() {
		when(snapshotLoader.load(null)).thenReturn(new PricingInputs(snapshot(List.of()), ScenarioOverrides.none()));

		BreakdownResponseDto response = service.getBreakdown(null, "dev", "java", "final_price_hr");

		assertThat(response.category()).isEqualTo(EmployeeCategory.DEV);
		assertThat(response.breakdown().operation()).isEqualTo(BreakdownOperation.PRODUCT);
		assertThat(response.breakdown().result()).isCloseTo(470.6625, within(1e-9));
		assertThat(response.breakdown().inputs()).hasSize(3);
	}

	@Test
	void breakdownBuildsOnlyTheRequestedTree() {
		PricingEngine engine = spy(new PricingEngine());
		PricingService breakdownService = new PricingService(snapshotLoader, engine,
				new AppProperties(new AppProperties.Pricing(0.005, "EGP", "USD")));
		when(snapshotLoader.load(null)).thenReturn(new PricingInputs(snapshot(List.of()), ScenarioOverrides.none()));

		BreakdownResponseDto response = breakdownService.getBreakdown(null, "DEV", " java ", "cogs_hr");

		assertThat(response.stackId()).isEqualTo("java");
		assertThat(response.currency()).isEqualTo("EGP");
		assertThat(response.breakdown().result()).isCloseTo(350.0, within(1e-9));
		verify(engine, never()).compute(any(), any());
		verify(snapshotLoader).load(null);
		verifyNoMoreInteractions(snapshotLoader);
	}

	@Test
	void reportReadsViewAndBaseDataInOneLoad() {
		ScenarioOverrides lean = new ScenarioOverrides("lean", Map.of("qa-1", false), null, null, null);
		when(snapshotLoader.load("lean")).thenReturn(new PricingInputs(snapshot(List.of()), lean));

		DashboardSummaryDto dashboard = service.getDashboard("lean");

		assertThat(dashboard.viewId()).isEqualTo("lean");
		assertThat(dashboard.overriddenEmployeeIds()).containsExactly("qa-1");
		verify(snapshotLoader).load("lean");
		verifyNoMoreInteractions(snapshotLoader);
	}

	@Test
	void unknownBreakdownKeyIsNotFound() {
		when(snapshotLoader.load(null)).thenReturn(new PricingInputs(snapshot(List.of()), ScenarioOverrides.none()));

		assertThatThrownBy(() -> service.getBreakdown(null, "DEV", "java", "nope"))
				.isInstanceOf(BreakdownNotFoundException.class);
	}

	@Test
	void breakdownRejectsPooledCategoriesBeforeLoading() {
		assertThatThrownBy(() -> service.getBreakdown(null, "QA", "java", "final_price_hr"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service.getBreakdown(null, "ops", "java", "final_price_hr"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service.getBreakdown(null, "DEV", "java", " "))
				.isInstanceOf(IllegalArgumentException.class);
		verifyNoInteractions(snapshotLoader);
	}

	@Test
	void parsesCategoryAliases() {
		assertThat(service.parseCategory(null)).isEqualTo(EmployeeCategory.DEV);
		assertThat(service.parseCategory("agentic")).isEqualTo(EmployeeCategory.AGENTIC_AI);
		assertThat(service.parseCategory("agentic_ai")).isEqualTo(EmployeeCategory.AGENTIC_AI);
	}

	@Test
	void unknownViewPropagates() {
		when(snapshotLoader.load("ghost")).thenThrow(new PricingViewNotFoundException("ghost"));

		assertThatThrownBy(() -> service.getValidation("ghost")).isInstanceOf(PricingViewNotFoundException.class);
	}

	@Test
	void validationAndDashboardReflectAllocationGaps() {
		List<AllocationRow> partial = List.of(new AllocationRow("dev-1", "office", 0.5));
		when(snapshotLoader.load(null)).thenReturn(new PricingInputs(snapshot(partial), ScenarioOverrides.none()));

		ValidationReportDto validation = service.getValidation(null);
		DashboardSummaryDto dashboard = service.getDashboard(null);

		assertThat(validation.hasWarnings()).isTrue();
		assertThat(validation.invalidOverheadAllocations()).singleElement()
				.satisfies(status -> assertThat(status.sum()).isEqualTo(0.5));
		assertThat(validation.employeesMissingAllocation()).containsExactly("qa-1");
		assertThat(dashboard.activeEmployeeCount()).isEqualTo(2);
		assertThat(dashboard.headcount()).containsEntry(EmployeeCategory.QA, 1);
		assertThat(dashboard.totalOverheadMonthly()).isEqualTo(1000.0);
		assertThat(dashboard.totalMonthlyCost()).isEqualTo(30500.0 + 16000.0);
	}

	private PricingSnapshot snapshot(List<AllocationRow> allocations) {
		List<AllocationRow> rows = allocations.isEmpty()
				? List.of(new AllocationRow("dev-1", "office", 0.5), new AllocationRow("qa-1", "office", 0.5))
				: allocations;
		List<SettingRecord> settings = new ArrayList<>();
		settings.add(new SettingRecord("dev_releasable_hours_per_month", "100", SettingValueType.NUMBER));
		settings.add(new SettingRecord("standard_hours_per_month", "160", SettingValueType.NUMBER));
		settings.add(new SettingRecord("qa_ratio", "0.5", SettingValueType.FLOAT));
		settings.add(new SettingRecord("ba_ratio", "0", SettingValueType.FLOAT));
		settings.add(new SettingRecord("margin", "0.2", SettingValueType.FLOAT));
		settings.add(new SettingRecord("risk", "0.1", SettingValueType.FLOAT));
		return new PricingSnapshot(
				List.of(
						new PricingEmployee("dev-1", "Dana", EmployeeCategory.DEV, "java", true, 30000, 25000, null, null, null, 1.0),
						new PricingEmployee("qa-1", "Quinn", EmployeeCategory.QA, null, true, 16000, 13000, null, null, null, 1.0)),
				List.of(new TechStackRef("java", "Java"), new TechStackRef("go", "Go")),
				List.of(new PricingOverheadType("office", "Office", true, 12000, OverheadPeriod.ANNUAL)),
				rows,
				settings);
	}
}
