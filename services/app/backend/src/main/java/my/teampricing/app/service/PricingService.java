package my.teampricing.app.service;

import my.teampricing.app.config.AppProperties;
import my.teampricing.app.dto.BreakdownNodeDto;
import my.teampricing.app.dto.BreakdownResponseDto;
import my.teampricing.app.dto.DashboardSummaryDto;
import my.teampricing.app.dto.OverheadAllocationStatusDto;
import my.teampricing.app.dto.OverheadContributionDto;
import my.teampricing.app.dto.PricingResultsDto;
import my.teampricing.app.dto.SharedCostsDto;
import my.teampricing.app.dto.StackPricingDto;
import my.teampricing.app.dto.ValidationReportDto;
import my.teampricing.app.pricing.BreakdownNode;
import my.teampricing.app.pricing.CurrencyConverter;
import my.teampricing.app.pricing.EmployeeCategory;
import my.teampricing.app.pricing.OverheadAllocationStatus;
import my.teampricing.app.pricing.PricingEngine;
import my.teampricing.app.pricing.PricingReport;
import my.teampricing.app.pricing.SharedCosts;
import my.teampricing.app.pricing.StackBreakdown;
import my.teampricing.app.pricing.StackPricing;
import my.teampricing.app.pricing.TeamCostSummary;
import my.teampricing.app.pricing.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class PricingService {
	private static final Logger logger = LoggerFactory.getLogger(PricingService.class);
	private static final String DEFAULT_PRIMARY_CURRENCY = "EGP";
	private static final String DEFAULT_SECONDARY_CURRENCY = "USD";

	private final PricingSnapshotLoader snapshotLoader;
	private final PricingEngine pricingEngine;
	private final AppProperties properties;

	public PricingService(PricingSnapshotLoader snapshotLoader, PricingEngine pricingEngine, AppProperties properties) {
		this.snapshotLoader = snapshotLoader;
		this.pricingEngine = pricingEngine;
		this.properties = properties;
	}

	public PricingReport computeReport(String viewId) {
		PricingInputs inputs = snapshotLoader.load(viewId);
		PricingReport report = pricingEngine.compute(inputs.snapshot(), inputs.overrides());
		logger.debug("Computed pricing for view {}: {} employees, {} stack rows, {} active overhead types.",
				describeView(report.viewId()), inputs.snapshot().employees().size(), report.stacks().size(),
				report.validation().overheadAllocations().size());
		logWarnings(report);
		return report;
	}

	public PricingResultsDto getResults(String viewId) {
		PricingReport report = computeReport(viewId);
		Map<String, String> typeNames = overheadTypeNames(report);
		return new PricingResultsDto(
				report.viewId(),
				currency(report.converter()),
				report.settings().exchangeRatio(),
				report.settings().asMap(),
				report.stacks(EmployeeCategory.DEV).stream().map(stack -> toStackDto(stack, typeNames)).toList(),
				report.stacks(EmployeeCategory.AGENTIC_AI).stream().map(stack -> toStackDto(stack, typeNames)).toList(),
				toSharedCostsDto(report.sharedCosts()),
				toValidationDto(report.viewId(), report.validation())
		);
	}

	public BreakdownResponseDto getBreakdown(String viewId, String category, String stackId, String key) {
		EmployeeCategory parsedCategory = parseCategory(category);
		if (stackId == null || stackId.isBlank() || key == null || key.isBlank()) {
			throw new IllegalArgumentException("stackId and key are required");
		}
		PricingInputs inputs = snapshotLoader.load(viewId);
		StackBreakdown breakdown = pricingEngine.breakdown(inputs.snapshot(), inputs.overrides(), parsedCategory,
						stackId.trim(), key.trim())
				.orElseThrow(() -> new BreakdownNotFoundException(stackId, key));
		return new BreakdownResponseDto(breakdown.viewId(), parsedCategory, stackId.trim(), currency(breakdown.converter()),
				toBreakdownDto(breakdown.node()));
	}

	public ValidationReportDto getValidation(String viewId) {
		PricingReport report = computeReport(viewId);
		return toValidationDto(report.viewId(), report.validation());
	}

	public DashboardSummaryDto getDashboard(String viewId) {
		PricingReport report = computeReport(viewId);
		TeamCostSummary summary = report.summary();
		return new DashboardSummaryDto(
				summary.viewId(),
				currency(report.converter()),
				summary.activeEmployeeCount(),
				summary.headcount(),
				summary.fte(),
				summary.monthlyCost(),
				summary.totalFte(),
				summary.totalMonthlyCost(),
				summary.totalOverheadMonthly(),
				summary.overheadAllocations().stream().map(this::toAllocationDto).toList(),
				summary.inactiveEmployeeCount(),
				summary.inactiveOverheadTypeCount(),
				summary.overriddenEmployeeIds(),
				summary.overriddenOverheadTypeIds()
		);
	}

	EmployeeCategory parseCategory(String category) {
		if (category == null || category.isBlank()) {
			return EmployeeCategory.DEV;
		}
		String normalized = category.trim().toUpperCase(Locale.ROOT);
		if ("AGENTIC".equals(normalized)) {
			return EmployeeCategory.AGENTIC_AI;
		}
		EmployeeCategory parsed;
		try {
			parsed = EmployeeCategory.valueOf(normalized);
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Unknown category: " + category, ex);
		}
		if (!parsed.isStackBound()) {
			throw new IllegalArgumentException("Breakdowns exist for DEV and AGENTIC_AI only, not " + parsed);
		}
		return parsed;
	}

	private void logWarnings(PricingReport report) {
		ValidationReport validation = report.validation();
		if (!validation.hasWarnings()) {
			return;
		}
		String view = describeView(report.viewId());
		if (!validation.missingSettings().isEmpty()) {
			logger.warn("View {} is missing settings {}; defaults applied.", view, validation.missingSettings());
		}
		if (!validation.malformedSettings().isEmpty()) {
			logger.warn("View {} has malformed settings {}; read as 0.", view, validation.malformedSettings());
		}
		for (OverheadAllocationStatus status : validation.invalidOverheadAllocations()) {
			logger.warn("View {}: overhead type {} is allocated {} instead of 1.0 ({} employees without a share).",
					view, status.typeId(), status.sum(), status.missingAllocationCount());
		}
		if (!validation.employeesMissingAllocation().isEmpty()) {
			logger.warn("View {}: {} employees lack an allocation for at least one overhead type.",
					view, validation.employeesMissingAllocation().size());
		}
	}

	private StackPricingDto toStackDto(StackPricing stack, Map<String, String> typeNames) {
		List<OverheadContributionDto> overheads = new ArrayList<>();
		stack.overheadsPerRelHour().forEach((typeId, value) ->
				overheads.add(new OverheadContributionDto(typeId, typeNames.getOrDefault(typeId, typeId), value, stack.pct(value))));
		return new StackPricingDto(
				stack.stackId(),
				stack.stackName(),
				stack.category(),
				stack.status(),
				stack.employeeCount(),
				stack.totalFte(),
				stack.capacityHours(),
				stack.costPerRelHour(),
				stack.rawCostPerRelHour(),
				stack.qaAddOn(),
				stack.baAddOn(),
				stack.cogs(),
				stack.pct(stack.cogs()),
				overheads,
				stack.totalOverheads(),
				stack.pct(stack.totalOverheads()),
				stack.releaseableCost(),
				stack.finalPrice()
		);
	}

	private SharedCostsDto toSharedCostsDto(SharedCosts shared) {
		return new SharedCostsDto(
				shared.qaCostPerDevRelHour(),
				shared.baCostPerDevRelHour(),
				shared.qaRawAddOnPerRelHour(),
				shared.baRawAddOnPerRelHour(),
				shared.qaEmployeeCount(),
				shared.baEmployeeCount()
		);
	}

	private ValidationReportDto toValidationDto(String viewId, ValidationReport validation) {
		return new ValidationReportDto(
				viewId,
				validation.hasWarnings(),
				validation.missingSettings(),
				validation.malformedSettings(),
				validation.invalidOverheadAllocations().stream().map(this::toAllocationDto).toList(),
				validation.employeesMissingAllocation(),
				validation.noActiveOverheadTypes(),
				validation.stacksWithoutEmployees()
		);
	}

	private OverheadAllocationStatusDto toAllocationDto(OverheadAllocationStatus status) {
		return new OverheadAllocationStatusDto(status.typeId(), status.typeName(), status.sum(), status.valid(),
				status.missingAllocationCount());
	}

	private BreakdownNodeDto toBreakdownDto(BreakdownNode node) {
		return new BreakdownNodeDto(
				node.key(),
				node.label(),
				node.operation(),
				node.result(),
				node.formula(),
				node.monetary(),
				node.inputs().stream().map(this::toBreakdownDto).toList()
		);
	}

	private Map<String, String> overheadTypeNames(PricingReport report) {
		Map<String, String> names = new LinkedHashMap<>();
		for (OverheadAllocationStatus status : report.validation().overheadAllocations()) {
			names.put(status.typeId(), status.typeName());
		}
		return names;
	}

	private String currency(CurrencyConverter converter) {
		AppProperties.Pricing pricing = properties == null ? null : properties.pricing();
		if (converter.converting()) {
			return pricing == null || pricing.secondaryCurrency() == null ? DEFAULT_SECONDARY_CURRENCY : pricing.secondaryCurrency();
		}
		return pricing == null || pricing.primaryCurrency() == null ? DEFAULT_PRIMARY_CURRENCY : pricing.primaryCurrency();
	}

	private static String describeView(String viewId) {
		return viewId == null ? "base" : viewId;
	}
}
