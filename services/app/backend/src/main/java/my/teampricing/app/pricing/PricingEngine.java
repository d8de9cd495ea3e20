package my.teampricing.app.pricing;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the whole pricing pipeline for one snapshot and one optional view. Stateless: every call recomputes from its
 * arguments.
 */
public class PricingEngine {
	private static final List<EmployeeCategory> PRICED_CATEGORIES = List.of(EmployeeCategory.DEV, EmployeeCategory.AGENTIC_AI);

	private final EffectiveDatasetResolver resolver;
	private final PricingValidator validator;

	public PricingEngine() {
		this(new PricingValidator());
	}

	public PricingEngine(PricingValidator validator) {
		this.resolver = new EffectiveDatasetResolver();
		this.validator = validator;
	}

	public PricingReport compute(PricingSnapshot snapshot, ScenarioOverrides overrides) {
		Pipeline pipeline = prepare(snapshot, overrides);
		EffectiveDataset dataset = pipeline.dataset();
		CurrencyConverter converter = pipeline.converter();
		PricingFormulaEngine formulas = pipeline.formulas();
		CategoryStackAggregator aggregator = pipeline.aggregator();

		SharedCosts shared = formulas.sharedCosts(
				aggregator.sharedPool(dataset, EmployeeCategory.QA),
				aggregator.sharedPool(dataset, EmployeeCategory.BA));

		List<StackPricing> stacks = new ArrayList<>();
		for (EmployeeCategory category : PRICED_CATEGORIES) {
			for (TechStackRef stack : dataset.techStacks()) {
				CategoryPool pool = aggregator.stackPool(dataset, category, stack.id());
				stacks.add(formulas.price(stack, pool, shared).converted(converter));
			}
		}

		ValidationReport validation = validator.validate(dataset, pipeline.settings(), pipeline.allocations());
		TeamCostSummary summary = summarize(dataset, pipeline.allocations(), validation).converted(converter);

		return new PricingReport(dataset.viewId(), pipeline.settings(), converter, stacks, shared.converted(converter),
				validation, summary, pipeline.breakdowns());
	}

	/**
	 * Builds a single explanation tree without pricing the other stacks or validating the dataset.
	 */
	public Optional<StackBreakdown> breakdown(PricingSnapshot snapshot, ScenarioOverrides overrides,
											  EmployeeCategory category, String stackId, String key) {
		Pipeline pipeline = prepare(snapshot, overrides);
		CurrencyConverter converter = pipeline.converter();
		return pipeline.breakdowns().breakdown(category, stackId, key)
				.map(node -> new StackBreakdown(pipeline.dataset().viewId(), converter, node.convertedWith(converter)));
	}

	private Pipeline prepare(PricingSnapshot snapshot, ScenarioOverrides overrides) {
		EffectiveDataset dataset = resolver.resolve(snapshot, overrides);
		PricingSettings settings = PricingSettings.from(dataset.settings());
		AllocationAggregator allocations = new AllocationAggregator(
				new CostNormalizer(settings.annualIncrease()), dataset.activeOverheadTypes());
		return new Pipeline(dataset, settings, CurrencyConverter.from(settings), allocations,
				new CategoryStackAggregator(allocations, dataset.activeOverheadTypes()),
				new PricingFormulaEngine(settings, dataset.activeOverheadTypes()));
	}

	private TeamCostSummary summarize(EffectiveDataset dataset, AllocationAggregator allocations, ValidationReport validation) {
		Map<EmployeeCategory, Integer> headcount = new EnumMap<>(EmployeeCategory.class);
		Map<EmployeeCategory, Double> fte = new EnumMap<>(EmployeeCategory.class);
		Map<EmployeeCategory, Double> monthlyCost = new EnumMap<>(EmployeeCategory.class);
		for (EmployeeCategory category : EmployeeCategory.values()) {
			headcount.put(category, 0);
			fte.put(category, 0.0);
			monthlyCost.put(category, 0.0);
		}
		double totalFte = 0.0;
		double totalMonthly = 0.0;
		for (EffectiveEmployee employee : dataset.activeEmployees()) {
			double monthly = allocations.fullyLoadedMonthly(employee);
			headcount.merge(employee.category(), 1, Integer::sum);
			fte.merge(employee.category(), employee.employee().fte(), Double::sum);
			monthlyCost.merge(employee.category(), monthly, Double::sum);
			totalFte += employee.employee().fte();
			totalMonthly += monthly;
		}
		double totalOverheadMonthly = 0.0;
		for (PricingOverheadType type : dataset.activeOverheadTypes()) {
			totalOverheadMonthly += CostNormalizer.overheadMonthlyEquivalent(type);
		}
		return new TeamCostSummary(dataset.viewId(), headcount, fte, monthlyCost, totalFte, totalMonthly,
				totalOverheadMonthly, validation.overheadAllocations(), dataset.inactiveEmployeeCount(),
				dataset.inactiveOverheadTypeCount(), dataset.overriddenEmployeeIds(), dataset.overriddenOverheadTypeIds());
	}

	private record Pipeline(EffectiveDataset dataset,
							PricingSettings settings,
							CurrencyConverter converter,
							AllocationAggregator allocations,
							CategoryStackAggregator aggregator,
							PricingFormulaEngine formulas) {
		BreakdownBuilder breakdowns() {
			return new BreakdownBuilder(formulas, aggregator, dataset);
		}
	}
}
