package my.teampricing.app.pricing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class BreakdownBuilderTest {
	private final PricingEngine engine = new PricingEngine();

	@Test
	void finalPriceMatchesEngineForEveryStack() {
		PricingSnapshot base = PricingFixtures.javaTeamWithQaAndOffice();
		PricingSnapshot snapshot = new PricingSnapshot(
				List.of(base.employees().get(0), base.employees().get(1),
						PricingFixtures.employee("agent-1", EmployeeCategory.AGENTIC_AI, "java", 5000)),
				List.of(new TechStackRef("java", "Java"), new TechStackRef("go", "Go")),
				base.overheadTypes(),
				base.allocations(),
				base.settings());

		PricingReport report = engine.compute(snapshot, ScenarioOverrides.none());

		for (StackPricing stack : report.stacks()) {
			BreakdownNode node = report.breakdown(stack.category(), stack.stackId(), BreakdownBuilder.FINAL_PRICE).orElseThrow();
			if (stack.finalPrice() == null) {
				assertThat(node.result()).isNull();
			} else {
				assertThat(node.result()).isCloseTo(stack.finalPrice(), within(1e-9));
			}
		}
	}

	@Test
	void everyDerivedNodeEqualsTheReductionOfItsInputs() {
		PricingReport report = engine.compute(PricingFixtures.javaTeamWithQaAndOffice(), ScenarioOverrides.none());

		for (String key : report.breakdownKeys(EmployeeCategory.DEV)) {
			BreakdownNode node = report.breakdown(EmployeeCategory.DEV, "java", key).orElseThrow();
			assertThat(node.key()).isEqualTo(key);
			assertReducesFromInputs(node);
		}
	}

	@Test
	void explainsCostComponentsWithFormulas() {
		PricingReport report = engine.compute(PricingFixtures.javaTeamWithQaAndOffice(), ScenarioOverrides.none());

		BreakdownNode cogs = report.breakdown(EmployeeCategory.DEV, "java", BreakdownBuilder.COGS).orElseThrow();
		assertThat(cogs.operation()).isEqualTo(BreakdownOperation.SUM);
		assertThat(cogs.inputs()).extracting(BreakdownNode::key)
				.containsExactly("dev_raw_hr", "qa_raw_addon_hr", "ba_raw_addon_hr");
		assertThat(cogs.formula()).isEqualTo("DEV raw cost per hour + QA raw cost per DEV hour + No active BA employees");
		assertThat(cogs.result()).isCloseTo(350.0, within(1e-9));

		BreakdownNode office = report.breakdown(EmployeeCategory.DEV, "java", "overhead_hr:office").orElseThrow();
		assertThat(office.inputs()).extracting(BreakdownNode::key)
				.containsExactly("dev_overhead_hr:office", "qa_overhead_addon_hr:office", "ba_overhead_addon_hr:office");
		assertThat(office.result()).isCloseTo(6.5625, within(1e-9));

		BreakdownNode capacity = report.breakdown(EmployeeCategory.DEV, "java", "dev_capacity_hours").orElseThrow();
		assertThat(capacity.monetary()).isFalse();
		assertThat(capacity.result()).isEqualTo(100.0);
	}

	@Test
	void unknownKeysAndStacksYieldNothing() {
		PricingReport report = engine.compute(PricingFixtures.javaTeamWithQaAndOffice(), ScenarioOverrides.none());

		assertThat(report.breakdown(EmployeeCategory.DEV, "java", "nonsense")).isEmpty();
		assertThat(report.breakdown(EmployeeCategory.DEV, "java", "overhead_hr:missing")).isEmpty();
		assertThat(report.breakdown(EmployeeCategory.DEV, "cobol", BreakdownBuilder.FINAL_PRICE)).isEmpty();
		assertThat(report.breakdown(EmployeeCategory.AGENTIC_AI, "java", "qa_addon_hr")).isEmpty();
		assertThat(report.breakdown(EmployeeCategory.AGENTIC_AI, "java", "dev_raw_hr")).isEmpty();
		assertThatThrownBy(() -> report.breakdown(EmployeeCategory.QA, "java", BreakdownBuilder.FINAL_PRICE))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void convertedBreakdownDividesOnlyMoney() {
		PricingSnapshot base = PricingFixtures.javaTeamWithQaAndOffice();
		PricingSnapshot snapshot = new PricingSnapshot(base.employees(), base.techStacks(), base.overheadTypes(),
				base.allocations(), PricingFixtures.settingsWith(
				PricingFixtures.setting(PricingSettings.QA_RATIO, "0.5"),
				PricingFixtures.setting(PricingSettings.EXCHANGE_RATIO, "50")));

		PricingReport report = engine.compute(snapshot, ScenarioOverrides.none());
		BreakdownNode qaAddOn = report.breakdown(EmployeeCategory.DEV, "java", "qa_addon_hr").orElseThrow();

		assertThat(qaAddOn.result()).isCloseTo(51.5625 / 50, within(1e-9));
		BreakdownNode ratio = qaAddOn.inputs().get(0);
		assertThat(ratio.key()).isEqualTo(PricingSettings.QA_RATIO);
		assertThat(ratio.result()).isEqualTo(0.5);
		assertReducesFromInputs(qaAddOn);

		BreakdownNode finalPrice = report.breakdown(EmployeeCategory.DEV, "java", BreakdownBuilder.FINAL_PRICE).orElseThrow();
		assertThat(finalPrice.result())
				.isCloseTo(report.stack(EmployeeCategory.DEV, "java").orElseThrow().finalPrice(), within(1e-9));
	}

	@Test
	void buildsOnlyTheRequestedSubtree() {
		PricingSnapshot snapshot = PricingFixtures.javaTeamWithQaAndOffice();
		EffectiveDataset dataset = new EffectiveDatasetResolver().resolve(snapshot, ScenarioOverrides.none());
		PricingSettings settings = PricingSettings.from(dataset.settings());
		AllocationAggregator allocations = new AllocationAggregator(new CostNormalizer(), dataset.activeOverheadTypes());
		CategoryStackAggregator aggregator = spy(new CategoryStackAggregator(allocations, dataset.activeOverheadTypes()));
		BreakdownBuilder builder = new BreakdownBuilder(
				new PricingFormulaEngine(settings, dataset.activeOverheadTypes()), aggregator, dataset);

		BreakdownNode margin = builder.breakdown(EmployeeCategory.DEV, "java", BreakdownBuilder.MARGIN_MULTIPLIER).orElseThrow();
		assertThat(margin.result()).isCloseTo(1.2, within(1e-12));
		verify(aggregator, never()).stackPool(any(), any(), any());
		verify(aggregator, never()).sharedPool(any(), any());

		builder.breakdown(EmployeeCategory.DEV, "java", "dev_raw_hr").orElseThrow();
		verify(aggregator, never()).sharedPool(any(), any());
	}

	private void assertReducesFromInputs(BreakdownNode node) {
		if (node.leaf()) {
			assertThat(node.inputs()).isEmpty();
			return;
		}
		List<Double> operands = node.inputs().stream().map(BreakdownNode::result).toList();
		assertThat(node.result()).isEqualTo(node.operation().reduce(operands));
		node.inputs().forEach(this::assertReducesFromInputs);
	}
}
