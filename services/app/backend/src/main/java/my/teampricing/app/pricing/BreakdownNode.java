package my.teampricing.app.pricing;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One step of a price explanation. Leaves carry a value; every other node derives its result from its inputs with
 * its operation, so a node can never disagree with its children.
 */
public record BreakdownNode(String key,
							String label,
							BreakdownOperation operation,
							Double result,
							String formula,
							boolean monetary,
							List<BreakdownNode> inputs) {
	public static BreakdownNode value(String key, String label, Double value, boolean monetary) {
		return new BreakdownNode(key, label, BreakdownOperation.VALUE, value, null, monetary, List.of());
	}

	public static BreakdownNode sum(String key, String label, List<BreakdownNode> inputs) {
		boolean monetary = inputs.stream().anyMatch(BreakdownNode::monetary);
		return derived(key, label, BreakdownOperation.SUM, monetary, inputs);
	}

	public static BreakdownNode product(String key, String label, List<BreakdownNode> inputs) {
		boolean monetary = inputs.stream().anyMatch(BreakdownNode::monetary);
		return derived(key, label, BreakdownOperation.PRODUCT, monetary, inputs);
	}

	public static BreakdownNode ratio(String key, String label, BreakdownNode numerator, BreakdownNode denominator) {
		boolean monetary = numerator.monetary() && !denominator.monetary();
		return derived(key, label, BreakdownOperation.RATIO, monetary, List.of(numerator, denominator));
	}

	private static BreakdownNode derived(String key, String label, BreakdownOperation operation, boolean monetary,
										 List<BreakdownNode> inputs) {
		List<Double> operands = inputs.stream().map(BreakdownNode::result).toList();
		String formula = inputs.isEmpty()
				? "0"
				: inputs.stream().map(BreakdownNode::label).collect(Collectors.joining(operation.symbol()));
		return new BreakdownNode(key, label, operation, operation.reduce(operands), formula, monetary, List.copyOf(inputs));
	}

	public boolean leaf() {
		return operation == BreakdownOperation.VALUE;
	}

	/**
	 * Rebuilds the tree with monetary leaves converted; derived results are recomputed from the converted inputs.
	 */
	public BreakdownNode convertedWith(CurrencyConverter converter) {
		if (!converter.converting()) {
			return this;
		}
		if (leaf()) {
			return monetary ? value(key, label, converter.money(result), true) : this;
		}
		List<BreakdownNode> converted = inputs.stream().map(input -> input.convertedWith(converter)).toList();
		return switch (operation) {
			case SUM -> sum(key, label, converted);
			case PRODUCT -> product(key, label, converted);
			case RATIO -> ratio(key, label, converted.get(0), converted.get(1));
			case VALUE -> this;
		};
	}
}
