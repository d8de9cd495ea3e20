package my.teampricing.app.pricing;

import java.util.List;

public enum BreakdownOperation {
	VALUE(""),
	SUM(" + "),
	PRODUCT(" * "),
	RATIO(" / ");

	private final String symbol;

	BreakdownOperation(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public Double reduce(List<Double> operands) {
		return switch (this) {
			case VALUE -> throw new IllegalStateException("VALUE nodes carry their own result");
			case SUM -> PricingMath.sum(operands);
			case PRODUCT -> PricingMath.product(operands);
			case RATIO -> {
				if (operands.size() != 2) {
					throw new IllegalArgumentException("RATIO takes exactly two operands, got " + operands.size());
				}
				yield PricingMath.ratio(operands.get(0), operands.get(1));
			}
		};
	}
}
