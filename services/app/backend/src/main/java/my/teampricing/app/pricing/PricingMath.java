package my.teampricing.app.pricing;

import java.util.Arrays;
import java.util.List;

/**
 * Null-propagating arithmetic. A null operand or a zero denominator yields null instead of NaN.
 */
public final class PricingMath {
	private PricingMath() {
	}

	public static Double sum(List<Double> values) {
		double total = 0.0;
		for (Double value : values) {
			if (value == null) {
				return null;
			}
			total += value;
		}
		return total;
	}

	public static Double sum(Double... values) {
		return sum(Arrays.asList(values));
	}

	public static Double product(List<Double> values) {
		double total = 1.0;
		for (Double value : values) {
			if (value == null) {
				return null;
			}
			total *= value;
		}
		return total;
	}

	public static Double product(Double... values) {
		return product(Arrays.asList(values));
	}

	public static Double ratio(Double numerator, Double denominator) {
		if (numerator == null || denominator == null || denominator == 0.0) {
			return null;
		}
		return numerator / denominator;
	}
}
