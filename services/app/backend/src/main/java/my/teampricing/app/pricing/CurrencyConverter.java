package my.teampricing.app.pricing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final display transform: money values are divided by the exchange ratio when one is configured.
 */
public record CurrencyConverter(Double exchangeRatio) {
	public static CurrencyConverter from(PricingSettings settings) {
		return new CurrencyConverter(settings.exchangeRatio());
	}

	public static CurrencyConverter identity() {
		return new CurrencyConverter(null);
	}

	public boolean converting() {
		return exchangeRatio != null && exchangeRatio > 0;
	}

	public Double money(Double amount) {
		if (amount == null || !converting()) {
			return amount;
		}
		return amount / exchangeRatio;
	}

	public Map<String, Double> money(Map<String, Double> amounts) {
		Map<String, Double> converted = new LinkedHashMap<>();
		amounts.forEach((key, value) -> converted.put(key, money(value)));
		return Collections.unmodifiableMap(converted);
	}
}
