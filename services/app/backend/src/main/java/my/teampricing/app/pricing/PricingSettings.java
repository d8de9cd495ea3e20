package my.teampricing.app.pricing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the effective settings. Absent required keys fall back to the defaults below and are listed in
 * {@link #missingKeys()}.
 */
public record PricingSettings(double devReleasableHoursPerMonth,
							  double standardHoursPerMonth,
							  double qaRatio,
							  double baRatio,
							  double margin,
							  double risk,
							  double annualIncrease,
							  Double exchangeRatio,
							  List<String> missingKeys,
							  List<String> malformedKeys) {
	public static final String DEV_RELEASABLE_HOURS_PER_MONTH = "dev_releasable_hours_per_month";
	public static final String STANDARD_HOURS_PER_MONTH = "standard_hours_per_month";
	public static final String QA_RATIO = "qa_ratio";
	public static final String BA_RATIO = "ba_ratio";
	public static final String MARGIN = "margin";
	public static final String RISK = "risk";
	public static final String EXCHANGE_RATIO = "exchange_ratio";
	public static final String ANNUAL_INCREASE = "annual_increase";

	public static final List<String> REQUIRED_KEYS = List.of(
			DEV_RELEASABLE_HOURS_PER_MONTH,
			STANDARD_HOURS_PER_MONTH,
			QA_RATIO,
			BA_RATIO,
			MARGIN,
			RISK
	);

	private static final Map<String, Double> DEFAULTS = Map.of(
			DEV_RELEASABLE_HOURS_PER_MONTH, 100.0,
			STANDARD_HOURS_PER_MONTH, 160.0,
			QA_RATIO, 0.5,
			BA_RATIO, 0.25,
			MARGIN, 0.2,
			RISK, 0.1,
			ANNUAL_INCREASE, 0.0
	);

	public static PricingSettings from(Map<String, ParsedSetting> effective) {
		Map<String, ParsedSetting> settings = effective == null ? Map.of() : effective;
		List<String> missing = new ArrayList<>();
		for (String key : REQUIRED_KEYS) {
			if (!settings.containsKey(key)) {
				missing.add(key);
			}
		}
		List<String> malformed = settings.entrySet().stream()
				.filter(entry -> entry.getValue().malformed())
				.map(Map.Entry::getKey)
				.toList();
		ParsedSetting exchange = settings.get(EXCHANGE_RATIO);
		Double exchangeRatio = exchange != null && exchange.value() > 0 ? exchange.value() : null;
		return new PricingSettings(
				valueOrDefault(settings, DEV_RELEASABLE_HOURS_PER_MONTH),
				valueOrDefault(settings, STANDARD_HOURS_PER_MONTH),
				valueOrDefault(settings, QA_RATIO),
				valueOrDefault(settings, BA_RATIO),
				valueOrDefault(settings, MARGIN),
				valueOrDefault(settings, RISK),
				valueOrDefault(settings, ANNUAL_INCREASE),
				exchangeRatio,
				List.copyOf(missing),
				malformed
		);
	}

	public static double defaultFor(String key) {
		Double value = DEFAULTS.get(key);
		return value == null ? 0.0 : value;
	}

	public Map<String, Double> asMap() {
		Map<String, Double> values = new LinkedHashMap<>();
		values.put(DEV_RELEASABLE_HOURS_PER_MONTH, devReleasableHoursPerMonth);
		values.put(STANDARD_HOURS_PER_MONTH, standardHoursPerMonth);
		values.put(QA_RATIO, qaRatio);
		values.put(BA_RATIO, baRatio);
		values.put(MARGIN, margin);
		values.put(RISK, risk);
		values.put(ANNUAL_INCREASE, annualIncrease);
		values.put(EXCHANGE_RATIO, exchangeRatio);
		return values;
	}

	public double ratioFor(EmployeeCategory category) {
		return switch (category) {
			case QA -> qaRatio;
			case BA -> baRatio;
			default -> 1.0;
		};
	}

	private static double valueOrDefault(Map<String, ParsedSetting> settings, String key) {
		ParsedSetting setting = settings.get(key);
		return setting == null ? defaultFor(key) : setting.value();
	}
}
