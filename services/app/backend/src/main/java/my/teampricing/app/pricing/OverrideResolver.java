package my.teampricing.app.pricing;

/**
 * Merges a base value with an optional view override. Every override channel goes through {@link #resolve}.
 */
public final class OverrideResolver {
	private OverrideResolver() {
	}

	public static <T> T resolve(T base, T override) {
		return override != null ? override : base;
	}

	public static EffectiveActive resolveActive(boolean baseActive, Boolean override) {
		boolean effective = resolve(baseActive, override);
		return new EffectiveActive(effective, override != null && effective != baseActive);
	}

	public static double resolveShare(Double baseShare, Double override) {
		Double effective = resolve(baseShare, override);
		return effective == null ? 0.0 : effective;
	}

	public static ParsedSetting resolveSetting(String baseValue, String overrideValue, SettingValueType valueType) {
		return SettingValueParser.parse(resolve(baseValue, overrideValue), valueType);
	}
}
