package my.teampricing.app.pricing;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns stored setting strings into numbers. Total: bad input becomes zero and is flagged, never thrown.
 */
public final class SettingValueParser {
	private static final Pattern DECIMAL_PREFIX = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
	private static final Pattern INTEGER_PREFIX = Pattern.compile("[+-]?\\d+");

	private SettingValueParser() {
	}

	public static ParsedSetting parse(String value, SettingValueType valueType) {
		SettingValueType type = valueType == null ? SettingValueType.STRING : valueType;
		String trimmed = value == null ? "" : value.trim();
		return switch (type) {
			case FLOAT, NUMBER -> parseDecimal(trimmed);
			case INTEGER -> parseInteger(trimmed);
			case BOOLEAN -> parseBoolean(trimmed);
			case STRING -> {
				ParsedSetting parsed = parseDecimal(trimmed);
				yield parsed.malformed() ? ParsedSetting.of(0.0) : parsed;
			}
		};
	}

	private static ParsedSetting parseDecimal(String value) {
		return parsePrefix(DECIMAL_PREFIX, value);
	}

	private static ParsedSetting parseInteger(String value) {
		return parsePrefix(INTEGER_PREFIX, value);
	}

	// Only the leading numeric part counts: "12abc" reads as 12, "1e3" as an integer reads as 1.
	private static ParsedSetting parsePrefix(Pattern pattern, String value) {
		Matcher matcher = pattern.matcher(value);
		if (!matcher.lookingAt()) {
			return ParsedSetting.malformedZero();
		}
		double parsed = Double.parseDouble(matcher.group());
		if (!Double.isFinite(parsed)) {
			return ParsedSetting.malformedZero();
		}
		return ParsedSetting.of(parsed);
	}

	private static ParsedSetting parseBoolean(String value) {
		if ("true".equals(value)) {
			return ParsedSetting.of(1.0);
		}
		return new ParsedSetting(0.0, !"false".equals(value));
	}
}
