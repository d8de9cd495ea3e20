package my.teampricing.app.pricing;

import java.util.Locale;

public enum EmployeeCategory {
	DEV,
	QA,
	BA,
	AGENTIC_AI;

	public boolean isStackBound() {
		return this == DEV || this == AGENTIC_AI;
	}

	public String keyPrefix() {
		return this == AGENTIC_AI ? "agentic" : name().toLowerCase(Locale.ROOT);
	}
}
