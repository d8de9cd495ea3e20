package my.teampricing.app.pricing;

public enum SettingValueType {
	STRING,
	NUMBER,
	FLOAT,
	INTEGER,
	BOOLEAN
}
