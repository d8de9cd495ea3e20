package my.teampricing.app.pricing;

public record SettingRecord(String key, String value, SettingValueType valueType) {
}
