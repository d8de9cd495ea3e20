package my.teampricing.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.teampricing.app.pricing.SettingValueType;

@Entity
@Table(name = "settings")
public class Setting {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "setting_key", nullable = false, unique = true)
	private String key;

	@Column(name = "setting_value", nullable = false, columnDefinition = "TEXT")
	private String value;

	@Enumerated(EnumType.STRING)
	@Column(name = "value_type", nullable = false)
	private SettingValueType valueType;

	@Column(name = "group_name", columnDefinition = "TEXT")
	private String groupName;

	@Column(name = "unit", columnDefinition = "TEXT")
	private String unit;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public String getKey() {
		return key;
	}

	public void setKey(String key) {
		this.key = key;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = value;
	}

	public SettingValueType getValueType() {
		return valueType;
	}

	public void setValueType(SettingValueType valueType) {
		this.valueType = valueType;
	}

	public String getGroupName() {
		return groupName;
	}

	public void setGroupName(String groupName) {
		this.groupName = groupName;
	}

	public String getUnit() {
		return unit;
	}

	public void setUnit(String unit) {
		this.unit = unit;
	}
}
