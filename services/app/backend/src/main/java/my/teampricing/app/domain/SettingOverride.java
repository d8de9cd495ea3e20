package my.teampricing.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import my.teampricing.app.pricing.SettingValueType;

@Entity
@Table(name = "setting_overrides", uniqueConstraints = @UniqueConstraint(columnNames = {"view_id", "setting_key"}))
public class SettingOverride {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "view_id", nullable = false)
	private String viewId;

	@Column(name = "setting_key", nullable = false)
	private String key;

	@Column(name = "setting_value", nullable = false, columnDefinition = "TEXT")
	private String value;

	@Enumerated(EnumType.STRING)
	@Column(name = "value_type", nullable = false)
	private SettingValueType valueType;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public String getViewId() {
		return viewId;
	}

	public void setViewId(String viewId) {
		this.viewId = viewId;
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
}
