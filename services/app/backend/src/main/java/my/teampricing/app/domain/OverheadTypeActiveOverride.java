package my.teampricing.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(name = "overhead_type_active_overrides", uniqueConstraints = @UniqueConstraint(columnNames = {"view_id", "overhead_type_id"}))
public class OverheadTypeActiveOverride {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "view_id", nullable = false)
	private String viewId;

	@Column(name = "overhead_type_id", nullable = false)
	private String overheadTypeId;

	@Column(name = "is_active", nullable = false)
	private boolean active;

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

	public String getOverheadTypeId() {
		return overheadTypeId;
	}

	public void setOverheadTypeId(String overheadTypeId) {
		this.overheadTypeId = overheadTypeId;
	}

	public boolean isActive() {
		return active;
	}

	public void setActive(boolean active) {
		this.active = active;
	}
}
