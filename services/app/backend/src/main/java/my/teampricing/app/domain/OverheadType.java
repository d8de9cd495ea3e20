package my.teampricing.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.teampricing.app.pricing.OverheadPeriod;

import java.math.BigDecimal;

@Entity
@Table(name = "overhead_types")
public class OverheadType {
	@Id
	@Column(name = "id")
	private String id;

	@Column(name = "name", nullable = false, columnDefinition = "TEXT")
	private String name;

	@Column(name = "amount", nullable = false)
	private BigDecimal amount;

	@Enumerated(EnumType.STRING)
	@Column(name = "period", nullable = false)
	private OverheadPeriod period;

	@Column(name = "is_active", nullable = false)
	private boolean active;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public BigDecimal getAmount() {
		return amount;
	}

	public void setAmount(BigDecimal amount) {
		this.amount = amount;
	}

	public OverheadPeriod getPeriod() {
		return period;
	}

	public void setPeriod(OverheadPeriod period) {
		this.period = period;
	}

	public boolean isActive() {
		return active;
	}

	public void setActive(boolean active) {
		this.active = active;
	}
}
