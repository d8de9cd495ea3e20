package my.teampricing.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;

@Entity
@Table(name = "overhead_allocations", uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "overhead_type_id"}))
public class OverheadAllocation {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "employee_id", nullable = false)
	private String employeeId;

	@Column(name = "overhead_type_id", nullable = false)
	private String overheadTypeId;

	@Column(name = "share", nullable = false)
	private BigDecimal share;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public String getEmployeeId() {
		return employeeId;
	}

	public void setEmployeeId(String employeeId) {
		this.employeeId = employeeId;
	}

	public String getOverheadTypeId() {
		return overheadTypeId;
	}

	public void setOverheadTypeId(String overheadTypeId) {
		this.overheadTypeId = overheadTypeId;
	}

	public BigDecimal getShare() {
		return share;
	}

	public void setShare(BigDecimal share) {
		this.share = share;
	}
}
