package my.teampricing.app.repository;

import my.teampricing.app.domain.EmployeeActiveOverride;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EmployeeActiveOverrideRepository extends JpaRepository<EmployeeActiveOverride, Long> {
	List<EmployeeActiveOverride> findByViewId(String viewId);
}
