package my.teampricing.app.repository;

import my.teampricing.app.domain.OverheadTypeActiveOverride;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OverheadTypeActiveOverrideRepository extends JpaRepository<OverheadTypeActiveOverride, Long> {
	List<OverheadTypeActiveOverride> findByViewId(String viewId);
}
