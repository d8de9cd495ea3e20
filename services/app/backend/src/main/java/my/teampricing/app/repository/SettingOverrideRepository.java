package my.teampricing.app.repository;

import my.teampricing.app.domain.SettingOverride;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SettingOverrideRepository extends JpaRepository<SettingOverride, Long> {
	List<SettingOverride> findByViewId(String viewId);
}
